package com.ciro.codepair.standalone;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.GeneralCodingRules.NO_CLASSES_SHOULD_ACCESS_STANDARD_STREAMS;
import static com.tngtech.archunit.library.GeneralCodingRules.NO_CLASSES_SHOULD_USE_JAVA_UTIL_LOGGING;

@AnalyzeClasses(packages = "com.ciro.codepair", importOptions = ImportOption.DoNotIncludeTests.class)
public class CodePairRulesTest {

    // 1. El relay no conoce el servidor HTTP
    @ArchTest
    static final ArchRule relay_is_transport_agnostic = noClasses()
            .that().resideInAnyPackage("com.ciro.codepair.relay..", "com.ciro.codepair.spi..")
            .should().dependOnClassesThat().resideInAnyPackage("io.undertow..", "org.xnio..", "com.fasterxml.jackson..")
            .because("El hub sólo ve RelayTransport.");

    // 2. Ni el relay ni el SPI dependen del módulo standalone
    @ArchTest
    static final ArchRule core_does_not_depend_on_standalone = noClasses()
            .that().resideInAnyPackage("com.ciro.codepair.relay..", "com.ciro.codepair.spi..")
            .should().dependOnClassesThat().resideInAPackage("com.ciro.codepair.standalone..");

    // 3. Los ejecutores no tocan HTTP
    @ArchTest
    static final ArchRule executors_know_nothing_about_http = noClasses()
            .that().resideInAPackage("com.ciro.codepair.standalone.exec..")
            .should().dependOnClassesThat().resideInAPackage("io.undertow..");

    // 4. Logging por SLF4J
    @ArchTest
    static final ArchRule no_standard_streams = NO_CLASSES_SHOULD_ACCESS_STANDARD_STREAMS;

    @ArchTest
    static final ArchRule no_jul = NO_CLASSES_SHOULD_USE_JAVA_UTIL_LOGGING;
}
