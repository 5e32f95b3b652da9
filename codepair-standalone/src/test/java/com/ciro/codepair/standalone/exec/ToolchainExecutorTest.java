package com.ciro.codepair.standalone.exec;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ToolchainExecutorTest {

    private static List<Path> workDirs() throws IOException {
        Path tmp = Paths.get(System.getProperty("java.io.tmpdir"));
        try (Stream<Path> s = Files.list(tmp)) {
            return s.filter(p -> p.getFileName().toString().startsWith("codepair-javascript-"))
                    .collect(Collectors.toList());
        }
    }

    private static boolean nodeAvailable() {
        try {
            Process p = new ProcessBuilder("node", "--version").start();
            return p.waitFor(30, TimeUnit.SECONDS) && p.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Test
    void missingBinaryIsAnInfrastructureFailure() throws Exception {
        List<Path> before = workDirs();
        NodeExecutor executor = new NodeExecutor("codepair-no-such-binary", Duration.ofSeconds(5));

        assertThatThrownBy(() -> executor.execute("console.log(1)"))
                .isInstanceOf(IOException.class);
        assertThat(workDirs()).containsExactlyInAnyOrderElementsOf(before);
    }

    @Test
    void runawayProgramIsKilledAtTimeout() throws Exception {
        assumeTrue(nodeAvailable(), "node not on PATH");
        NodeExecutor executor = new NodeExecutor("node", Duration.ofSeconds(1));

        long started = System.nanoTime();
        assertThatThrownBy(() -> executor.execute("while (true) {}"))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("timed out");
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    void nodeOutputIsReturnedAsPlainText() throws Exception {
        assumeTrue(nodeAvailable(), "node not on PATH");
        NodeExecutor executor = new NodeExecutor("node", Duration.ofSeconds(30));

        ExecutionResult result = executor.execute("console.log('a'); console.error('b');");

        assertThat(result.contentType()).isEqualTo("text/plain");
        assertThat(new String(result.payload())).contains("a\n").contains("b\n");
    }

    @Test
    void languagesResolveThroughAliases() {
        NodeExecutor node = new NodeExecutor("node", Duration.ofSeconds(1));
        GoWasmExecutor go = new GoWasmExecutor("go", Duration.ofSeconds(1));
        CodeExecutors executors = new CodeExecutors().register(go).register(node, "js");

        assertThat(executors.forLanguage("go")).containsSame(go);
        assertThat(executors.forLanguage("javascript")).containsSame(node);
        assertThat(executors.forLanguage("js")).containsSame(node);
        assertThat(executors.forLanguage("python")).isEmpty();
    }

    @Test
    void emptyLanguageDefaultsToGo() {
        assertThat(new CompileRequest("x", null).languageOrDefault()).isEqualTo("go");
        assertThat(new CompileRequest("x", "").languageOrDefault()).isEqualTo("go");
        assertThat(new CompileRequest("x", "JavaScript").languageOrDefault()).isEqualTo("javascript");
    }
}
