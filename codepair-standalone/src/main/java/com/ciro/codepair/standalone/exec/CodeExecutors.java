package com.ciro.codepair.standalone.exec;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** Lenguaje (o alias) → ejecutor. */
public final class CodeExecutors {

    private final Map<String, CodeExecutor> byName = new HashMap<>();

    public CodeExecutors register(CodeExecutor executor, String... aliases) {
        byName.put(executor.language(), executor);
        for (String a : aliases) byName.put(a, executor);
        return this;
    }

    public Optional<CodeExecutor> forLanguage(String language) {
        return Optional.ofNullable(byName.get(language));
    }
}
