package com.ciro.codepair.standalone.exec;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/** Body de POST /compile. {@code language} vacío o ausente equivale a "go". */
public record CompileRequest(
        @NotNull(message = "code is required") String code,
        @Size(max = 32, message = "language name too long") String language) {

    public String languageOrDefault() {
        return (language == null || language.isBlank()) ? "go" : language.trim().toLowerCase();
    }
}
