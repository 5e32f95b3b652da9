package com.ciro.codepair.standalone.exec;

public record ExecutionResult(byte[] payload, String contentType) {
    public static final String WASM = "application/wasm";
    public static final String TEXT = "text/plain";
}
