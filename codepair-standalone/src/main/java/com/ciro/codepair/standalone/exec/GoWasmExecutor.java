package com.ciro.codepair.standalone.exec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/** go build a WebAssembly; devuelve el .wasm. */
public class GoWasmExecutor extends ToolchainExecutor {

    private final String goBinary;

    public GoWasmExecutor(String goBinary, Duration timeout) {
        super(timeout);
        this.goBinary = goBinary;
    }

    @Override
    public String language() {
        return "go";
    }

    @Override
    protected String sourceFile() {
        return "main.go";
    }

    @Override
    protected List<String> command() {
        return List.of(goBinary, "build", "-o", "main.wasm", "main.go");
    }

    @Override
    protected Map<String, String> environment() {
        return Map.of("GOOS", "js", "GOARCH", "wasm");
    }

    @Override
    protected ExecutionResult onSuccess(Path workDir, byte[] output) throws IOException {
        return new ExecutionResult(Files.readAllBytes(workDir.resolve("main.wasm")), ExecutionResult.WASM);
    }
}
