package com.ciro.codepair.standalone.exec;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/** node main.js; devuelve stdout y stderr combinados. */
public class NodeExecutor extends ToolchainExecutor {

    private final String nodeBinary;

    public NodeExecutor(String nodeBinary, Duration timeout) {
        super(timeout);
        this.nodeBinary = nodeBinary;
    }

    @Override
    public String language() {
        return "javascript";
    }

    @Override
    protected String sourceFile() {
        return "main.js";
    }

    @Override
    protected List<String> command() {
        return List.of(nodeBinary, "main.js");
    }

    @Override
    protected ExecutionResult onSuccess(Path workDir, byte[] output) {
        return new ExecutionResult(output, ExecutionResult.TEXT);
    }
}
