package com.ciro.codepair.standalone.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Base para ejecutores que lanzan un proceso externo en un directorio temporal propio.
 * El directorio se borra siempre al terminar.
 */
abstract class ToolchainExecutor implements CodeExecutor {

    private static final Logger log = LoggerFactory.getLogger(ToolchainExecutor.class);

    private final Duration timeout;

    protected ToolchainExecutor(Duration timeout) {
        this.timeout = timeout;
    }

    /** Nombre del fichero fuente dentro del directorio de trabajo. */
    protected abstract String sourceFile();

    protected abstract List<String> command();

    protected Map<String, String> environment() {
        return Map.of();
    }

    /** Construye el resultado a partir de un proceso que salió con 0. */
    protected abstract ExecutionResult onSuccess(Path workDir, byte[] output) throws IOException;

    @Override
    public ExecutionResult execute(String code) throws CompileException, IOException, InterruptedException {
        Path workDir = Files.createTempDirectory("codepair-" + language() + "-");
        try {
            Files.writeString(workDir.resolve(sourceFile()), code, StandardCharsets.UTF_8);
            Path out = workDir.resolve(".output");

            ProcessBuilder pb = new ProcessBuilder(command())
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(out.toFile());
            pb.environment().putAll(environment());

            Process process = pb.start();
            boolean finished;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                throw new CompileException(language() + " execution timed out after " + timeout.toSeconds() + "s");
            }

            byte[] output = Files.readAllBytes(out);
            if (process.exitValue() != 0) {
                throw new CompileException(new String(output, StandardCharsets.UTF_8));
            }
            return onSuccess(workDir, output);
        } finally {
            deleteRecursively(workDir);
        }
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.warn("Cannot delete {}: {}", p, e.toString());
                }
            });
        } catch (IOException e) {
            log.warn("Cannot clean up {}: {}", dir, e.toString());
        }
    }
}
