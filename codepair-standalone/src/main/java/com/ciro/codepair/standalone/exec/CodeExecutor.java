package com.ciro.codepair.standalone.exec;

import java.io.IOException;

/**
 * Compila o ejecuta un programa de un solo fichero.
 */
public interface CodeExecutor {

    /** Nombre canónico del lenguaje ("go", "javascript"). */
    String language();

    /**
     * @throws CompileException si la toolchain rechaza el código, el programa sale con error
     *                          o supera el tiempo máximo
     * @throws IOException      fallo de infraestructura (directorio temporal, binario ausente)
     */
    ExecutionResult execute(String code) throws CompileException, IOException, InterruptedException;
}
