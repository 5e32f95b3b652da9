package com.ciro.codepair.standalone.exec;

/** El código del usuario no compila, falla o se pasa de tiempo. El mensaje es la salida de la toolchain. */
public class CompileException extends Exception {

    public CompileException(String diagnostics) {
        super(diagnostics);
    }

    public String diagnostics() {
        return getMessage();
    }
}
