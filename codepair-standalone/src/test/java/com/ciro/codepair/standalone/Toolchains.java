package com.ciro.codepair.standalone;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/** ¿Está el binario en el PATH? Para saltar tests con Assumptions. */
final class Toolchains {
    private Toolchains() {}

    static boolean available(String... command) {
        try {
            Process p = new ProcessBuilder(command).redirectErrorStream(true).start();
            p.getInputStream().transferTo(java.io.OutputStream.nullOutputStream());
            return p.waitFor(30, TimeUnit.SECONDS) && p.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static boolean node() {
        return available("node", "--version");
    }

    static boolean go() {
        return available("go", "version");
    }
}
