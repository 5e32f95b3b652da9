package com.ciro.codepair.standalone;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Ids de sesión: 8 caracteres hex en minúscula a partir de 4 bytes aleatorios.
 * No se comprueba colisión con sesiones existentes.
 */
public final class SessionIds {
    private static final SecureRandom RNG = new SecureRandom();

    private SessionIds() {}

    public static String newId() {
        byte[] b = new byte[4];
        RNG.nextBytes(b);
        return HexFormat.of().formatHex(b);
    }
}
