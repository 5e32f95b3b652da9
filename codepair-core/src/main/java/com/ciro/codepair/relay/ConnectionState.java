package com.ciro.codepair.relay;

public enum ConnectionState {
    /** Upgrade hecho, registro aún no aceptado por el hub. */
    CONNECTING,
    REGISTERED,
    /** Ambos pumps corriendo; el único estado con tráfico. */
    ACTIVE,
    UNREGISTERING,
    /** Terminal. */
    CLOSED
}
