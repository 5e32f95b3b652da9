package com.ciro.codepair.spi;

import java.io.IOException;

/**
 * Transporte dúplex de frames de texto que consume el relay.
 * <p>
 * El relay garantiza que {@link #read()} sólo lo llama el pump de entrada y que
 * {@link #write(String)} y {@link #close()} sólo los llama el pump de salida.
 * {@link #abort()} puede llamarse desde cualquier hilo.
 */
public interface RelayTransport {

    /** Identificador para logs (dirección remota, id de canal...). */
    String id();

    /**
     * Bloquea hasta el siguiente frame.
     *
     * @return el texto del frame, o {@code null} cuando el extremo remoto cerró
     * @throws IOException si el transporte falla
     */
    String read() throws IOException;

    /** Escritura bloqueante de un frame completo. */
    void write(String text) throws IOException;

    boolean isOpen();

    /** Cierre ordenado (envía el frame de cierre si el protocolo lo tiene). */
    void close();

    /** Desconexión forzada; desbloquea cualquier read/write en curso. */
    void abort();
}
