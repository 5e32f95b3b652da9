package com.ciro.codepair.standalone;

import com.ciro.codepair.spi.RelayTransport;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xnio.IoUtils;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Adapta un {@link WebSocketChannel} de Undertow al modelo bloqueante de
 * {@link RelayTransport}.
 * <p>
 * Undertow entrega los frames en el hilo de IO; aquí se encolan y el pump de entrada
 * los consume con {@link #read()}. Con {@code highWater} frames pendientes se suspende
 * la lectura del socket y se reanuda al bajar a la mitad.
 */
public class UndertowRelayTransport implements RelayTransport {

    private static final Logger log = LoggerFactory.getLogger(UndertowRelayTransport.class);

    // Marca de fin de stream; se compara por identidad
    private static final String EOF = new String("<eof>");

    private final WebSocketChannel channel;
    private final String id;
    private final int highWater;
    private final long maxTextBytes;

    private final BlockingQueue<String> inbox = new LinkedBlockingQueue<>();
    private volatile IOException failure;

    // Un único lock para el flag, el tamaño del inbox y la decisión de suspender/reanudar
    private final Object flow = new Object();
    private boolean suspended; // guardado por flow

    public UndertowRelayTransport(WebSocketChannel channel, String sessionId, int highWater, long maxTextBytes) {
        this.channel = channel;
        this.id = sessionId + "@" + channel.getSourceAddress();
        this.highWater = highWater;
        this.maxTextBytes = maxTextBytes;
    }

    /** Instala los listeners y empieza a recibir. Llamar una sola vez. */
    public void listen() {
        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                // hilo de IO del canal
                synchronized (flow) {
                    inbox.add(message.getData());
                    if (!suspended && inbox.size() >= highWater) {
                        suspended = true;
                        ch.suspendReceives();
                        log.debug("{} inbound buffer at {}, suspending receives", id, highWater);
                    }
                }
            }

            @Override
            protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                inbox.add(EOF);
            }

            @Override
            protected void onError(WebSocketChannel ch, Throwable error) {
                failure = (error instanceof IOException io) ? io : new IOException(error);
                inbox.add(EOF);
                super.onError(ch, error);
            }

            @Override
            protected long getMaxTextBufferSize() {
                return maxTextBytes;
            }
        });
        channel.getCloseSetter().set(ch -> inbox.add(EOF));
        channel.resumeReceives();
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String read() throws IOException {
        String frame;
        try {
            frame = inbox.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("read interrupted");
        }
        if (frame == EOF) {
            inbox.add(EOF);
            IOException f = failure;
            if (f != null) throw f;
            return null;
        }
        boolean resume = false;
        synchronized (flow) {
            if (suspended && inbox.size() <= highWater / 2) {
                suspended = false;
                resume = true;
            }
        }
        if (resume) {
            // resumeReceives sólo entrega lo ya leído si corre en el hilo de IO
            channel.getIoThread().execute(this::resumeOnIoThread);
        }
        return frame;
    }

    private void resumeOnIoThread() {
        synchronized (flow) {
            // un frame rezagado pudo volver a llenar el inbox: quien lo drene reanudará
            if (suspended) return;
            if (!channel.isOpen()) return;
            channel.resumeReceives();
        }
        log.debug("{} inbound buffer drained, resuming receives", id);
    }

    @Override
    public void write(String text) throws IOException {
        if (!channel.isOpen()) throw new IOException("channel closed: " + id);
        WebSockets.sendTextBlocking(text, channel);
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void close() {
        try {
            if (channel.isOpen()) channel.sendClose();
        } catch (IOException e) {
            log.debug("{} close handshake failed: {}", id, e.toString());
            IoUtils.safeClose(channel);
        }
        inbox.add(EOF);
    }

    @Override
    public void abort() {
        IoUtils.safeClose(channel);
        inbox.add(EOF);
    }

    @Override
    public String toString() {
        return id;
    }
}
