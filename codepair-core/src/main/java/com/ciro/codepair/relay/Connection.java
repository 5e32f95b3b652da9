package com.ciro.codepair.relay;

import com.ciro.codepair.spi.RelayTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Un participante: su transporte, su cola de salida acotada y los dos pumps que lo
 * conectan con el {@link Hub}.
 * <p>
 * El pump de entrada es el único que lee del transporte y el de salida el único que
 * escribe. La cola de salida sólo la alimenta el loop del hub.
 */
public final class Connection {

    private static final Logger log = LoggerFactory.getLogger(Connection.class);

    private static final AtomicLong SERIALS = new AtomicLong();

    // Centinela comparado por identidad: nunca coincide con un payload real.
    private static final String RELEASED = new String("<released>");

    private final long serial = SERIALS.incrementAndGet();
    private final RelayTransport transport;
    private final BlockingQueue<String> outbound;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);

    private volatile Hub hub;

    public Connection(RelayTransport transport, int outboundCapacity) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.outbound = new ArrayBlockingQueue<>(outboundCapacity);
    }

    public ConnectionState state() {
        return state.get();
    }

    public boolean isAlive() {
        ConnectionState s = state.get();
        return s == ConnectionState.REGISTERED || s == ConnectionState.ACTIVE;
    }

    /** El hub dueño; {@code null} mientras la conexión está en CONNECTING. */
    public Hub hub() {
        return hub;
    }

    /** Mensajes encolados y aún no escritos. */
    public int pending() {
        return outbound.size();
    }

    public RelayTransport transport() {
        return transport;
    }

    // --- Llamados sólo desde el loop del hub ---

    void activate(Hub owner, Executor executor) {
        if (!state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.REGISTERED)) {
            throw new IllegalStateException(this + " cannot be registered in state " + state.get());
        }
        this.hub = owner;
        executor.execute(this::pumpOutbound);
        executor.execute(this::pumpInbound);
        state.compareAndSet(ConnectionState.REGISTERED, ConnectionState.ACTIVE);
    }

    boolean offer(String payload) {
        if (state.get() == ConnectionState.CLOSED) return false;
        return outbound.offer(payload);
    }

    /**
     * Pasa a CLOSED y despierta al pump de salida para que cierre el transporte.
     * Idempotente.
     */
    void release() {
        if (state.getAndSet(ConnectionState.CLOSED) == ConnectionState.CLOSED) return;
        outbound.clear();
        // Tras el clear hay hueco: nadie más que el loop del hub encola.
        outbound.offer(RELEASED);
    }

    void abort() {
        transport.abort();
    }

    // --- Pumps ---

    private void pumpInbound() {
        try {
            String frame;
            while (isAlive() && (frame = transport.read()) != null) {
                hub.broadcast(frame);
            }
            log.debug("{} inbound finished", this);
        } catch (IOException e) {
            log.debug("{} read failed: {}", this, e.toString());
        } catch (RuntimeException e) {
            log.error("{} inbound pump crashed", this, e);
            transport.abort();
        } finally {
            beginUnregister();
        }
    }

    private void pumpOutbound() {
        try {
            for (;;) {
                String next = outbound.take();
                if (next == RELEASED) {
                    transport.close();
                    log.debug("{} outbound released", this);
                    return;
                }
                transport.write(next);
            }
        } catch (IOException e) {
            log.debug("{} write failed: {}", this, e.toString());
            transport.abort();
            beginUnregister();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            transport.abort();
            beginUnregister();
        } catch (RuntimeException e) {
            log.error("{} outbound pump crashed", this, e);
            transport.abort();
            beginUnregister();
        }
    }

    private void beginUnregister() {
        if (state.compareAndSet(ConnectionState.ACTIVE, ConnectionState.UNREGISTERING)
                || state.compareAndSet(ConnectionState.REGISTERED, ConnectionState.UNREGISTERING)) {
            hub.unregister(this);
        }
    }

    @Override
    public String toString() {
        return "conn#" + serial + "(" + transport.id() + ")";
    }
}
