package com.ciro.codepair.relay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Actor de broadcast de una sesión.
 * <p>
 * Todos los eventos (register, unregister, broadcast) entran por una única cola y los
 * consume un único loop secuencial, que es el único que toca el set de miembros.
 * El orden en que el loop desencola los broadcasts es el orden que ven todos los
 * miembros.
 */
public final class Hub {

    private static final Logger log = LoggerFactory.getLogger(Hub.class);

    private interface Event {}
    private record Register(Connection connection) implements Event {}
    private record Unregister(Connection connection) implements Event {}
    private record Broadcast(String payload) implements Event {}
    private record Retire(Duration idleTimeout) implements Event {}
    private record Shutdown() implements Event {}

    private enum Phase { OPEN, RETIRED, SHUT_DOWN }

    private final String sessionId;
    private final Executor executor;
    private final Clock clock;
    private final HubRegistry registry;

    private final BlockingQueue<Event> events = new LinkedBlockingQueue<>();
    private final Set<Connection> members = new HashSet<>();

    // write lock: cambio de fase + drenado; read lock: encolar
    private final ReentrantReadWriteLock lifecycle = new ReentrantReadWriteLock();
    private volatile Phase phase = Phase.OPEN;

    private final AtomicBoolean started = new AtomicBoolean();
    private final CountDownLatch terminated = new CountDownLatch(1);

    // Publicados por el loop para lecturas externas
    private volatile int memberCount;
    private volatile Instant emptySince;

    Hub(String sessionId, Executor executor, Clock clock, HubRegistry registry) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.registry = registry;
        this.emptySince = clock.instant();
    }

    public String sessionId() {
        return sessionId;
    }

    public void register(Connection connection) {
        submit(new Register(Objects.requireNonNull(connection, "connection")));
    }

    /** Idempotente: des-registrar una conexión ausente no hace nada. */
    public void unregister(Connection connection) {
        submit(new Unregister(Objects.requireNonNull(connection, "connection")));
    }

    public void broadcast(String payload) {
        submit(new Broadcast(Objects.requireNonNull(payload, "payload")));
    }

    public int memberCount() {
        return memberCount;
    }

    public boolean isRunning() {
        return started.get() && terminated.getCount() > 0;
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return terminated.await(timeout, unit);
    }

    /** Tiempo que lleva vacío; cero si tiene miembros. */
    Duration idleFor(Instant now) {
        Instant since = emptySince;
        return since == null ? Duration.ZERO : Duration.between(since, now);
    }

    void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Hub " + sessionId + " already started");
        }
        executor.execute(this::run);
    }

    void retire(Duration idleTimeout) {
        submit(new Retire(idleTimeout));
    }

    /** Desconecta a todos los miembros y detiene el loop. */
    void shutdown() {
        List<Event> pending = new ArrayList<>();
        lifecycle.writeLock().lock();
        try {
            if (phase != Phase.OPEN) return;
            phase = Phase.SHUT_DOWN;
            events.drainTo(pending);
            events.add(new Shutdown());
        } finally {
            lifecycle.writeLock().unlock();
        }
        pending.forEach(this::rejected);
    }

    private void submit(Event event) {
        lifecycle.readLock().lock();
        try {
            if (phase == Phase.OPEN) {
                events.add(event);
                return;
            }
        } finally {
            lifecycle.readLock().unlock();
        }
        rejected(event);
    }

    /**
     * Eventos que llegan a un hub que ya no acepta trabajo. Un register hacia un hub
     * retirado se reenvía al sucesor de la misma sesión; el resto se descarta.
     */
    private void rejected(Event event) {
        if (!(event instanceof Register r)) {
            log.trace("Hub {} dropped {} after {}", sessionId, event.getClass().getSimpleName(), phase);
            return;
        }
        if (phase == Phase.RETIRED && registry != null) {
            try {
                registry.getOrCreateHub(sessionId).register(r.connection());
                return;
            } catch (IllegalStateException e) {
                log.debug("Registry closed while forwarding {} for session {}", r.connection(), sessionId);
            }
        }
        r.connection().abort();
    }

    // --- Loop ---

    private void run() {
        log.debug("Hub {} loop started", sessionId);
        try {
            boolean keepRunning = true;
            while (keepRunning) {
                Event event = events.take();
                try {
                    keepRunning = dispatch(event);
                } catch (RuntimeException e) {
                    log.error("Hub {} failed handling {}", sessionId, event.getClass().getSimpleName(), e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            disconnectAll();
        } finally {
            terminated.countDown();
            log.debug("Hub {} loop stopped", sessionId);
        }
    }

    private boolean dispatch(Event event) {
        if (event instanceof Broadcast b) {
            onBroadcast(b.payload());
        } else if (event instanceof Register r) {
            onRegister(r.connection());
        } else if (event instanceof Unregister u) {
            onUnregister(u.connection());
        } else if (event instanceof Retire t) {
            return !onRetire(t.idleTimeout());
        } else if (event instanceof Shutdown) {
            disconnectAll();
            return false;
        }
        return true;
    }

    private void onRegister(Connection c) {
        if (!members.add(c)) return;
        try {
            c.activate(this, executor);
        } catch (IllegalStateException e) {
            // Ya pertenece a otro hub: no es nuestra para cerrarla.
            log.warn("Hub {} refused {}: {}", sessionId, c, e.getMessage());
            members.remove(c);
        } catch (RejectedExecutionException e) {
            log.warn("Hub {} could not start pumps for {}", sessionId, c);
            members.remove(c);
            c.release();
            c.abort();
        }
        publishMembership();
        log.debug("Hub {} registered {} ({} members)", sessionId, c, members.size());
    }

    private void onUnregister(Connection c) {
        if (!members.remove(c)) return;
        c.release();
        publishMembership();
        log.debug("Hub {} unregistered {} ({} members)", sessionId, c, members.size());
    }

    private void onBroadcast(String payload) {
        List<Connection> overflowed = null;
        for (Connection c : members) {
            if (!c.offer(payload)) {
                if (overflowed == null) overflowed = new ArrayList<>();
                overflowed.add(c);
            }
        }
        if (overflowed == null) return;

        // Miembro lento: se le desconecta sólo a él, el resto ya recibió el mensaje.
        for (Connection c : overflowed) {
            // Si sus pumps ya murieron, el Unregister está en camino: no es un miembro lento
            boolean wasAlive = c.isAlive();
            members.remove(c);
            c.release();
            c.abort();
            if (wasAlive) {
                log.warn("Hub {} disconnected {}: outbound queue overflow", sessionId, c);
            } else {
                log.debug("Hub {} dropped {} already closing", sessionId, c);
            }
        }
        publishMembership();
    }

    /** @return true si el hub se retiró y el loop debe terminar */
    private boolean onRetire(Duration idleTimeout) {
        if (!members.isEmpty() || idleFor(clock.instant()).compareTo(idleTimeout) < 0) {
            return false;
        }
        List<Event> pending = new ArrayList<>();
        lifecycle.writeLock().lock();
        try {
            phase = Phase.RETIRED;
            if (registry != null) registry.remove(sessionId, this);
            events.drainTo(pending);
        } finally {
            lifecycle.writeLock().unlock();
        }
        log.info("Hub {} retired after {} idle", sessionId, idleTimeout);
        pending.forEach(this::rejected);
        return true;
    }

    private void disconnectAll() {
        for (Connection c : members) {
            c.release();
            c.abort();
        }
        members.clear();
        publishMembership();
    }

    private void publishMembership() {
        memberCount = members.size();
        if (members.isEmpty()) {
            if (emptySince == null) emptySince = clock.instant();
        } else {
            emptySince = null;
        }
    }

    @Override
    public String toString() {
        return "Hub[" + sessionId + ", members=" + memberCount + "]";
    }
}
