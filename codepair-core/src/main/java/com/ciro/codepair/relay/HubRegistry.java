package com.ciro.codepair.relay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Mapa sessionId → {@link Hub}.
 * <p>
 * Se construye una vez al arrancar el proceso y se pasa por referencia a los handlers;
 * cada test crea el suyo. Es dueño de los hilos de los hubs y de los pumps, que se
 * liberan con {@link #close()}.
 * <p>
 * Las búsquedas toman el read lock; la inserción ante un fallo toma el write lock y
 * vuelve a comprobar, así que para un mismo id sólo se crea (y arranca) un hub.
 */
public class HubRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HubRegistry.class);

    private final RelayConfig config;
    private final Clock clock;
    private final Map<String, Hub> hubs = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final ExecutorService workers;
    private final ScheduledExecutorService sweeper;

    private boolean closed; // guardado por lock

    public HubRegistry(RelayConfig config) {
        this(config, Clock.systemUTC());
    }

    HubRegistry(RelayConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.workers = Executors.newCachedThreadPool(RelayThreads.named("codepair-relay"));

        if (config.isEvictionEnabled()) {
            long every = config.getSweepInterval().toMillis();
            this.sweeper = Executors.newSingleThreadScheduledExecutor(RelayThreads.named("codepair-sweeper"));
            this.sweeper.scheduleWithFixedDelay(this::sweep, every, every, TimeUnit.MILLISECONDS);
        } else {
            this.sweeper = null;
        }
    }

    public RelayConfig config() {
        return config;
    }

    public Hub getOrCreateHub(String id) {
        Objects.requireNonNull(id, "id");

        lock.readLock().lock();
        try {
            ensureOpen();
            Hub hub = hubs.get(id);
            if (hub != null) return hub;
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            ensureOpen();
            Hub hub = hubs.get(id);
            if (hub == null) {
                hub = new Hub(id, workers, clock, this);
                hub.start();
                hubs.put(id, hub);
                log.info("Hub created for session {}", id);
            }
            return hub;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Hub> find(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(hubs.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return hubs.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> sessionIds() {
        lock.readLock().lock();
        try {
            return new TreeSet<>(hubs.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Pide el retiro a cada hub vacío desde hace al menos {@code idleTimeout}. El hub
     * decide en su propio loop, así que un register concurrente nunca se pierde.
     *
     * @return número de hubs a los que se pidió el retiro
     */
    public int evictIdle() {
        if (!config.isEvictionEnabled()) return 0;
        Duration timeout = config.getIdleTimeout();

        // Snapshot fuera del lock: el retiro toma el lock del hub y luego el nuestro.
        List<Hub> snapshot;
        lock.readLock().lock();
        try {
            snapshot = new ArrayList<>(hubs.values());
        } finally {
            lock.readLock().unlock();
        }

        Instant now = clock.instant();
        int requested = 0;
        for (Hub hub : snapshot) {
            if (hub.idleFor(now).compareTo(timeout) >= 0) {
                hub.retire(timeout);
                requested++;
            }
        }
        return requested;
    }

    void remove(String id, Hub hub) {
        lock.writeLock().lock();
        try {
            hubs.remove(id, hub);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        List<Hub> snapshot;
        lock.writeLock().lock();
        try {
            if (closed) return;
            closed = true;
            snapshot = new ArrayList<>(hubs.values());
            hubs.clear();
        } finally {
            lock.writeLock().unlock();
        }

        if (sweeper != null) sweeper.shutdownNow();
        snapshot.forEach(Hub::shutdown);
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Relay workers still running after close, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        log.info("Hub registry closed ({} hubs)", snapshot.size());
    }

    private void sweep() {
        try {
            int n = evictIdle();
            if (n > 0) log.debug("Requested retirement of {} idle hubs", n);
        } catch (RuntimeException e) {
            log.error("Idle hub sweep failed", e);
        }
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("Hub registry is closed");
    }
}
