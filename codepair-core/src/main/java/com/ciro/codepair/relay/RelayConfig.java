package com.ciro.codepair.relay;

import java.time.Duration;
import java.util.Objects;

public class RelayConfig {
    /** Mensajes pendientes por conexión antes de desconectarla por lenta */
    private int outboundQueueCapacity = 256;
    /** Tiempo que un hub vacío sobrevive antes de retirarse (0 = nunca) */
    private Duration idleTimeout = Duration.ofMinutes(5);
    /** Frecuencia del barrido de hubs inactivos */
    private Duration sweepInterval = Duration.ofSeconds(30);

    public int getOutboundQueueCapacity() { return outboundQueueCapacity; }
    public void setOutboundQueueCapacity(int outboundQueueCapacity) {
        if (outboundQueueCapacity < 1) {
            throw new IllegalArgumentException("outboundQueueCapacity must be >= 1: " + outboundQueueCapacity);
        }
        this.outboundQueueCapacity = outboundQueueCapacity;
    }

    public Duration getIdleTimeout() { return idleTimeout; }
    public void setIdleTimeout(Duration idleTimeout) { this.idleTimeout = Objects.requireNonNull(idleTimeout); }

    public Duration getSweepInterval() { return sweepInterval; }
    public void setSweepInterval(Duration sweepInterval) {
        if (sweepInterval.isZero() || sweepInterval.isNegative()) {
            throw new IllegalArgumentException("sweepInterval must be positive: " + sweepInterval);
        }
        this.sweepInterval = sweepInterval;
    }

    public boolean isEvictionEnabled() {
        return !idleTimeout.isZero() && !idleTimeout.isNegative();
    }
}
