package com.ciro.codepair.relay;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionTest {

    @Test
    void outboundQueueRejectsOnceFull() {
        Connection c = new Connection(new PipeTransport("t"), 3);

        assertThat(c.offer("1")).isTrue();
        assertThat(c.offer("2")).isTrue();
        assertThat(c.offer("3")).isTrue();
        assertThat(c.offer("4")).isFalse();
        assertThat(c.pending()).isEqualTo(3);
    }

    @Test
    void releasedConnectionRefusesOffers() {
        Connection c = new Connection(new PipeTransport("t"), 3);
        c.offer("queued");

        c.release();
        c.release();

        assertThat(c.state()).isEqualTo(ConnectionState.CLOSED);
        assertThat(c.isAlive()).isFalse();
        assertThat(c.offer("late")).isFalse();
    }

    @Test
    void newConnectionIsConnectingWithoutHub() {
        Connection c = new Connection(new PipeTransport("t"), 1);

        assertThat(c.state()).isEqualTo(ConnectionState.CONNECTING);
        assertThat(c.hub()).isNull();
        assertThat(c.isAlive()).isFalse();
    }

    @Test
    void activationHappensOnce() throws Exception {
        RelayConfig config = new RelayConfig();
        config.setIdleTimeout(Duration.ZERO);
        ExecutorService executor = Executors.newCachedThreadPool();
        try (HubRegistry registry = new HubRegistry(config)) {
            Hub hub = registry.getOrCreateHub("s");
            PipeTransport t = new PipeTransport("t");
            Connection c = new Connection(t, 4);

            c.activate(hub, executor);
            assertThat(c.state()).isIn(ConnectionState.REGISTERED, ConnectionState.ACTIVE);
            assertThat(c.hub()).isSameAs(hub);

            assertThatThrownBy(() -> c.activate(hub, executor))
                    .isInstanceOf(IllegalStateException.class);

            c.release();
            assertThat(t.awaitDone(Duration.ofSeconds(5))).isTrue();
            assertThat(t.wasClosedGracefully()).isTrue();
        } finally {
            executor.shutdownNow();
        }
    }
}
