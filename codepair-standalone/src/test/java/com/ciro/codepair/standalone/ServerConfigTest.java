package com.ciro.codepair.standalone;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServerConfigTest {

    @Test
    void defaultsApplyWithoutProperties() {
        ServerConfig c = ServerConfig.from(new Properties());

        assertThat(c.getHost()).isEqualTo("0.0.0.0");
        assertThat(c.getPort()).isEqualTo(8080);
        assertThat(c.getMaxTextMessageBytes()).isEqualTo(1024 * 1024);
        assertThat(c.getInboundHighWater()).isEqualTo(64);
        assertThat(c.getMaxCodeBytes()).isEqualTo(256 * 1024);
        assertThat(c.getExecutionTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(c.getGoBinary()).isEqualTo("go");
        assertThat(c.getNodeBinary()).isEqualTo("node");
    }

    @Test
    void prefixedPropertiesOverrideDefaults() {
        Properties p = new Properties();
        p.setProperty("codepair.port", "9090");
        p.setProperty("codepair.executionTimeout", "PT3S");
        p.setProperty("codepair.nodeBinary", "/opt/node/bin/node");
        p.setProperty("port", "1");

        ServerConfig c = ServerConfig.from(p);

        assertThat(c.getPort()).isEqualTo(9090);
        assertThat(c.getExecutionTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(c.getNodeBinary()).isEqualTo("/opt/node/bin/node");
    }

    @Test
    void highWaterNeedsRoomToResume() {
        assertThatThrownBy(() -> new ServerConfig().setInboundHighWater(1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
