package com.ciro.codepair.standalone;

import java.time.Duration;
import java.util.Properties;

public class ServerConfig {
    public static final String PREFIX = "codepair.";

    private String host = "0.0.0.0";
    /** 0 = puerto efímero (tests) */
    private int port = 8080;
    /** Tamaño máximo de un frame de texto entrante */
    private long maxTextMessageBytes = 1024 * 1024;
    /** Frames en buffer antes de suspender la lectura del socket */
    private int inboundHighWater = 64;
    /** Tamaño máximo del body de /compile */
    private long maxCodeBytes = 256 * 1024;
    private Duration executionTimeout = Duration.ofSeconds(10);
    private String goBinary = "go";
    private String nodeBinary = "node";

    public static ServerConfig fromSystemProperties() {
        return from(System.getProperties());
    }

    public static ServerConfig from(Properties props) {
        ServerConfig c = new ServerConfig();
        c.setHost(props.getProperty(PREFIX + "host", c.getHost()));
        c.setPort(Integer.parseInt(props.getProperty(PREFIX + "port", String.valueOf(c.getPort()))));
        c.setMaxTextMessageBytes(Long.parseLong(props.getProperty(PREFIX + "maxTextMessageBytes", String.valueOf(c.getMaxTextMessageBytes()))));
        c.setInboundHighWater(Integer.parseInt(props.getProperty(PREFIX + "inboundHighWater", String.valueOf(c.getInboundHighWater()))));
        c.setMaxCodeBytes(Long.parseLong(props.getProperty(PREFIX + "maxCodeBytes", String.valueOf(c.getMaxCodeBytes()))));
        c.setExecutionTimeout(Duration.parse(props.getProperty(PREFIX + "executionTimeout", c.getExecutionTimeout().toString())));
        c.setGoBinary(props.getProperty(PREFIX + "goBinary", c.getGoBinary()));
        c.setNodeBinary(props.getProperty(PREFIX + "nodeBinary", c.getNodeBinary()));
        return c;
    }

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }

    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }

    public long getMaxTextMessageBytes() { return maxTextMessageBytes; }
    public void setMaxTextMessageBytes(long maxTextMessageBytes) { this.maxTextMessageBytes = maxTextMessageBytes; }

    public int getInboundHighWater() { return inboundHighWater; }
    public void setInboundHighWater(int inboundHighWater) {
        if (inboundHighWater < 2) throw new IllegalArgumentException("inboundHighWater must be >= 2");
        this.inboundHighWater = inboundHighWater;
    }

    public long getMaxCodeBytes() { return maxCodeBytes; }
    public void setMaxCodeBytes(long maxCodeBytes) { this.maxCodeBytes = maxCodeBytes; }

    public Duration getExecutionTimeout() { return executionTimeout; }
    public void setExecutionTimeout(Duration executionTimeout) { this.executionTimeout = executionTimeout; }

    public String getGoBinary() { return goBinary; }
    public void setGoBinary(String goBinary) { this.goBinary = goBinary; }

    public String getNodeBinary() { return nodeBinary; }
    public void setNodeBinary(String nodeBinary) { this.nodeBinary = nodeBinary; }
}
