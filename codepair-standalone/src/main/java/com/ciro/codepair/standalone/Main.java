package com.ciro.codepair.standalone;

import com.ciro.codepair.relay.RelayConfig;

public class Main {

    public static void main(String[] args) {
        ServerConfig config = ServerConfig.fromSystemProperties();
        CodePairServer server = new CodePairServer(config, new RelayConfig());

        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "codepair-shutdown"));
        server.start();
    }
}
