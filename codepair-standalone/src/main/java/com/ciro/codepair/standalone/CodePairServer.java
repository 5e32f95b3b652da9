package com.ciro.codepair.standalone;

import com.ciro.codepair.relay.HubRegistry;
import com.ciro.codepair.relay.RelayConfig;
import com.ciro.codepair.standalone.exec.CodeExecutors;
import com.ciro.codepair.standalone.exec.GoWasmExecutor;
import com.ciro.codepair.standalone.exec.NodeExecutor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.handlers.PathHandler;
import io.undertow.server.handlers.resource.ClassPathResourceManager;
import io.undertow.server.handlers.resource.ResourceHandler;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

public class CodePairServer {

    private static final Logger log = LoggerFactory.getLogger(CodePairServer.class);

    private final ServerConfig config;
    private final HubRegistry registry;
    private final ObjectMapper mapper;
    private final Validator validator;

    private Undertow server;

    public CodePairServer(ServerConfig config, RelayConfig relayConfig) {
        this.config = config;
        this.registry = new HubRegistry(relayConfig);
        this.mapper = jsonMapper();

        Validator v;
        try {
            v = Validation.buildDefaultValidatorFactory().getValidator();
        } catch (Exception e) {
            v = null;
            log.warn("No Bean Validation provider found, compile requests are checked manually");
        }
        this.validator = v;
    }

    /** Mapper de las peticiones de /compile; el editor puede mandar campos extra. */
    static ObjectMapper jsonMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .addModule(new Jdk8Module())
                .addModule(new ParameterNamesModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public HubRegistry registry() {
        return registry;
    }

    public synchronized void start() {
        if (server != null) throw new IllegalStateException("Server already started");

        ClassLoader cl = CodePairServer.class.getClassLoader();

        // /static/* -> classpath:/static/*
        ResourceHandler staticHandler = new ResourceHandler(new ClassPathResourceManager(cl, "static"));
        staticHandler.setCacheTime(0);

        CodeExecutors executors = new CodeExecutors()
                .register(new GoWasmExecutor(config.getGoBinary(), config.getExecutionTimeout()))
                .register(new NodeExecutor(config.getNodeBinary(), config.getExecutionTimeout()), "js");

        WsEndpoint wsEndpoint = new WsEndpoint(registry, config);
        CompileEndpoint compileEndpoint = new CompileEndpoint(mapper, validator, executors, config.getMaxCodeBytes());
        HttpHandler fallback = new PageEndpoint(cl);

        PathHandler routes = new PathHandler(fallback);
        routes.addPrefixPath("/ws", wsEndpoint.handler());
        routes.addExactPath("/create", new CreateEndpoint());
        routes.addExactPath("/compile", compileEndpoint);
        routes.addPrefixPath("/static", staticHandler);

        server = Undertow.builder()
                .addHttpListener(config.getPort(), config.getHost())
                .setHandler(routes)
                .build();
        server.start();
        log.info("CodePair listening on http://{}:{}", config.getHost(), port());
    }

    /** Puerto real (útil con port = 0). */
    public synchronized int port() {
        if (server == null) throw new IllegalStateException("Server not started");
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop();
            server = null;
        }
        registry.close();
        log.info("CodePair stopped");
    }
}
