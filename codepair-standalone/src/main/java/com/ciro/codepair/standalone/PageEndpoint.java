package com.ciro.codepair.standalone;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;

/**
 * Fallback del router: la página del editor para "/" y "/interview/{id}", 404 para el resto.
 */
public class PageEndpoint implements HttpHandler {

    static final String INDEX = "static/index.html";

    private final byte[] page;

    public PageEndpoint(ClassLoader cl) {
        try (InputStream in = cl.getResourceAsStream(INDEX)) {
            if (in == null) throw new IllegalStateException("Missing classpath resource " + INDEX);
            this.page = in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + INDEX, e);
        }
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String requestPath = exchange.getRequestPath();
        if (requestPath == null || requestPath.isBlank()) requestPath = "/";

        if (!requestPath.equals("/") && !requestPath.startsWith("/interview/")) {
            HttpReplies.text(exchange, StatusCodes.NOT_FOUND, "404 page not found");
            return;
        }

        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/html; charset=UTF-8");
        exchange.getResponseHeaders().put(Headers.CACHE_CONTROL, "no-store");
        exchange.getResponseSender().send(ByteBuffer.wrap(page));
    }
}
