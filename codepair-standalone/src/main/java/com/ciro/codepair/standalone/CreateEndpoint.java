package com.ciro.codepair.standalone;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** GET /create: nueva sesión y redirección a su página. */
public final class CreateEndpoint implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(CreateEndpoint.class);

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String id = SessionIds.newId();
        log.debug("New interview session {}", id);
        exchange.setStatusCode(StatusCodes.FOUND);
        exchange.getResponseHeaders().put(Headers.LOCATION, "/interview/" + id);
        exchange.endExchange();
    }
}
