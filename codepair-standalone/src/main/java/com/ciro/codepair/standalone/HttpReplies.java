package com.ciro.codepair.standalone;

import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

final class HttpReplies {
    private HttpReplies() {}

    static void text(HttpServerExchange exchange, int status, String body) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
        exchange.getResponseSender().send(body.endsWith("\n") ? body : body + "\n");
    }
}
