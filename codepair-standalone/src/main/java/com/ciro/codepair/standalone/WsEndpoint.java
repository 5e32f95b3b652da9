package com.ciro.codepair.standalone;

import com.ciro.codepair.relay.Connection;
import com.ciro.codepair.relay.HubRegistry;
import io.undertow.Handlers;
import io.undertow.server.HttpHandler;
import io.undertow.util.AttachmentKey;
import io.undertow.util.StatusCodes;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xnio.IoUtils;

/**
 * /ws/{id}: valida el id antes del upgrade y une la conexión al hub de la sesión.
 */
public class WsEndpoint {

    private static final Logger log = LoggerFactory.getLogger(WsEndpoint.class);

    /** Id de sesión extraído de /ws/{id} antes del upgrade. */
    static final AttachmentKey<String> SESSION_ID = AttachmentKey.create(String.class);

    private final HubRegistry registry;
    private final ServerConfig config;
    private final HttpHandler upgrade;

    public WsEndpoint(HubRegistry registry, ServerConfig config) {
        this.registry = registry;
        this.config = config;
        this.upgrade = Handlers.websocket(this::onConnect);
    }

    /** Handler HTTP previo al handshake. */
    public HttpHandler handler() {
        return exchange -> {
            String sessionId = JoinPaths.sessionId(exchange.getRequestPath());
            if (sessionId == null) {
                HttpReplies.text(exchange, StatusCodes.BAD_REQUEST, "Invalid WebSocket URL");
                return;
            }
            exchange.putAttachment(SESSION_ID, sessionId);
            upgrade.handleRequest(exchange);
        };
    }

    void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
        String sessionId = exchange.getAttachment(SESSION_ID);
        if (sessionId == null) {
            // handler() siempre lo adjunta antes del upgrade
            log.warn("WS connect without session id from {}", channel.getSourceAddress());
            IoUtils.safeClose(channel);
            return;
        }

        UndertowRelayTransport transport = new UndertowRelayTransport(
                channel, sessionId, config.getInboundHighWater(), config.getMaxTextMessageBytes());
        Connection connection = new Connection(transport, registry.config().getOutboundQueueCapacity());
        transport.listen();

        try {
            registry.getOrCreateHub(sessionId).register(connection);
            log.info("WS CONNECT session={} from {}", sessionId, channel.getSourceAddress());
        } catch (IllegalStateException e) {
            log.warn("WS connect rejected for session {}: {}", sessionId, e.getMessage());
            transport.abort();
        }
    }
}
