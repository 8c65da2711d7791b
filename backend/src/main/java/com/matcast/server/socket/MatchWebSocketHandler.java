package com.matcast.server.socket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import com.matcast.server.model.Role;
import com.matcast.server.security.HubHandshakeInterceptor;
import com.matcast.server.security.HubIdentity;

/**
 * Servlet-container adapter for the match and tournament endpoints.
 *
 * Wraps each session in a {@link ConcurrentWebSocketSessionDecorator} so
 * sends from the hub, the sweep and the broker thread are serialized and
 * bounded (a consumer that falls behind by more than the buffer limit or
 * blocks longer than the time limit is cut off). Everything else is
 * delegated to {@link MatchProtocolHandler}.
 */
@Component
public class MatchWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(MatchWebSocketHandler.class);
    static final String ATTR_CONNECTION = "matcast.connection";

    private final MatchProtocolHandler protocol;
    private final int sendTimeLimitMs;
    private final int sendBufferSizeBytes;

    public MatchWebSocketHandler(MatchProtocolHandler protocol,
                                 @Value("${matcast.ws.send-time-limit-ms:5000}") int sendTimeLimitMs,
                                 @Value("${matcast.ws.send-buffer-size-bytes:524288}") int sendBufferSizeBytes) {
        this.protocol = protocol;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.sendBufferSizeBytes = sendBufferSizeBytes;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) throws Exception {
        Object identity = session.getAttributes().get(HubHandshakeInterceptor.ATTR_IDENTITY);
        Object channel = session.getAttributes().get(HubHandshakeInterceptor.ATTR_CHANNEL);
        Object role = session.getAttributes().get(HubHandshakeInterceptor.ATTR_ROLE);
        if (!(identity instanceof HubIdentity) || !(channel instanceof Channel) || !(role instanceof Role)) {
            log.warn("[WS] Session {} arrived without handshake attributes, closing", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }

        WebSocketSession decorated =
                new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferSizeBytes);
        HubConnection connection = new HubConnection(decorated, (Channel) channel, (Role) role, (HubIdentity) identity);
        session.getAttributes().put(ATTR_CONNECTION, connection);
        protocol.onOpen(connection);
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        HubConnection connection = connectionOf(session);
        if (connection != null) {
            protocol.onFrame(connection, message.getPayload());
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.debug("[WS] Transport error on {}: {}", session.getId(), exception.getMessage());
        HubConnection connection = connectionOf(session);
        if (connection != null) {
            protocol.onClose(connection, CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        HubConnection connection = connectionOf(session);
        if (connection != null) {
            protocol.onClose(connection, status);
        }
    }

    private static HubConnection connectionOf(WebSocketSession session) {
        Object value = session.getAttributes().get(ATTR_CONNECTION);
        return value instanceof HubConnection ? (HubConnection) value : null;
    }
}
