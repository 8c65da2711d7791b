package com.matcast.server.socket;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import com.matcast.server.exception.ConnectionSendException;
import com.matcast.server.model.Role;
import com.matcast.server.security.HubIdentity;

/**
 * One accepted socket plus its channel, role and identity.
 *
 * The session is expected to be a {@code ConcurrentWebSocketSessionDecorator},
 * so {@link #send} is safe from any thread and bounded in time and buffer.
 * Identity is by connection id (the session id).
 */
public class HubConnection {

    private static final Logger log = LoggerFactory.getLogger(HubConnection.class);

    private final WebSocketSession session;
    private final Channel channel;
    private final Role role;
    private final HubIdentity identity;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public HubConnection(WebSocketSession session, Channel channel, Role role, HubIdentity identity) {
        this.session = session;
        this.channel = channel;
        this.role = role;
        this.identity = identity;
    }

    /**
     * @throws ConnectionSendException the socket is closed, the write failed,
     *                                 or the outbound buffer/time limit was hit
     */
    public void send(String payload) {
        if (isClosed() || !session.isOpen()) {
            throw new ConnectionSendException(getId(), "Connection is closed", null);
        }
        try {
            session.sendMessage(new TextMessage(payload));
        } catch (IOException | IllegalStateException e) {
            throw new ConnectionSendException(getId(), "Send failed: " + e.getMessage(), e);
        } catch (SessionLimitExceededException e) {
            throw new ConnectionSendException(getId(), "Slow consumer: " + e.getMessage(), e);
        }
    }

    /**
     * Close the socket once. Later calls are no-ops.
     *
     * @return true if this call closed it
     */
    public boolean close(CloseStatus status) {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        if (session.isOpen()) {
            try {
                session.close(status);
            } catch (IOException e) {
                log.debug("[WS] Close of {} failed: {}", getId(), e.getMessage());
            }
        }
        return true;
    }

    boolean isClosed() {
        return closed.get();
    }

    public String getId() { return session.getId(); }
    public Channel getChannel() { return channel; }
    public Role getRole() { return role; }
    public HubIdentity getIdentity() { return identity; }

    @Override
    public String toString() {
        return "HubConnection{" + getId() + ", " + channel + ", " + role.wireName() + "}";
    }
}
