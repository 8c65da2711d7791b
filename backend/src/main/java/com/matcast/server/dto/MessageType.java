package com.matcast.server.dto;

import java.util.Optional;

/**
 * Frame types on the match and tournament sockets.
 */
public enum MessageType {
    // inbound
    SCORE_UPDATE,
    MATCH_STATE_UPDATE,
    TIMER_UPDATE,
    PING,
    PONG,
    // outbound
    MATCH_UPDATE,
    CONNECTION_STATUS,
    ERROR;

    /** Commands that mutate match state and therefore need the referee role. */
    public boolean isMutatingCommand() {
        return this == SCORE_UPDATE || this == MATCH_STATE_UPDATE || this == TIMER_UPDATE;
    }

    public static Optional<MessageType> fromWire(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (MessageType t : values()) {
            if (t.name().equals(raw)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
