package com.matcast.server.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outbound JSON envelope: {@code {type, matchId|tournamentId, data, timestamp}}.
 * Exactly one of matchId and tournamentId is set for channel traffic.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WireMessage(
        String type,
        String matchId,
        String tournamentId,
        Object data,
        String timestamp
) {

    public static WireMessage forMatch(MessageType type, String matchId, Object data, Instant now) {
        return new WireMessage(type.name(), matchId, null, data, now.toString());
    }

    public static WireMessage forTournament(MessageType type, String tournamentId, Object data, Instant now) {
        return new WireMessage(type.name(), null, tournamentId, data, now.toString());
    }
}
