package com.matcast.server.dto;

import java.util.Map;

import com.matcast.server.model.MatchEvent;
import com.matcast.server.model.MatchEventType;

public record MatchEventView(
        String id,
        String matchId,
        String timestamp,
        String actorId,
        String participantId,
        MatchEventType eventType,
        Integer value,
        Map<String, Object> metadata
) {

    public static MatchEventView from(MatchEvent e) {
        return new MatchEventView(e.getId(), e.getMatchId(), e.getTimestamp().toString(), e.getActorId(),
                e.getParticipantId(), e.getEventType(), e.getValue(), e.getMetadata());
    }
}
