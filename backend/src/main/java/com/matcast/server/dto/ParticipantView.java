package com.matcast.server.dto;

import com.matcast.server.model.Participant;

public record ParticipantView(String id, String name, String team) {

    public static ParticipantView from(Participant p) {
        return new ParticipantView(p.getId(), p.getName(), p.getTeam());
    }
}
