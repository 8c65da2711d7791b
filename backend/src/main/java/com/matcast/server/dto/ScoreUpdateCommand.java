package com.matcast.server.dto;

import com.matcast.server.model.ScoreAction;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public class ScoreUpdateCommand {

    @NotNull(message = "action is required")
    private ScoreAction action;

    @NotBlank(message = "participantId is required")
    private String participantId;

    public ScoreAction getAction() { return action; }
    public void setAction(ScoreAction action) { this.action = action; }
    public String getParticipantId() { return participantId; }
    public void setParticipantId(String participantId) { this.participantId = participantId; }
}
