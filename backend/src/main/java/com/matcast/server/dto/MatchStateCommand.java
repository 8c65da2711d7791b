package com.matcast.server.dto;

import com.matcast.server.model.MatchState;

import jakarta.validation.constraints.NotNull;

public class MatchStateCommand {

    @NotNull(message = "state is required")
    private MatchState state;

    public MatchState getState() { return state; }
    public void setState(MatchState state) { this.state = state; }
}
