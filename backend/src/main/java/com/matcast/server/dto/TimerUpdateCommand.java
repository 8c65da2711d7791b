package com.matcast.server.dto;

import jakarta.validation.constraints.NotNull;

/**
 * Range is checked by the match service, not here, so a negative value
 * surfaces as a domain error rather than a malformed frame.
 */
public class TimerUpdateCommand {

    @NotNull(message = "timeRemaining is required")
    private Integer timeRemaining;

    public Integer getTimeRemaining() { return timeRemaining; }
    public void setTimeRemaining(Integer timeRemaining) { this.timeRemaining = timeRemaining; }
}
