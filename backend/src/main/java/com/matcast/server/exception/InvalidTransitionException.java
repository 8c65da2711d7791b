package com.matcast.server.exception;

import com.matcast.server.model.MatchState;

/**
 * Thrown when a requested state change is not an edge of the transition table.
 */
public class InvalidTransitionException extends MatchDomainException {

    public InvalidTransitionException(String matchId, MatchState from, MatchState to) {
        super(matchId, String.format("Invalid state transition from %s to %s", from, to));
    }
}
