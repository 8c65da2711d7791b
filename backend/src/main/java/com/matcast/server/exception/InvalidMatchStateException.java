package com.matcast.server.exception;

import com.matcast.server.model.MatchState;

/**
 * Thrown when an operation needs the match in one state but it is in another.
 * E.g., applying a score action to a PAUSED match.
 */
public class InvalidMatchStateException extends MatchDomainException {

    public InvalidMatchStateException(String matchId, MatchState currentState, MatchState expectedState) {
        super(matchId, String.format("Match %s is %s, expected %s", matchId, currentState, expectedState));
    }
}
