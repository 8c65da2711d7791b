package com.matcast.server.exception;

/**
 * Thrown when a requested match is not known to the persistence layer.
 */
public class MatchNotFoundException extends MatchDomainException {

    public MatchNotFoundException(String matchId) {
        super(matchId, "Match not found: " + matchId);
    }
}
