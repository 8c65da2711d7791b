package com.matcast.server.exception;

/**
 * Base type for rule violations raised by the match state machine.
 *
 * These are always recoverable: nothing has been mutated when one is thrown,
 * and the message is safe to send back to the client that caused it.
 */
public abstract class MatchDomainException extends RuntimeException {
    private final String matchId;

    protected MatchDomainException(String matchId, String message) {
        super(message);
        this.matchId = matchId;
    }

    public String getMatchId() {
        return matchId;
    }
}
