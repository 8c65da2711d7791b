package com.matcast.server.exception;

/**
 * Another writer committed a change to the same match first (optimistic
 * version check failed). Nothing from this attempt was applied.
 */
public class MatchConflictException extends MatchDomainException {

    public MatchConflictException(String matchId, Throwable cause) {
        super(matchId, "Match was modified concurrently, please retry");
        initCause(cause);
    }
}
