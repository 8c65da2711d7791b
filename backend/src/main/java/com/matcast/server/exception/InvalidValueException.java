package com.matcast.server.exception;

/**
 * Thrown for out-of-range command values, e.g. a negative time remaining.
 */
public class InvalidValueException extends MatchDomainException {

    public InvalidValueException(String matchId, String message) {
        super(matchId, message);
    }
}
