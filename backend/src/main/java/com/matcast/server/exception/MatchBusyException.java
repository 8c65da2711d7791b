package com.matcast.server.exception;

/**
 * Thrown when the cross-process match lock could not be acquired in time.
 * The client may simply resend the command.
 */
public class MatchBusyException extends MatchDomainException {

    public MatchBusyException(String matchId) {
        super(matchId, "Match " + matchId + " is being updated elsewhere, please retry");
    }
}
