package com.matcast.server.exception;

/**
 * Thrown when a score action names someone who is not competing in the match.
 */
public class InvalidParticipantException extends MatchDomainException {
    private final String participantId;

    public InvalidParticipantException(String matchId, String participantId) {
        super(matchId, "Invalid participant ID for this match: " + participantId);
        this.participantId = participantId;
    }

    public String getParticipantId() {
        return participantId;
    }
}
