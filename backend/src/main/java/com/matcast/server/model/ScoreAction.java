package com.matcast.server.model;

/**
 * Referee score actions. Each one increments exactly one counter of a
 * participant's {@link Score}; none of them can decrease a counter.
 */
public enum ScoreAction {
    POINTS_2(MatchEventType.POINTS_2),
    ADVANTAGE(MatchEventType.ADVANTAGE),
    PENALTY(MatchEventType.PENALTY),
    SUBMISSION(MatchEventType.SUBMISSION);

    private final MatchEventType eventType;

    ScoreAction(MatchEventType eventType) {
        this.eventType = eventType;
    }

    public MatchEventType getEventType() {
        return eventType;
    }
}
