package com.matcast.server.model;

/**
 * Kinds of audit records appended to a match's event log.
 */
public enum MatchEventType {
    POINTS_2,
    ADVANTAGE,
    PENALTY,
    SUBMISSION,
    START,
    STOP,
    RESET,
    COMMENT,
    MATCH_CREATED,
    STATE_CHANGE,
    TIMER_UPDATE,
    AUTO_FINISH,
    EVENTS_PURGED;

    /**
     * Event type recorded when a match enters {@code newState}.
     */
    public static MatchEventType forStateChange(MatchState newState) {
        switch (newState) {
            case IN_PROGRESS:
                return START;
            case PAUSED:
            case FINISHED:
                return STOP;
            default:
                return STATE_CHANGE;
        }
    }
}
