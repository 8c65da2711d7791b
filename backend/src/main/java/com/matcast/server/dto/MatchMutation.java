package com.matcast.server.dto;

import java.util.List;

/**
 * Result of one state machine operation: the committed snapshot, the audit
 * events it appended (in order), and whether the system auto-finished the match.
 */
public record MatchMutation(MatchSnapshot snapshot, List<MatchEventView> events, boolean autoFinished) {
}
