package com.matcast.server.dto;

import java.util.List;

/** Newest-first slice of a match's audit log. */
public record EventsPage(String matchId, long total, int limit, int offset, List<MatchEventView> events) {
}
