package com.matcast.server.service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.matcast.server.dto.ScoreView;
import com.matcast.server.model.Match;
import com.matcast.server.model.MatchEvent;
import com.matcast.server.model.MatchEventType;
import com.matcast.server.model.MatchState;
import com.matcast.server.model.ScoreAction;
import com.matcast.server.repository.MatchEventRepository;

/**
 * Builds and appends audit events. Called only from {@link MatchService}
 * inside the mutation's transaction, so an event is stored iff its mutation is.
 */
@Component
public class MatchEventLog {

    public static final String SYSTEM_ACTOR = "system";

    private final MatchEventRepository eventRepository;

    public MatchEventLog(MatchEventRepository eventRepository) {
        this.eventRepository = eventRepository;
    }

    public MatchEvent score(Match match, String actorId, String participantId, ScoreAction action,
                            ScoreView oldScore, ScoreView newScore, Instant now) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("action", action.name());
        meta.put("oldScore", scoreMap(oldScore));
        meta.put("newScore", scoreMap(newScore));
        meta.put("scoreDifference", scoreMap(new ScoreView(
                newScore.points() - oldScore.points(),
                newScore.advantages() - oldScore.advantages(),
                newScore.penalties() - oldScore.penalties(),
                newScore.submissions() - oldScore.submissions())));
        return append(match.getId(), now, actorId, participantId, action.getEventType(), null, meta);
    }

    public MatchEvent stateChange(Match match, String actorId, MatchState oldState, MatchState newState,
                                  Instant now) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("oldState", oldState.name());
        meta.put("newState", newState.name());
        return append(match.getId(), now, actorId, null, MatchEventType.forStateChange(newState), null, meta);
    }

    public MatchEvent timer(Match match, String actorId, int oldRemaining, int newRemaining, Instant now) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("oldTimeRemaining", oldRemaining);
        meta.put("newTimeRemaining", newRemaining);
        meta.put("timeChange", newRemaining - oldRemaining);
        return append(match.getId(), now, actorId, null, MatchEventType.TIMER_UPDATE, newRemaining, meta);
    }

    public MatchEvent autoFinish(Match match, MatchState previousState, String reason, String winnerId,
                                 Instant now) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("reason", reason);
        meta.put("oldState", previousState.name());
        meta.put("newState", MatchState.FINISHED.name());
        meta.put("finalScore1", scoreMap(ScoreView.from(match.getScore1())));
        meta.put("finalScore2", scoreMap(ScoreView.from(match.getScore2())));
        meta.put("winnerId", winnerId);
        return append(match.getId(), now, SYSTEM_ACTOR, null, MatchEventType.AUTO_FINISH, null, meta);
    }

    public MatchEvent created(Match match, String actorId, Instant now) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("participant1Id", match.getParticipant1().getId());
        meta.put("participant2Id", match.getParticipant2().getId());
        meta.put("duration", match.getDuration());
        meta.put("tournamentId", match.getTournamentId());
        return append(match.getId(), now, actorId, null, MatchEventType.MATCH_CREATED, null, meta);
    }

    public MatchEvent refereeAssigned(Match match, String actorId, String oldRefereeId, Instant now) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("comment", "Referee assigned");
        meta.put("oldRefereeId", oldRefereeId);
        meta.put("newRefereeId", match.getRefereeId());
        return append(match.getId(), now, actorId, null, MatchEventType.COMMENT, null, meta);
    }

    public MatchEvent purged(String matchId, String actorId, int deleted, Instant now) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("deletedCount", deleted);
        return append(matchId, now, actorId, null, MatchEventType.EVENTS_PURGED, deleted, meta);
    }

    private MatchEvent append(String matchId, Instant now, String actorId, String participantId,
                              MatchEventType type, Integer value, Map<String, Object> meta) {
        return eventRepository.save(new MatchEvent(matchId, now, actorId, participantId, type, value, meta));
    }

    private static Map<String, Object> scoreMap(ScoreView s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("points", s.points());
        m.put("advantages", s.advantages());
        m.put("penalties", s.penalties());
        m.put("submissions", s.submissions());
        return m;
    }
}
