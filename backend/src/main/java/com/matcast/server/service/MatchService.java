package com.matcast.server.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.matcast.server.dto.CreateMatchRequest;
import com.matcast.server.dto.EventsPage;
import com.matcast.server.dto.MatchEventView;
import com.matcast.server.dto.MatchMutation;
import com.matcast.server.dto.MatchSnapshot;
import com.matcast.server.dto.ScoreView;
import com.matcast.server.exception.InvalidMatchStateException;
import com.matcast.server.exception.InvalidParticipantException;
import com.matcast.server.exception.InvalidTransitionException;
import com.matcast.server.exception.InvalidValueException;
import com.matcast.server.exception.MatchConflictException;
import com.matcast.server.exception.MatchNotFoundException;
import com.matcast.server.model.Match;
import com.matcast.server.model.MatchEvent;
import com.matcast.server.model.MatchEventType;
import com.matcast.server.model.MatchState;
import com.matcast.server.model.Participant;
import com.matcast.server.model.Score;
import com.matcast.server.model.ScoreAction;
import com.matcast.server.repository.MatchEventRepository;
import com.matcast.server.repository.MatchRepository;
import com.matcast.server.util.HubLogger;
import com.matcast.server.util.MatchRules;

/**
 * The match state machine. The only code that mutates a {@link Match}.
 *
 * Every mutation runs as
 * {@code lock(match) -> begin tx -> load -> validate -> mutate -> append events -> commit -> unlock},
 * so two commands racing on the same match are applied one after the other,
 * and an auto-finish condition fires exactly once: the second evaluation sees
 * FINISHED and does nothing.
 *
 * Nothing here touches sockets. Callers publish the returned snapshot.
 */
@Service
public class MatchService {

    private static final Logger log = LoggerFactory.getLogger(MatchService.class);
    private static final int MAX_EVENT_PAGE = 500;

    private final MatchRepository matchRepository;
    private final MatchEventRepository eventRepository;
    private final MatchEventLog eventLog;
    private final MatchLockManager locks;
    private final TransactionTemplate tx;
    private final HubMetrics metrics;
    private final Clock clock;

    public MatchService(MatchRepository matchRepository,
                        MatchEventRepository eventRepository,
                        MatchEventLog eventLog,
                        MatchLockManager locks,
                        PlatformTransactionManager transactionManager,
                        HubMetrics metrics,
                        Clock clock) {
        this.matchRepository = matchRepository;
        this.eventRepository = eventRepository;
        this.eventLog = eventLog;
        this.locks = locks;
        this.tx = new TransactionTemplate(transactionManager);
        this.metrics = metrics;
        this.clock = clock;
    }

    // ==================== SCORE ====================

    /**
     * Apply one referee score action, then evaluate auto-finish.
     *
     * @throws InvalidMatchStateException  match is not IN_PROGRESS
     * @throws InvalidParticipantException participant is not in this match
     */
    public MatchMutation applyScoreAction(String matchId, ScoreAction action, String participantId, String actorId) {
        return mutate(matchId, match -> {
            if (match.getState() != MatchState.IN_PROGRESS) {
                throw new InvalidMatchStateException(matchId, match.getState(), MatchState.IN_PROGRESS);
            }
            if (!match.hasParticipant(participantId)) {
                throw new InvalidParticipantException(matchId, participantId);
            }

            Instant now = clock.instant();
            Score score = match.scoreOf(participantId);
            ScoreView before = ScoreView.from(score);
            score.apply(action);
            ScoreView after = ScoreView.from(score);
            match.setUpdatedAt(now);

            List<MatchEvent> events = new ArrayList<>();
            events.add(eventLog.score(match, actorId, participantId, action, before, after, now));
            HubLogger.logScore(log, matchId, participantId, action.name(), after);

            boolean finished = evaluateAutoFinish(match, events, now);
            return new Outcome(events, finished);
        });
    }

    // ==================== TIMER ====================

    /**
     * Set the remaining time. Accepted in any state; auto-finish is only
     * evaluated while IN_PROGRESS.
     *
     * @throws InvalidValueException {@code newRemaining < 0}
     */
    public MatchMutation updateTimer(String matchId, int newRemaining, String actorId) {
        if (newRemaining < 0) {
            throw new InvalidValueException(matchId, "Time remaining cannot be negative");
        }
        return mutate(matchId, match -> {
            Instant now = clock.instant();
            int old = match.getTimeRemaining();
            match.setTimeRemaining(newRemaining);
            match.setUpdatedAt(now);

            List<MatchEvent> events = new ArrayList<>();
            events.add(eventLog.timer(match, actorId, old, newRemaining, now));

            boolean finished = match.getState() == MatchState.IN_PROGRESS && evaluateAutoFinish(match, events, now);
            return new Outcome(events, finished);
        });
    }

    // ==================== STATE ====================

    /**
     * Move the match along one edge of the transition table.
     *
     * @throws InvalidTransitionException the edge does not exist
     */
    public MatchMutation transitionState(String matchId, MatchState newState, String actorId) {
        return mutate(matchId, match -> {
            MatchState old = match.getState();
            if (!old.canTransitionTo(newState)) {
                throw new InvalidTransitionException(matchId, old, newState);
            }
            Instant now = clock.instant();
            match.setState(newState);
            match.setUpdatedAt(now);

            List<MatchEvent> events = new ArrayList<>();
            events.add(eventLog.stateChange(match, actorId, old, newState, now));
            HubLogger.logStateTransition(log, matchId, old.name(), newState.name(), actorId);

            // resuming a match whose finishing condition already holds ends it at once
            boolean finished = newState == MatchState.IN_PROGRESS && evaluateAutoFinish(match, events, now);
            return new Outcome(events, finished);
        });
    }

    /**
     * Finish an IN_PROGRESS match if a finishing condition holds. Caller holds
     * the match lock and is inside the transaction.
     */
    private boolean evaluateAutoFinish(Match match, List<MatchEvent> events, Instant now) {
        if (match.getState() != MatchState.IN_PROGRESS) {
            return false;
        }
        Optional<String> reason = MatchRules.autoFinishReason(match);
        if (reason.isEmpty()) {
            return false;
        }
        MatchState previous = match.getState();
        match.setState(MatchState.FINISHED);
        String winner = MatchRules.determineWinner(match).orElse(null);
        events.add(eventLog.autoFinish(match, previous, reason.get(), winner, now));
        HubLogger.logAutoFinish(log, match.getId(), reason.get(), winner);
        return true;
    }

    // ==================== LIFECYCLE HELPERS ====================

    public MatchMutation createMatch(CreateMatchRequest request, String actorId) {
        String id = request.getId() != null && !request.getId().isBlank()
                ? request.getId()
                : UUID.randomUUID().toString();
        if (request.getParticipant1().getId().equals(request.getParticipant2().getId())) {
            throw new InvalidValueException(id, "Participants must be different");
        }

        return locks.withMatchLock(id, () -> commit(id, () -> {
            if (matchRepository.existsById(id)) {
                throw new InvalidValueException(id, "Match already exists: " + id);
            }
            Instant now = clock.instant();
            Match match = new Match(id,
                    toParticipant(request.getParticipant1()),
                    toParticipant(request.getParticipant2()),
                    request.getDuration(), now);
            match.setCategory(request.getCategory());
            match.setDivision(request.getDivision());
            match.setTournamentId(request.getTournamentId());
            match.setRefereeId(request.getRefereeId());
            match.setRefereeName(request.getRefereeName());

            Match saved = matchRepository.saveAndFlush(match);
            MatchEvent created = eventLog.created(saved, actorId, now);
            log.info("[Match] Created {} ({} vs {})", id,
                    saved.getParticipant1().getId(), saved.getParticipant2().getId());
            return new MatchMutation(MatchSnapshot.from(saved), List.of(MatchEventView.from(created)), false);
        }));
    }

    public MatchMutation assignReferee(String matchId, String refereeId, String refereeName, String actorId) {
        return mutate(matchId, match -> {
            Instant now = clock.instant();
            String old = match.getRefereeId();
            match.setRefereeId(refereeId);
            match.setRefereeName(refereeName);
            match.setUpdatedAt(now);
            return new Outcome(List.of(eventLog.refereeAssigned(match, actorId, old, now)), false);
        });
    }

    // ==================== QUERIES ====================

    public MatchSnapshot getMatch(String matchId) {
        return findMatch(matchId).orElseThrow(() -> new MatchNotFoundException(matchId));
    }

    public Optional<MatchSnapshot> findMatch(String matchId) {
        return matchRepository.findById(matchId).map(MatchSnapshot::from);
    }

    /**
     * Newest-first page of the audit log.
     *
     * @param filter optional event type; null for all
     */
    public EventsPage listEvents(String matchId, MatchEventType filter, int limit, int offset) {
        if (!matchRepository.existsById(matchId)) {
            throw new MatchNotFoundException(matchId);
        }
        int size = Math.max(1, Math.min(limit, MAX_EVENT_PAGE));
        int skip = Math.max(0, offset);
        long total = eventRepository.countByMatchId(matchId);
        if (skip >= total) {
            return new EventsPage(matchId, total, size, skip, List.of());
        }

        // Pages are size-aligned, so [skip, skip + size) spans at most two of them.
        int first = skip / size;
        int within = skip % size;
        List<MatchEvent> rows = new ArrayList<>(fetchEvents(matchId, filter, PageRequest.of(first, size)));
        if (within != 0) {
            rows.addAll(fetchEvents(matchId, filter, PageRequest.of(first + 1, size)));
        }

        List<MatchEventView> page = rows.stream()
                .skip(within)
                .limit(size)
                .map(MatchEventView::from)
                .collect(Collectors.toList());
        return new EventsPage(matchId, total, size, skip, page);
    }

    private List<MatchEvent> fetchEvents(String matchId, MatchEventType filter, PageRequest window) {
        return filter == null
                ? eventRepository.findByMatchIdOrderByTimestampDesc(matchId, window)
                : eventRepository.findByMatchIdAndEventTypeOrderByTimestampDesc(matchId, filter, window);
    }

    /**
     * Delete the match's audit log and record that it happened.
     */
    public MatchEventView purgeEvents(String matchId, String actorId) {
        return locks.withMatchLock(matchId, () -> commit(matchId, () -> {
            if (!matchRepository.existsById(matchId)) {
                throw new MatchNotFoundException(matchId);
            }
            int deleted = eventRepository.deleteByMatchId(matchId);
            MatchEvent purged = eventLog.purged(matchId, actorId, deleted, clock.instant());
            log.warn("[Match] Purged {} events of match {} (actor={})", deleted, matchId, actorId);
            return MatchEventView.from(purged);
        }));
    }

    // ==================== INTERNALS ====================

    private record Outcome(List<MatchEvent> events, boolean autoFinished) {
    }

    private MatchMutation mutate(String matchId, Function<Match, Outcome> change) {
        MatchMutation result = locks.withMatchLock(matchId, () -> commit(matchId, () -> {
            Match match = matchRepository.findById(matchId)
                    .orElseThrow(() -> new MatchNotFoundException(matchId));
            Outcome outcome = change.apply(match);
            Match saved = matchRepository.saveAndFlush(match);
            List<MatchEventView> views = outcome.events().stream()
                    .map(MatchEventView::from)
                    .collect(Collectors.toList());
            return new MatchMutation(MatchSnapshot.from(saved), views, outcome.autoFinished());
        }));
        if (result.autoFinished()) {
            metrics.recordAutoFinished();
        }
        return result;
    }

    private <T> T commit(String matchId, Supplier<T> work) {
        try {
            return tx.execute(status -> work.get());
        } catch (OptimisticLockingFailureException e) {
            log.warn("[Match] Concurrent modification of match {}: {}", matchId, e.getMessage());
            throw new MatchConflictException(matchId, e);
        }
    }

    private static Participant toParticipant(CreateMatchRequest.ParticipantRequest p) {
        return new Participant(p.getId(), p.getName(), p.getTeam());
    }
}
