package com.matcast.server.support;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import org.springframework.data.domain.Pageable;
import org.springframework.transaction.PlatformTransactionManager;

import com.matcast.server.dto.CreateMatchRequest;
import com.matcast.server.model.Match;
import com.matcast.server.model.MatchEvent;
import com.matcast.server.model.MatchEventType;
import com.matcast.server.repository.MatchEventRepository;
import com.matcast.server.repository.MatchRepository;
import com.matcast.server.service.HubMetrics;
import com.matcast.server.service.MatchEventLog;
import com.matcast.server.service.MatchLockManager;
import com.matcast.server.service.MatchService;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * A {@link MatchService} over in-memory repository doubles. The repositories
 * are Mockito mocks backed by real collections, so tests can still re-stub
 * single calls (for example to simulate an optimistic-lock failure).
 */
public final class MatchFixtures {

    public final Map<String, Match> matches = new ConcurrentHashMap<>();
    public final List<MatchEvent> events = new CopyOnWriteArrayList<>();
    public final MatchRepository matchRepository = mock(MatchRepository.class);
    public final MatchEventRepository eventRepository = mock(MatchEventRepository.class);
    public final HubMetrics metrics = new HubMetrics(new SimpleMeterRegistry());
    public final MutableClock clock;
    public final MatchService service;

    public MatchFixtures(MutableClock clock) {
        this.clock = clock;
        stubMatches();
        stubEvents();
        this.service = new MatchService(matchRepository, eventRepository, new MatchEventLog(eventRepository),
                MatchLockManager.localOnly(), mock(PlatformTransactionManager.class), metrics, clock);
    }

    /** Create a SCHEDULED match between p1 and p2. */
    public Match createMatch(String id, int duration, String tournamentId) {
        CreateMatchRequest req = new CreateMatchRequest();
        req.setId(id);
        req.setParticipant1(new CreateMatchRequest.ParticipantRequest("p1", "Ana", "Alpha"));
        req.setParticipant2(new CreateMatchRequest.ParticipantRequest("p2", "Bea", "Beta"));
        req.setDuration(duration);
        req.setCategory("Adult");
        req.setDivision("Black");
        req.setTournamentId(tournamentId);
        service.createMatch(req, "organizer");
        return matches.get(id);
    }

    public List<MatchEvent> eventsOf(String matchId, MatchEventType type) {
        return events.stream()
                .filter(e -> e.getMatchId().equals(matchId) && e.getEventType() == type)
                .collect(Collectors.toList());
    }

    private void stubMatches() {
        when(matchRepository.findById(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(matches.get(inv.<String>getArgument(0))));
        when(matchRepository.existsById(anyString()))
                .thenAnswer(inv -> matches.containsKey(inv.<String>getArgument(0)));
        when(matchRepository.saveAndFlush(any(Match.class))).thenAnswer(inv -> {
            Match m = inv.getArgument(0);
            matches.put(m.getId(), m);
            return m;
        });
    }

    private void stubEvents() {
        when(eventRepository.save(any(MatchEvent.class))).thenAnswer(inv -> {
            MatchEvent e = inv.getArgument(0);
            events.add(e);
            return e;
        });
        when(eventRepository.findByMatchIdOrderByTimestampDesc(anyString(), any(Pageable.class)))
                .thenAnswer(inv -> newestFirst(inv.getArgument(0), null, inv.getArgument(1)));
        when(eventRepository.findByMatchIdAndEventTypeOrderByTimestampDesc(
                anyString(), any(MatchEventType.class), any(Pageable.class)))
                .thenAnswer(inv -> newestFirst(inv.getArgument(0), inv.getArgument(1), inv.getArgument(2)));
        when(eventRepository.countByMatchId(anyString()))
                .thenAnswer(inv -> events.stream().filter(e -> e.getMatchId().equals(inv.getArgument(0))).count());
        when(eventRepository.deleteByMatchId(anyString())).thenAnswer(inv -> {
            String matchId = inv.getArgument(0);
            List<MatchEvent> doomed = events.stream()
                    .filter(e -> e.getMatchId().equals(matchId))
                    .collect(Collectors.toList());
            events.removeAll(doomed);
            return doomed.size();
        });
    }

    private List<MatchEvent> newestFirst(String matchId, MatchEventType type, Pageable page) {
        List<MatchEvent> rows = events.stream()
                .filter(e -> e.getMatchId().equals(matchId))
                .filter(e -> type == null || e.getEventType() == type)
                .collect(Collectors.toCollection(ArrayList::new));
        // later inserts win ties on timestamp
        Collections.reverse(rows);
        rows.sort(Comparator.comparing(MatchEvent::getTimestamp).reversed());
        return rows.stream().skip(page.getOffset()).limit(page.getPageSize()).collect(Collectors.toList());
    }
}
