package com.matcast.server.controller;

import java.util.Locale;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.matcast.server.dto.ChannelStats;
import com.matcast.server.dto.EventsPage;
import com.matcast.server.dto.MatchSnapshot;
import com.matcast.server.model.MatchEventType;
import com.matcast.server.service.MatchService;
import com.matcast.server.socket.BroadcastHub;
import com.matcast.server.socket.Channel;

/**
 * Read-only match queries. Clients that lost their socket recover state here.
 *
 * Endpoints:
 *   GET /api/matches/{id}              current snapshot
 *   GET /api/matches/{id}/events       audit log, newest first
 *   GET /api/matches/{id}/connections  local referee/viewer counts
 */
@RestController
@RequestMapping("/api/matches")
public class MatchController {

    private final MatchService matchService;
    private final BroadcastHub hub;

    public MatchController(MatchService matchService, BroadcastHub hub) {
        this.matchService = matchService;
        this.hub = hub;
    }

    @GetMapping("/{matchId}")
    public ResponseEntity<MatchSnapshot> getMatch(@PathVariable String matchId) {
        return ResponseEntity.ok(matchService.getMatch(matchId));
    }

    @GetMapping("/{matchId}/events")
    public ResponseEntity<EventsPage> getEvents(@PathVariable String matchId,
                                                @RequestParam(required = false) String type,
                                                @RequestParam(defaultValue = "50") int limit,
                                                @RequestParam(defaultValue = "0") int offset) {
        MatchEventType filter = type == null || type.isBlank()
                ? null
                : MatchEventType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        return ResponseEntity.ok(matchService.listEvents(matchId, filter, limit, offset));
    }

    @GetMapping("/{matchId}/connections")
    public ResponseEntity<ChannelStats> getConnections(@PathVariable String matchId) {
        return ResponseEntity.ok(hub.stats(Channel.match(matchId)));
    }
}
