package com.matcast.server.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

/**
 * Append-only audit record. No setters; rows are only ever removed by an
 * explicit purge, which itself appends an EVENTS_PURGED record.
 */
@Entity
@Table(name = "match_events", indexes = @Index(name = "idx_match_events_match_ts", columnList = "match_id, event_timestamp"))
public class MatchEvent {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "match_id", nullable = false, length = 64)
    private String matchId;

    @Column(name = "event_timestamp", nullable = false)
    private Instant timestamp;

    @Column(name = "actor_id", nullable = false, length = 64)
    private String actorId;

    @Column(name = "participant_id", length = 64)
    private String participantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 20)
    private MatchEventType eventType;

    @Column(name = "event_value")
    private Integer value;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata", length = 2000)
    private Map<String, Object> metadata = new LinkedHashMap<>();

    protected MatchEvent() {
    }

    public MatchEvent(String matchId, Instant timestamp, String actorId, String participantId,
                      MatchEventType eventType, Integer value, Map<String, Object> metadata) {
        this.id = UUID.randomUUID().toString();
        this.matchId = matchId;
        this.timestamp = timestamp;
        this.actorId = actorId;
        this.participantId = participantId;
        this.eventType = eventType;
        this.value = value;
        if (metadata != null) {
            this.metadata = new LinkedHashMap<>(metadata);
        }
    }

    public String getId() { return id; }
    public String getMatchId() { return matchId; }
    public Instant getTimestamp() { return timestamp; }
    public String getActorId() { return actorId; }
    public String getParticipantId() { return participantId; }
    public MatchEventType getEventType() { return eventType; }
    public Integer getValue() { return value; }
    public Map<String, Object> getMetadata() { return Collections.unmodifiableMap(metadata); }
}
