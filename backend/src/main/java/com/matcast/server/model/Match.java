package com.matcast.server.model;

import java.time.Instant;
import java.util.Objects;

import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

/**
 * Authoritative record of one match.
 *
 * Only {@code MatchService} mutates it, always under that match's lock.
 * The {@link Version} column turns a lost race between two server
 * processes into an optimistic-lock failure instead of a silent overwrite.
 */
@Entity
@Table(name = "matches")
public class Match {

    @Id
    @Column(length = 64)
    private String id;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "id", column = @Column(name = "participant1_id", nullable = false, length = 64)),
            @AttributeOverride(name = "name", column = @Column(name = "participant1_name", length = 120)),
            @AttributeOverride(name = "team", column = @Column(name = "participant1_team", length = 120))
    })
    private Participant participant1;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "id", column = @Column(name = "participant2_id", nullable = false, length = 64)),
            @AttributeOverride(name = "name", column = @Column(name = "participant2_name", length = 120)),
            @AttributeOverride(name = "team", column = @Column(name = "participant2_team", length = 120))
    })
    private Participant participant2;

    @Column(length = 60)
    private String category;

    @Column(length = 60)
    private String division;

    @Column(name = "duration_seconds", nullable = false)
    private int duration;

    @Column(name = "time_remaining", nullable = false)
    private int timeRemaining;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MatchState state = MatchState.SCHEDULED;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "points", column = @Column(name = "score1_points", nullable = false)),
            @AttributeOverride(name = "advantages", column = @Column(name = "score1_advantages", nullable = false)),
            @AttributeOverride(name = "penalties", column = @Column(name = "score1_penalties", nullable = false)),
            @AttributeOverride(name = "submissions", column = @Column(name = "score1_submissions", nullable = false))
    })
    private Score score1 = new Score();

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "points", column = @Column(name = "score2_points", nullable = false)),
            @AttributeOverride(name = "advantages", column = @Column(name = "score2_advantages", nullable = false)),
            @AttributeOverride(name = "penalties", column = @Column(name = "score2_penalties", nullable = false)),
            @AttributeOverride(name = "submissions", column = @Column(name = "score2_submissions", nullable = false))
    })
    private Score score2 = new Score();

    @Column(name = "referee_id", length = 64)
    private String refereeId;

    @Column(name = "referee_name", length = 120)
    private String refereeName;

    @Column(name = "tournament_id", length = 64)
    private String tournamentId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private long version;

    protected Match() {
    }

    public Match(String id, Participant participant1, Participant participant2, int duration, Instant now) {
        this.id = id;
        this.participant1 = participant1;
        this.participant2 = participant2;
        this.duration = duration;
        this.timeRemaining = duration;
        this.createdAt = now;
        this.updatedAt = now;
    }

    // ==================== PARTICIPANTS ====================

    public boolean hasParticipant(String participantId) {
        return participantId != null
                && (participantId.equals(participant1.getId()) || participantId.equals(participant2.getId()));
    }

    /**
     * Score of the given participant; callers check {@link #hasParticipant} first.
     */
    public Score scoreOf(String participantId) {
        if (Objects.equals(participantId, participant1.getId())) {
            return score1;
        }
        if (Objects.equals(participantId, participant2.getId())) {
            return score2;
        }
        throw new IllegalArgumentException("Not a participant: " + participantId);
    }

    // Getters and Setters
    public String getId() { return id; }
    public Participant getParticipant1() { return participant1; }
    public Participant getParticipant2() { return participant2; }
    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }
    public String getDivision() { return division; }
    public void setDivision(String division) { this.division = division; }
    public int getDuration() { return duration; }
    public int getTimeRemaining() { return timeRemaining; }
    public void setTimeRemaining(int timeRemaining) { this.timeRemaining = timeRemaining; }
    public MatchState getState() { return state; }
    public void setState(MatchState state) { this.state = state; }
    public Score getScore1() { return score1; }
    public Score getScore2() { return score2; }
    public String getRefereeId() { return refereeId; }
    public void setRefereeId(String refereeId) { this.refereeId = refereeId; }
    public String getRefereeName() { return refereeName; }
    public void setRefereeName(String refereeName) { this.refereeName = refereeName; }
    public String getTournamentId() { return tournamentId; }
    public void setTournamentId(String tournamentId) { this.tournamentId = tournamentId; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public long getVersion() { return version; }
}
