package com.matcast.server.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Input for {@code MatchService.createMatch}. The id is optional; a UUID is
 * generated when it is absent.
 */
public class CreateMatchRequest {

    @Pattern(regexp = "[A-Za-z0-9_-]{1,64}", message = "id may only contain letters, digits, '-' and '_'")
    private String id;

    @NotNull(message = "participant1 is required")
    @Valid
    private ParticipantRequest participant1;

    @NotNull(message = "participant2 is required")
    @Valid
    private ParticipantRequest participant2;

    private String category;
    private String division;

    @Min(value = 1, message = "Duration must be at least 1 second")
    @Max(value = 7200, message = "Duration cannot exceed 2 hours")
    private int duration;

    private String tournamentId;
    private String refereeId;
    private String refereeName;

    public static class ParticipantRequest {
        @NotBlank(message = "participant id is required")
        private String id;
        private String name;
        private String team;

        public ParticipantRequest() {
        }

        public ParticipantRequest(String id, String name, String team) {
            this.id = id;
            this.name = name;
            this.team = team;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getTeam() { return team; }
        public void setTeam(String team) { this.team = team; }
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public ParticipantRequest getParticipant1() { return participant1; }
    public void setParticipant1(ParticipantRequest participant1) { this.participant1 = participant1; }
    public ParticipantRequest getParticipant2() { return participant2; }
    public void setParticipant2(ParticipantRequest participant2) { this.participant2 = participant2; }
    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }
    public String getDivision() { return division; }
    public void setDivision(String division) { this.division = division; }
    public int getDuration() { return duration; }
    public void setDuration(int duration) { this.duration = duration; }
    public String getTournamentId() { return tournamentId; }
    public void setTournamentId(String tournamentId) { this.tournamentId = tournamentId; }
    public String getRefereeId() { return refereeId; }
    public void setRefereeId(String refereeId) { this.refereeId = refereeId; }
    public String getRefereeName() { return refereeName; }
    public void setRefereeName(String refereeName) { this.refereeName = refereeName; }
}
