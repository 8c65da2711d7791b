package com.matcast.server.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.matcast.server.model.Match;
import com.matcast.server.model.MatchState;
import com.matcast.server.util.MatchRules;

/**
 * Full, self-contained state of a match at one instant. Broadcast as the
 * payload of MATCH_UPDATE; applying the same snapshot twice is harmless,
 * which is what makes duplicate delivery acceptable.
 *
 * {@code winnerId} is only present once the match is FINISHED, and stays
 * null for a draw.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatchSnapshot(
        String id,
        ParticipantView participant1,
        ParticipantView participant2,
        String category,
        String division,
        int duration,
        int timeRemaining,
        MatchState state,
        ScoreView score1,
        ScoreView score2,
        RefereeView referee,
        String tournamentId,
        String winnerId,
        String createdAt,
        String updatedAt,
        long version
) {

    public static MatchSnapshot from(Match match) {
        RefereeView referee = match.getRefereeId() == null
                ? null
                : new RefereeView(match.getRefereeId(), match.getRefereeName());
        String winner = match.getState() == MatchState.FINISHED
                ? MatchRules.determineWinner(match).orElse(null)
                : null;
        return new MatchSnapshot(
                match.getId(),
                ParticipantView.from(match.getParticipant1()),
                ParticipantView.from(match.getParticipant2()),
                match.getCategory(),
                match.getDivision(),
                match.getDuration(),
                match.getTimeRemaining(),
                match.getState(),
                ScoreView.from(match.getScore1()),
                ScoreView.from(match.getScore2()),
                referee,
                match.getTournamentId(),
                winner,
                match.getCreatedAt() != null ? match.getCreatedAt().toString() : null,
                match.getUpdatedAt() != null ? match.getUpdatedAt().toString() : null,
                match.getVersion());
    }
}
