package com.matcast.server.util;

import java.util.Optional;

import com.matcast.server.model.Match;
import com.matcast.server.model.Score;

/**
 * Pure scoring rules. No I/O and no mutation; safe to call from any thread
 * on a match the caller already holds the lock for.
 */
public final class MatchRules {

    public static final String REASON_SUBMISSION = "Submission";
    public static final String REASON_DISQUALIFICATION = "Disqualification";
    public static final String REASON_TIME_EXPIRED = "Time expired";

    private MatchRules() {
    }

    /**
     * Why the match should end now, or empty if it should keep going.
     * Only meaningful for IN_PROGRESS matches; the caller checks the state.
     */
    public static Optional<String> autoFinishReason(Match match) {
        Score s1 = match.getScore1();
        Score s2 = match.getScore2();

        if (s1.getSubmissions() > 0 || s2.getSubmissions() > 0) {
            return Optional.of(REASON_SUBMISSION);
        }
        if (s1.isDisqualified() || s2.isDisqualified()) {
            return Optional.of(REASON_DISQUALIFICATION);
        }
        if (match.getTimeRemaining() <= 0) {
            return Optional.of(REASON_TIME_EXPIRED);
        }
        return Optional.empty();
    }

    /**
     * Winner by the tie-break ladder: submission, disqualification, points,
     * advantages, fewer penalties. Empty means a draw.
     */
    public static Optional<String> determineWinner(Match match) {
        Score s1 = match.getScore1();
        Score s2 = match.getScore2();
        String p1 = match.getParticipant1().getId();
        String p2 = match.getParticipant2().getId();

        if (s1.getSubmissions() > 0) return Optional.of(p1);
        if (s2.getSubmissions() > 0) return Optional.of(p2);

        if (s1.isDisqualified()) return Optional.of(p2);
        if (s2.isDisqualified()) return Optional.of(p1);

        if (s1.getPoints() != s2.getPoints()) {
            return Optional.of(s1.getPoints() > s2.getPoints() ? p1 : p2);
        }
        if (s1.getAdvantages() != s2.getAdvantages()) {
            return Optional.of(s1.getAdvantages() > s2.getAdvantages() ? p1 : p2);
        }
        if (s1.getPenalties() != s2.getPenalties()) {
            return Optional.of(s1.getPenalties() < s2.getPenalties() ? p1 : p2);
        }
        return Optional.empty();
    }
}
