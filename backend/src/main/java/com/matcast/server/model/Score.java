package com.matcast.server.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * Four non-negative counters for one participant. There are no setters:
 * the only way to change a score is {@link #apply(ScoreAction)}.
 */
@Embeddable
public class Score {

    @Column(nullable = false)
    private int points;

    @Column(nullable = false)
    private int advantages;

    @Column(nullable = false)
    private int penalties;

    @Column(nullable = false)
    private int submissions;

    public Score() {
    }

    public Score(int points, int advantages, int penalties, int submissions) {
        this.points = points;
        this.advantages = advantages;
        this.penalties = penalties;
        this.submissions = submissions;
    }

    public void apply(ScoreAction action) {
        switch (action) {
            case POINTS_2:
                points += 2;
                break;
            case ADVANTAGE:
                advantages += 1;
                break;
            case PENALTY:
                penalties += 1;
                break;
            case SUBMISSION:
                submissions += 1;
                break;
            default:
                throw new IllegalArgumentException("Unknown score action: " + action);
        }
    }

    /** Three penalties disqualify. */
    public boolean isDisqualified() {
        return penalties >= 3;
    }

    public int getPoints() { return points; }
    public int getAdvantages() { return advantages; }
    public int getPenalties() { return penalties; }
    public int getSubmissions() { return submissions; }

    @Override
    public String toString() {
        return "Score{points=" + points + ", advantages=" + advantages
                + ", penalties=" + penalties + ", submissions=" + submissions + "}";
    }
}
