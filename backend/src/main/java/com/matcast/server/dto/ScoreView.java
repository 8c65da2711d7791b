package com.matcast.server.dto;

import com.matcast.server.model.Score;

public record ScoreView(int points, int advantages, int penalties, int submissions) {

    public static ScoreView from(Score s) {
        return new ScoreView(s.getPoints(), s.getAdvantages(), s.getPenalties(), s.getSubmissions());
    }
}
