package com.trendradar.model;

public final class ScoreBreakdown {
    public final double rankScore;
    public final double frequencyScore;
    public final double keywordScore;
    public final double finalScore;

    public ScoreBreakdown(double rankScore, double frequencyScore, double keywordScore, double finalScore) {
        this.rankScore = rankScore;
        this.frequencyScore = frequencyScore;
        this.keywordScore = keywordScore;
        this.finalScore = finalScore;
    }
}
