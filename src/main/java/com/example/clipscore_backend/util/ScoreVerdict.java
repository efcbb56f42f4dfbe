package com.example.clipscore_backend.util;

/**
 * Coarse editorial band for a final score.
 */
public enum ScoreVerdict {
    EXCELLENT(8.5, "Outstanding example"),
    GOOD(7.0, "Strong category match"),
    MODERATE(5.5, "Some elements present"),
    POOR(0.0, "Does not fit category");

    private final double minScore;
    private final String description;

    ScoreVerdict(double minScore, String description) {
        this.minScore = minScore;
        this.description = description;
    }

    public double minScore() {
        return minScore;
    }

    public String description() {
        return description;
    }

    public static ScoreVerdict fromScore(double score) {
        for (ScoreVerdict verdict : values()) {
            if (score >= verdict.minScore) {
                return verdict;
            }
        }
        return POOR;
    }
}
