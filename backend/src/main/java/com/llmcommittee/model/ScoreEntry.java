package com.llmcommittee.model;

import java.util.List;

/**
 * Score of one backend, either from a single judge or aggregated over all judges.
 */
public record ScoreEntry(
        String backendId,
        int score,
        List<String> strengths,
        List<String> weaknesses
) {
    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 100;
    public static final int NEUTRAL_SCORE = 50;

    public ScoreEntry {
        if (score < MIN_SCORE || score > MAX_SCORE) {
            throw new IllegalArgumentException("score must be between " + MIN_SCORE + " and " + MAX_SCORE);
        }
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        weaknesses = weaknesses == null ? List.of() : List.copyOf(weaknesses);
    }

    public static ScoreEntry neutral(String backendId) {
        return new ScoreEntry(backendId, NEUTRAL_SCORE, List.of(), List.of());
    }
}
