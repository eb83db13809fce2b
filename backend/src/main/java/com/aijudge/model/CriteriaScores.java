package com.aijudge.model;

/**
 * Per-criterion rubric scores, each in {@code [0, 20]}.
 */
public record CriteriaScores(
        int relevance,
        int coherence,
        int evidence,
        int persuasiveness,
        int rebuttal
) {
    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 20;

    private static final int NEUTRAL_SCORE = 10;

    public CriteriaScores {
        requireInRange("relevance", relevance);
        requireInRange("coherence", coherence);
        requireInRange("evidence", evidence);
        requireInRange("persuasiveness", persuasiveness);
        requireInRange("rebuttal", rebuttal);
    }

    public static CriteriaScores zero() {
        return new CriteriaScores(0, 0, 0, 0, 0);
    }

    public static CriteriaScores neutral() {
        return new CriteriaScores(NEUTRAL_SCORE, NEUTRAL_SCORE, NEUTRAL_SCORE, NEUTRAL_SCORE, NEUTRAL_SCORE);
    }

    private static void requireInRange(String field, int value) {
        if (value < MIN_SCORE || value > MAX_SCORE) {
            throw new IllegalArgumentException(
                    "criteria_scores." + field + " must be between " + MIN_SCORE + " and " + MAX_SCORE
            );
        }
    }
}
