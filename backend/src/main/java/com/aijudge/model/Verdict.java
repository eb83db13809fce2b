package com.aijudge.model;

import java.util.Objects;

/**
 * Structured judge decision. Scores are in {@code [0, 100]}.
 */
public record Verdict(
        int emotionalScore,
        int logicalScore,
        Winner winner,
        String reasoning,
        CriteriaScores criteriaScores
) {
    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 100;

    static final String PLACEHOLDER_REASONING =
            "Pending: debate is still in progress; a detailed verdict will appear when all rounds finish.";

    public Verdict {
        requireInRange("emotional_score", emotionalScore);
        requireInRange("logical_score", logicalScore);
        Objects.requireNonNull(winner, "winner is required");
        reasoning = reasoning == null ? "" : reasoning;
        criteriaScores = criteriaScores == null ? CriteriaScores.zero() : criteriaScores;
    }

    /**
     * Verdict shown while a debate has not been judged yet.
     */
    public static Verdict placeholder() {
        return new Verdict(0, 0, Winner.TIE, PLACEHOLDER_REASONING, CriteriaScores.zero());
    }

    public Verdict withReasoning(String nextReasoning) {
        return new Verdict(emotionalScore, logicalScore, winner, nextReasoning, criteriaScores);
    }

    public static int clampScore(long value) {
        return (int) Math.max(MIN_SCORE, Math.min(MAX_SCORE, value));
    }

    private static void requireInRange(String field, int value) {
        if (value < MIN_SCORE || value > MAX_SCORE) {
            throw new IllegalArgumentException(field + " must be between " + MIN_SCORE + " and " + MAX_SCORE);
        }
    }
}
