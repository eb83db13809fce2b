package com.aijudge.model;

import java.util.List;

/**
 * The three sequential exchange steps of a debate.
 */
public enum DebateRound {
    OPENING(1, "Opening"),
    COUNTER(2, "Counter-Argument"),
    REBUTTAL(3, "Rebuttal");

    private static final List<DebateRound> ORDERED_VALUES = List.of(OPENING, COUNTER, REBUTTAL);

    private final int number;
    private final String label;

    DebateRound(int number, String label) {
        this.number = number;
        this.label = label;
    }

    public int number() {
        return number;
    }

    public String label() {
        return label;
    }

    public static List<DebateRound> orderedValues() {
        return ORDERED_VALUES;
    }

    public static DebateRound fromNumber(int number) {
        for (DebateRound round : ORDERED_VALUES) {
            if (round.number == number) {
                return round;
            }
        }
        throw new IllegalArgumentException("round_number must be between 1 and " + ORDERED_VALUES.size());
    }
}
