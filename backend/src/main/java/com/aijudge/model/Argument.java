package com.aijudge.model;

import java.util.Objects;

/**
 * One lawyer's text for one round. The word count is always derived from the content.
 */
public record Argument(
        AgentKind lawyer,
        int roundNumber,
        String content,
        int wordCount
) {
    public Argument {
        Objects.requireNonNull(lawyer, "lawyer is required");
        DebateRound.fromNumber(roundNumber);
        content = content == null ? "" : content;
        wordCount = countWords(content);
    }

    public Argument(AgentKind lawyer, int roundNumber, String content) {
        this(lawyer, roundNumber, content, 0);
    }

    /**
     * Builds an argument for a live debate, rejecting content outside the configured word band.
     */
    public static Argument create(AgentKind lawyer, DebateRound round, String content, WordBand band) {
        Objects.requireNonNull(round, "round is required");
        Objects.requireNonNull(band, "band is required");
        Argument argument = new Argument(lawyer, round.number(), content);
        if (!band.contains(argument.wordCount())) {
            throw new IllegalArgumentException(
                    "Argument for "
                            + lawyer.wireValue()
                            + " in round "
                            + round.number()
                            + " has "
                            + argument.wordCount()
                            + " words; expected "
                            + band.minWords()
                            + "-"
                            + band.maxWords()
            );
        }
        return argument;
    }

    public DebateRound round() {
        return DebateRound.fromNumber(roundNumber);
    }

    public static int countWords(String text) {
        String normalized = text == null ? "" : text.trim();
        if (normalized.isEmpty()) {
            return 0;
        }
        return normalized.split("\\s+").length;
    }
}
