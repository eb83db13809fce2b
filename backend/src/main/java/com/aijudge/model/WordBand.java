package com.aijudge.model;

/**
 * Inclusive word-count range an argument or reasoning text must fall in.
 */
public record WordBand(
        int minWords,
        int maxWords
) {
    public WordBand {
        if (minWords < 0) {
            throw new IllegalArgumentException("minWords must not be negative");
        }
        if (maxWords < minWords) {
            throw new IllegalArgumentException("maxWords must be greater than or equal to minWords");
        }
    }

    public boolean contains(int wordCount) {
        return wordCount >= minWords && wordCount <= maxWords;
    }

    /**
     * Completion token ceiling for a text of {@code maxWords} words.
     */
    public int tokenCeiling() {
        return tokenCeiling(maxWords);
    }

    public static int tokenCeiling(int words) {
        return (int) Math.ceil(words * 1.33d);
    }
}
