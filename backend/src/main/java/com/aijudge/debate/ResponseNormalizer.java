package com.aijudge.debate;

import com.aijudge.model.WordBand;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Cleans generated text and forces it into a word band by padding and trimming.
 * Never throws for any string input.
 */
public class ResponseNormalizer {

    static final String FILLER_SENTENCE =
            "Therefore, based on the foregoing reasons, this position is justified and the requested remedy follows logically.";

    private static final Pattern LEADING_FENCE = Pattern.compile("^```[A-Za-z0-9_-]*[ \\t]*\\r?\\n");
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\r?\\n?```\\s*$");
    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public String normalize(String raw, WordBand band) {
        return normalize(raw, band.minWords(), band.maxWords());
    }

    /**
     * Cleans and fits {@code raw} into the band. The result is a fixed point: cleaning it changes
     * nothing, so normalizing it again returns it unchanged. Nested fences or quotes, and quotes
     * exposed by a hard cut, are removed by further passes. Every extra pass shortens the text or
     * ends it with filler.
     */
    public String normalize(String raw, int minWords, int maxWords) {
        String result = fitToBand(clean(raw), minWords, maxWords);
        String recleaned = clean(result);
        while (!recleaned.equals(result)) {
            result = fitToBand(recleaned, minWords, maxWords);
            recleaned = clean(result);
        }
        return result;
    }

    /**
     * Strips code fences and one layer of enclosing quotes, and collapses spaces and tabs.
     * Line breaks are kept.
     */
    public String clean(String raw) {
        String text = raw == null ? "" : raw.trim();
        if (text.startsWith("```")) {
            String withoutLeading = LEADING_FENCE.matcher(text).replaceFirst("");
            if (!withoutLeading.equals(text) && TRAILING_FENCE.matcher(withoutLeading).find()) {
                text = TRAILING_FENCE.matcher(withoutLeading).replaceFirst("").trim();
            }
        }
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last = text.charAt(text.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                text = text.substring(1, text.length() - 1).trim();
            }
        }
        return HORIZONTAL_WHITESPACE.matcher(text).replaceAll(" ");
    }

    private static String fitToBand(String cleaned, int minWords, int maxWords) {
        return trimToMaximum(padToMinimum(cleaned, minWords), minWords, maxWords);
    }

    public static int countWords(String text) {
        return tokens(text).length;
    }

    private static String padToMinimum(String text, int minWords) {
        if (countWords(text) >= minWords) {
            return text;
        }
        StringBuilder padded = new StringBuilder(text);
        int words = countWords(text);
        int fillerWords = countWords(FILLER_SENTENCE);
        while (words < minWords) {
            if (padded.length() > 0) {
                padded.append(' ');
            }
            padded.append(FILLER_SENTENCE);
            words += fillerWords;
        }
        return padded.toString();
    }

    private static String trimToMaximum(String text, int minWords, int maxWords) {
        String[] tokens = tokens(text);
        maxWords = Math.max(0, maxWords);
        if (tokens.length <= maxWords) {
            return text;
        }
        String prefix = String.join(" ", Arrays.copyOfRange(tokens, 0, maxWords));
        int lastTerminal = Math.max(prefix.lastIndexOf('.'), Math.max(prefix.lastIndexOf('!'), prefix.lastIndexOf('?')));
        if (lastTerminal >= 0) {
            String sentenceCut = prefix.substring(0, lastTerminal + 1);
            if (countWords(sentenceCut) >= minWords) {
                return sentenceCut;
            }
        }
        return prefix;
    }

    private static String[] tokens(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            return new String[0];
        }
        return WHITESPACE.split(trimmed);
    }
}
