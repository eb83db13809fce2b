package com.aijudge.debate;

import com.aijudge.model.WordBand;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResponseNormalizerTest {

    private final ResponseNormalizer normalizer = new ResponseNormalizer();

    @Test
    void cleanStripsFencesQuotesAndRepeatedSpaces() {
        assertEquals("Hello world.", normalizer.clean("```text\nHello world.\n```"));
        assertEquals("Quoted text", normalizer.clean("\"Quoted text\""));
        assertEquals("a b c", normalizer.clean("a   b\t\tc"));
        assertEquals("first line\nsecond line", normalizer.clean("first  line\nsecond line"));
    }

    @Test
    void cleanLeavesUnterminatedFenceInPlace() {
        assertEquals("```json\n{\"a\": 1}", normalizer.clean("```json\n{\"a\": 1}"));
    }

    @Test
    void normalizePadsShortTextWithFillerSentences() {
        String normalized = normalizer.normalize("One two three.", 20, 40);

        assertTrue(normalized.startsWith("One two three. "));
        assertTrue(normalized.contains(ResponseNormalizer.FILLER_SENTENCE));
        int words = ResponseNormalizer.countWords(normalized);
        assertTrue(words >= 20 && words <= 40, "words=" + words);
    }

    @Test
    void normalizeTrimsAtLastSentenceBoundaryWhenMinimumSurvives() {
        String text = String.join(" ", Collections.nCopies(10, "Word word word word end."));

        String normalized = normalizer.normalize(text, 10, 23);

        assertEquals(20, ResponseNormalizer.countWords(normalized));
        assertTrue(normalized.endsWith("end."));
    }

    @Test
    void normalizeCutsAtWordLimitWhenSentenceBoundaryIsTooEarly() {
        String text = "alpha. " + String.join(" ", Collections.nCopies(30, "beta"));

        String normalized = normalizer.normalize(text, 10, 20);

        assertEquals(20, ResponseNormalizer.countWords(normalized));
        assertTrue(normalized.startsWith("alpha. beta"));
    }

    @Test
    void normalizeHandlesNullAndEmptyInput() {
        assertEquals("", normalizer.normalize(null, 0, 10));
        assertEquals(10, ResponseNormalizer.countWords(normalizer.normalize(null, 5, 10)));
        assertEquals(0, ResponseNormalizer.countWords("   "));
    }

    @Test
    void normalizedOutputStaysInsideArgumentBand() {
        WordBand band = new WordBand(250, 350);
        String[] inputs = {
                "",
                "Short answer.",
                String.join(" ", Collections.nCopies(120, "The record shows harm.")),
                "```\n" + String.join(" ", Collections.nCopies(90, "Counsel objects here.")) + "\n```"
        };

        for (String input : inputs) {
            int words = ResponseNormalizer.countWords(normalizer.normalize(input, band));
            assertTrue(band.contains(words), "words=" + words);
        }
    }

    @Test
    void normalizingNormalizedTextReturnsItUnchanged() {
        WordBand band = new WordBand(250, 350);
        String body = String.join(" ", Collections.nCopies(70, "The record shows harm.")) + " end";
        String[] inputs = {
                "\"\"" + body + "\"\"",
                "'\"" + body + "\"'",
                "```\n```text\n" + body + "\n```\n```",
                "\"" + String.join(" ", Collections.nCopies(400, "word")) + "\"",
                "\"" + String.join(" ", Collections.nCopies(100, "Short claim.")) + " \"tail\"",
                "Short answer.",
                body
        };

        for (String input : inputs) {
            String once = normalizer.normalize(input, band);
            String twice = normalizer.normalize(once, band);

            assertEquals(once, twice);
            assertEquals(once, normalizer.clean(once));
            assertTrue(band.contains(ResponseNormalizer.countWords(once)), "words=" + ResponseNormalizer.countWords(once));
        }
    }

    @Test
    void nestedQuotesAreRemovedByNormalize() {
        String body = String.join(" ", Collections.nCopies(70, "The record shows harm.")) + " end";

        String normalized = normalizer.normalize("\"\"" + body + "\"\"", new WordBand(250, 350));

        assertEquals(body, normalized);
    }
}
