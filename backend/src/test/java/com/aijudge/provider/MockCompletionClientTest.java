package com.aijudge.provider;

import com.aijudge.debate.VerdictExtraction;
import com.aijudge.debate.VerdictExtractor;
import com.aijudge.model.Argument;
import com.aijudge.model.VerdictSource;
import com.aijudge.model.Winner;
import com.aijudge.model.WordBand;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MockCompletionClientTest {

    private final MockCompletionClient client = new MockCompletionClient();

    @Test
    void sameRequestYieldsSameText() {
        CompletionRequest request = new CompletionRequest("Round: Opening.", "Case: deposit dispute", 0.8d, 466);

        assertEquals(client.generate(request), client.generate(request));
    }

    @Test
    void differentPromptsYieldDifferentText() {
        String first = client.generate(new CompletionRequest("Round: Opening.", "Case: deposit dispute", 0.8d, 466));
        String second = client.generate(new CompletionRequest("Round: Rebuttal.", "Case: deposit dispute", 0.8d, 466));

        assertNotEquals(first, second);
    }

    @Test
    void argumentProseFitsArgumentBand() {
        WordBand band = new WordBand(250, 350);
        for (int index = 0; index < 20; index++) {
            String text = client.generate(new CompletionRequest(
                    "Round: Counter-Argument. variant " + index,
                    "Case: deposit dispute",
                    0.25d,
                    band.tokenCeiling()
            ));

            int words = Argument.countWords(text);
            assertTrue(band.contains(words), "words=" + words);
        }
    }

    @Test
    void jsonModeReturnsStrictlyParseableVerdict() {
        String raw = client.generate(new CompletionRequest(
                "Evaluate the transcript.",
                "You are an impartial judge.",
                0.0d,
                700,
                Map.of(CompletionRequest.OPTION_FORMAT, CompletionRequest.FORMAT_JSON)
        ));

        VerdictExtraction extraction = new VerdictExtractor().extract(raw);

        assertEquals(VerdictSource.STRICT, extraction.source());
        assertTrue(extraction.scoresParsed());
        assertTrue(extraction.qualityIssues().isEmpty(), extraction.qualityIssues().toString());
        int emotional = extraction.verdict().emotionalScore();
        int logical = extraction.verdict().logicalScore();
        assertTrue(emotional >= 55 && emotional <= 90);
        assertTrue(logical >= 55 && logical <= 90);
        assertEquals(Winner.fromScores(emotional, logical), extraction.verdict().winner());
    }
}
