package com.aijudge.model;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DebateTranscriptJsonCodecTest {

    @Test
    void roundsToJsonWritesSnakeCaseArguments() {
        List<List<Argument>> rounds = List.of(
                List.of(
                        new Argument(AgentKind.EMOTIONAL, 1, "Think of the family."),
                        new Argument(AgentKind.LOGICAL, 1, "Clause four applies.")
                ),
                List.of(),
                List.of()
        );

        ArrayNode json = DebateTranscriptJsonCodec.roundsToJson(rounds);

        assertEquals(3, json.size());
        assertEquals("emotional", json.get(0).get(0).get("lawyer").asText());
        assertEquals(1, json.get(0).get(0).get("round_number").asInt());
        assertEquals(4, json.get(0).get(0).get("word_count").asInt());
        assertEquals("Clause four applies.", json.get(0).get(1).get("content").asText());
        assertTrue(json.get(1).isEmpty());
    }

    @Test
    void roundsFromJsonRecomputesWordCount() {
        ArrayNode json = JsonNodeFactory.instance.arrayNode();
        ObjectNode argument = json.addArray().addObject();
        argument.put("lawyer", "logical");
        argument.put("round_number", 1);
        argument.put("content", "Three words here");
        argument.put("word_count", 999);

        List<List<Argument>> rounds = DebateTranscriptJsonCodec.roundsFromJson(json);

        assertEquals(1, rounds.size());
        assertEquals(AgentKind.LOGICAL, rounds.get(0).get(0).lawyer());
        assertEquals(3, rounds.get(0).get(0).wordCount());
    }

    @Test
    void roundsFromJsonRejectsUnknownLawyer() {
        ArrayNode json = JsonNodeFactory.instance.arrayNode();
        ObjectNode argument = json.addArray().addObject();
        argument.put("lawyer", "judge");
        argument.put("round_number", 1);
        argument.put("content", "text");

        assertThrows(IllegalArgumentException.class, () -> DebateTranscriptJsonCodec.roundsFromJson(json));
    }

    @Test
    void verdictFromJsonParsesStoredVerdict() {
        Verdict verdict = new Verdict(61, 74, Winner.LOGICAL, "Precise citations carried the day.",
                new CriteriaScores(14, 16, 17, 12, 15));

        Verdict parsed = DebateTranscriptJsonCodec.verdictFromJson(DebateTranscriptJsonCodec.verdictToJson(verdict));

        assertEquals(verdict, parsed);
    }

    @Test
    void verdictFromJsonReturnsPlaceholderForNull() {
        assertEquals(Verdict.placeholder(), DebateTranscriptJsonCodec.verdictFromJson(null));
    }

    @Test
    void verdictFromJsonRejectsMissingScore() {
        ObjectNode json = DebateTranscriptJsonCodec.verdictToJson(Verdict.placeholder());
        json.remove("logical_score");

        IllegalArgumentException ex = assertThrows(
                IllegalArgumentException.class,
                () -> DebateTranscriptJsonCodec.verdictFromJson(json)
        );

        assertEquals("Missing integer field 'logical_score'", ex.getMessage());
    }
}
