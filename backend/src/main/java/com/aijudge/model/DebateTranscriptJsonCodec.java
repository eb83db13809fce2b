package com.aijudge.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts debate rounds and verdicts to and from the JSON documents stored on {@link DebateRecord}.
 */
public final class DebateTranscriptJsonCodec {

    private static final String FIELD_LAWYER = "lawyer";
    private static final String FIELD_ROUND_NUMBER = "round_number";
    private static final String FIELD_CONTENT = "content";
    private static final String FIELD_WORD_COUNT = "word_count";

    private static final String FIELD_EMOTIONAL_SCORE = "emotional_score";
    private static final String FIELD_LOGICAL_SCORE = "logical_score";
    private static final String FIELD_WINNER = "winner";
    private static final String FIELD_REASONING = "reasoning";
    private static final String FIELD_CRITERIA_SCORES = "criteria_scores";

    private static final String FIELD_RELEVANCE = "relevance";
    private static final String FIELD_COHERENCE = "coherence";
    private static final String FIELD_EVIDENCE = "evidence";
    private static final String FIELD_PERSUASIVENESS = "persuasiveness";
    private static final String FIELD_REBUTTAL = "rebuttal";

    private DebateTranscriptJsonCodec() {
    }

    public static ArrayNode roundsToJson(List<List<Argument>> rounds) {
        ArrayNode root = JsonNodeFactory.instance.arrayNode();
        if (rounds == null) {
            return root;
        }
        for (List<Argument> round : rounds) {
            ArrayNode roundNode = root.addArray();
            for (Argument argument : round) {
                ObjectNode argumentNode = roundNode.addObject();
                argumentNode.put(FIELD_LAWYER, argument.lawyer().wireValue());
                argumentNode.put(FIELD_ROUND_NUMBER, argument.roundNumber());
                argumentNode.put(FIELD_CONTENT, argument.content());
                argumentNode.put(FIELD_WORD_COUNT, argument.wordCount());
            }
        }
        return root;
    }

    public static List<List<Argument>> roundsFromJson(JsonNode roundsJson) {
        if (roundsJson == null || roundsJson.isNull()) {
            return List.of();
        }
        if (!roundsJson.isArray()) {
            throw new IllegalArgumentException("Debate rounds JSON must be an array");
        }

        List<List<Argument>> rounds = new ArrayList<>();
        for (JsonNode roundNode : roundsJson) {
            if (!roundNode.isArray()) {
                throw new IllegalArgumentException("Each debate round must be an array of arguments");
            }
            List<Argument> round = new ArrayList<>();
            for (JsonNode argumentNode : roundNode) {
                round.add(parseArgument(argumentNode));
            }
            rounds.add(List.copyOf(round));
        }
        return List.copyOf(rounds);
    }

    public static ObjectNode verdictToJson(Verdict verdict) {
        if (verdict == null) {
            throw new IllegalArgumentException("Verdict is required");
        }
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put(FIELD_EMOTIONAL_SCORE, verdict.emotionalScore());
        root.put(FIELD_LOGICAL_SCORE, verdict.logicalScore());
        root.put(FIELD_WINNER, verdict.winner().wireValue());
        root.put(FIELD_REASONING, verdict.reasoning());

        CriteriaScores criteria = verdict.criteriaScores();
        ObjectNode criteriaNode = root.putObject(FIELD_CRITERIA_SCORES);
        criteriaNode.put(FIELD_RELEVANCE, criteria.relevance());
        criteriaNode.put(FIELD_COHERENCE, criteria.coherence());
        criteriaNode.put(FIELD_EVIDENCE, criteria.evidence());
        criteriaNode.put(FIELD_PERSUASIVENESS, criteria.persuasiveness());
        criteriaNode.put(FIELD_REBUTTAL, criteria.rebuttal());
        return root;
    }

    public static Verdict verdictFromJson(JsonNode verdictJson) {
        if (verdictJson == null || verdictJson.isNull()) {
            return Verdict.placeholder();
        }
        if (!verdictJson.isObject()) {
            throw new IllegalArgumentException("Verdict JSON must be an object");
        }

        JsonNode criteriaNode = verdictJson.path(FIELD_CRITERIA_SCORES);
        CriteriaScores criteria = new CriteriaScores(
                requireInt(criteriaNode, FIELD_RELEVANCE),
                requireInt(criteriaNode, FIELD_COHERENCE),
                requireInt(criteriaNode, FIELD_EVIDENCE),
                requireInt(criteriaNode, FIELD_PERSUASIVENESS),
                requireInt(criteriaNode, FIELD_REBUTTAL)
        );
        return new Verdict(
                requireInt(verdictJson, FIELD_EMOTIONAL_SCORE),
                requireInt(verdictJson, FIELD_LOGICAL_SCORE),
                Winner.fromWireValue(requireText(verdictJson, FIELD_WINNER)),
                requireText(verdictJson, FIELD_REASONING),
                criteria
        );
    }

    private static Argument parseArgument(JsonNode argumentNode) {
        if (argumentNode == null || !argumentNode.isObject()) {
            throw new IllegalArgumentException("Debate argument must be an object");
        }
        return new Argument(
                AgentKind.fromWireValue(requireText(argumentNode, FIELD_LAWYER)),
                requireInt(argumentNode, FIELD_ROUND_NUMBER),
                requireText(argumentNode, FIELD_CONTENT)
        );
    }

    private static int requireInt(JsonNode node, String fieldName) {
        JsonNode valueNode = node.get(fieldName);
        if (valueNode == null || !valueNode.isIntegralNumber()) {
            throw new IllegalArgumentException("Missing integer field '" + fieldName + "'");
        }
        return valueNode.intValue();
    }

    private static String requireText(JsonNode node, String fieldName) {
        JsonNode valueNode = node.get(fieldName);
        if (valueNode == null || !valueNode.isTextual()) {
            throw new IllegalArgumentException("Missing textual field '" + fieldName + "'");
        }
        return valueNode.textValue();
    }
}
