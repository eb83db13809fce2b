package com.aijudge.provider;

import com.aijudge.model.Winner;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Deterministic completion generator used for reproducible local runs and tests.
 * The same request always yields the same text.
 */
@Component
public class MockCompletionClient implements CompletionClient {

    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder().build();

    private static final List<String> ARGUMENT_SENTENCES = List.of(
            "The record shows a clear sequence of events that the court should weigh carefully.",
            "Every party here made choices, and those choices carry consequences under the agreement.",
            "The opposing account leaves important gaps that no amount of framing can close.",
            "Consider what a reasonable person would have expected at the moment the promise was made.",
            "The documents, messages and receipts all point toward the same conclusion.",
            "Fairness requires that we look at the harm actually suffered rather than the harm imagined.",
            "A remedy must match the wrong, and the wrong in this case is concrete and measurable.",
            "My opponent asks the court to overlook facts that are plainly in evidence.",
            "If the terms were understood by both sides, then both sides are bound by them.",
            "The timeline demonstrates that notice was given and ignored.",
            "We should not reward conduct that shifts the burden onto the party who acted in good faith.",
            "The evidence does not support the inference that my opponent draws from it.",
            "Each step of this dispute could have been avoided with ordinary diligence.",
            "The standard the court applies must be the same for both parties.",
            "What happened here is not a misunderstanding but a pattern that repeated itself."
    );

    private static final List<String> REASONING_SENTENCES = List.of(
            "Both advocates addressed the central dispute and stayed within the facts of the case.",
            "The emotional advocate built a vivid narrative that made the stakes easy to grasp.",
            "The logical advocate organized the argument into clear steps supported by the record.",
            "Rebuttals in the final round engaged directly with the opposing counter-arguments.",
            "Some claims relied on inference rather than on evidence presented in the transcript.",
            "Persuasiveness was weighed separately from the volume of text each side produced.",
            "The scoring reflects relevance, coherence, evidence, persuasiveness and rebuttal strength.",
            "Neither side introduced facts beyond those described in the case summary."
    );

    @Override
    public String generate(CompletionRequest request) {
        String seed = request.systemPrompt() + "|" + request.prompt() + "|" + request.temperature();
        if (request.wantsJson()) {
            return buildVerdictJson(seed, request.maxTokens());
        }
        return buildProse(seed, ARGUMENT_SENTENCES, targetWords(seed, request.maxTokens()));
    }

    private static String buildVerdictJson(String seed, int maxTokens) {
        int emotionalScore = 55 + stableIndex(seed + "|emotional", 36);
        int logicalScore = 55 + stableIndex(seed + "|logical", 36);

        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put("emotional_score", emotionalScore);
        root.put("logical_score", logicalScore);
        root.put("winner", Winner.fromScores(emotionalScore, logicalScore).wireValue());
        root.put("reasoning", buildProse(seed + "|reasoning", REASONING_SENTENCES, targetWords(seed, maxTokens) * 3 / 5));
        ObjectNode criteria = root.putObject("criteria_scores");
        criteria.put("relevance", 10 + stableIndex(seed + "|relevance", 11));
        criteria.put("coherence", 10 + stableIndex(seed + "|coherence", 11));
        criteria.put("evidence", 10 + stableIndex(seed + "|evidence", 11));
        criteria.put("persuasiveness", 10 + stableIndex(seed + "|persuasiveness", 11));
        criteria.put("rebuttal", 10 + stableIndex(seed + "|rebuttal", 11));
        try {
            return OBJECT_MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize mock verdict", ex);
        }
    }

    private static String buildProse(String seed, List<String> sentences, int targetWords) {
        StringBuilder text = new StringBuilder();
        int words = 0;
        int index = 0;
        while (words < targetWords) {
            String sentence = sentences.get(stableIndex(seed + "|" + index, sentences.size()));
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(sentence);
            words += sentence.split("\\s+").length;
            index++;
        }
        return text.toString();
    }

    /**
     * Between 80% and 92% of the word budget implied by the token ceiling.
     */
    private static int targetWords(String seed, int maxTokens) {
        int budgetWords = (int) Math.floor(maxTokens / 1.33d);
        int floor = budgetWords * 80 / 100;
        int spread = Math.max(1, budgetWords * 12 / 100);
        return floor + stableIndex(seed + "|length", spread);
    }

    private static int stableIndex(String seed, int bound) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(seed.getBytes(StandardCharsets.UTF_8));
            int raw = ByteBuffer.wrap(hash).getInt();
            return Math.floorMod(raw, bound);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 digest algorithm is required", ex);
        }
    }
}
