package com.aijudge.debate;

import com.aijudge.model.CriteriaScores;
import com.aijudge.model.Verdict;
import com.aijudge.model.VerdictSource;
import com.aijudge.model.Winner;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a judge response into a {@link Verdict}. Accepts strict JSON, JSON wrapped in fences or prose,
 * JSON with trailing commas, and free text. Never throws.
 *
 * <p>A declared {@code winner} is kept whenever it is a valid token, even if the scores disagree.
 * A missing or invalid winner is derived from the scores. On the heuristic path the winner always
 * comes from the scores, and a "winner ..." mention in the text is consulted only to break a tie.
 */
public class VerdictExtractor {

    private static final Logger log = LoggerFactory.getLogger(VerdictExtractor.class);
    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder().build();

    static final String HEURISTIC_REASONING =
            "Model did not return strict JSON; applied heuristic parse to extract scores and winner.";
    static final int HEURISTIC_DEFAULT_SCORE = 50;
    static final int MIN_REASONING_CHARACTERS = 30;

    private static final BigDecimal ROUNDING_HALF = new BigDecimal("0.5");
    private static final MathContext SCORE_DIGITS = new MathContext(32, RoundingMode.DOWN);

    private static final String FIELD_EMOTIONAL_SCORE = "emotional_score";
    private static final String FIELD_LOGICAL_SCORE = "logical_score";
    private static final String FIELD_WINNER = "winner";
    private static final String FIELD_REASONING = "reasoning";
    private static final String FIELD_CRITERIA_SCORES = "criteria_scores";

    private static final Pattern LEADING_FENCE = Pattern.compile("^```[A-Za-z0-9_-]*[ \\t]*\\r?\\n?");
    private static final Pattern TRAILING_FENCE = Pattern.compile("```\\s*$");
    private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*([}\\]])");
    private static final Pattern EMOTIONAL_SCORE = Pattern.compile(
            "\\bemo(?:tional)?(?:[_\\s-]*score)?\\b\\D{0,10}?(\\d{1,3})",
            Pattern.CASE_INSENSITIVE
    );
    private static final Pattern LOGICAL_SCORE = Pattern.compile(
            "\\blog(?:ical)?(?:[_\\s-]*score)?\\b\\D{0,10}?(\\d{1,3})",
            Pattern.CASE_INSENSITIVE
    );
    private static final Pattern WINNER_MENTION = Pattern.compile(
            "winner\\W{0,10}(?:is\\W{0,5})?(emotional|logical|tie)\\b",
            Pattern.CASE_INSENSITIVE
    );

    public VerdictExtraction extract(String raw) {
        String cleaned = stripFences(raw);
        String candidate = extractFirstObject(cleaned).orElse(cleaned);

        Optional<JsonNode> strict = parseObject(candidate);
        if (strict.isPresent()) {
            return fromObject(strict.get(), VerdictSource.STRICT);
        }

        String repairedCandidate = TRAILING_COMMA.matcher(candidate).replaceAll("$1");
        if (!repairedCandidate.equals(candidate)) {
            Optional<JsonNode> repaired = parseObject(repairedCandidate);
            if (repaired.isPresent()) {
                return fromObject(repaired.get(), VerdictSource.REPAIRED);
            }
        }

        return heuristic(cleaned);
    }

    static String stripFences(String raw) {
        String text = raw == null ? "" : raw.trim();
        text = LEADING_FENCE.matcher(text).replaceFirst("");
        text = TRAILING_FENCE.matcher(text).replaceFirst("");
        return text.trim();
    }

    /**
     * First balanced {@code {...}} substring, ignoring braces inside string literals.
     */
    static Optional<String> extractFirstObject(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            return Optional.empty();
        }
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int index = start; index < text.length(); index++) {
            char current = text.charAt(index);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (current == '\\') {
                    escaped = true;
                } else if (current == '"') {
                    inString = false;
                }
                continue;
            }
            if (current == '"') {
                inString = true;
            } else if (current == '{') {
                depth++;
            } else if (current == '}') {
                depth--;
                if (depth == 0) {
                    return Optional.of(text.substring(start, index + 1));
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<JsonNode> parseObject(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = OBJECT_MAPPER.readTree(candidate);
            if (node != null && node.isObject()) {
                return Optional.of(node);
            }
            return Optional.empty();
        } catch (JsonProcessingException ex) {
            return Optional.empty();
        }
    }

    private VerdictExtraction fromObject(JsonNode root, VerdictSource source) {
        List<String> qualityIssues = new ArrayList<>();

        JsonNode emotionalNode = root.get(FIELD_EMOTIONAL_SCORE);
        JsonNode logicalNode = root.get(FIELD_LOGICAL_SCORE);
        int emotionalScore = coerceScore(emotionalNode, FIELD_EMOTIONAL_SCORE, Verdict.MAX_SCORE, qualityIssues);
        int logicalScore = coerceScore(logicalNode, FIELD_LOGICAL_SCORE, Verdict.MAX_SCORE, qualityIssues);
        boolean scoresParsed = isIntegral(emotionalNode) && isIntegral(logicalNode);

        Winner derived = Winner.fromScores(emotionalScore, logicalScore);
        JsonNode winnerNode = root.get(FIELD_WINNER);
        Optional<Winner> declared = winnerNode != null && winnerNode.isTextual()
                ? Winner.fromToken(winnerNode.textValue())
                : Optional.empty();
        Winner winner;
        if (declared.isPresent()) {
            winner = declared.get();
            if (winner != derived) {
                log.warn(
                        "Judge declared winner '{}' although scores {}/{} favour '{}'; keeping declared value",
                        winner.wireValue(),
                        emotionalScore,
                        logicalScore,
                        derived.wireValue()
                );
                qualityIssues.add("winner contradicts scores");
            }
        } else {
            winner = derived;
            qualityIssues.add("winner missing or invalid; derived from scores");
        }

        String reasoning = coerceReasoning(root.get(FIELD_REASONING), qualityIssues);
        if (reasoning.trim().length() < MIN_REASONING_CHARACTERS) {
            qualityIssues.add("reasoning shorter than " + MIN_REASONING_CHARACTERS + " characters");
        }

        JsonNode criteriaNode = root.path(FIELD_CRITERIA_SCORES);
        CriteriaScores criteria = new CriteriaScores(
                coerceScore(criteriaNode.get("relevance"), "criteria_scores.relevance", CriteriaScores.MAX_SCORE, qualityIssues),
                coerceScore(criteriaNode.get("coherence"), "criteria_scores.coherence", CriteriaScores.MAX_SCORE, qualityIssues),
                coerceScore(criteriaNode.get("evidence"), "criteria_scores.evidence", CriteriaScores.MAX_SCORE, qualityIssues),
                coerceScore(criteriaNode.get("persuasiveness"), "criteria_scores.persuasiveness", CriteriaScores.MAX_SCORE, qualityIssues),
                coerceScore(criteriaNode.get("rebuttal"), "criteria_scores.rebuttal", CriteriaScores.MAX_SCORE, qualityIssues)
        );

        if (!qualityIssues.isEmpty()) {
            log.debug("Verdict extracted ({}) with quality issues: {}", source.wireValue(), qualityIssues);
        }
        return new VerdictExtraction(
                new Verdict(emotionalScore, logicalScore, winner, reasoning, criteria),
                source,
                scoresParsed,
                qualityIssues
        );
    }

    private VerdictExtraction heuristic(String text) {
        int emotionalScore = findScore(EMOTIONAL_SCORE, text);
        int logicalScore = findScore(LOGICAL_SCORE, text);

        Winner winner = Winner.fromScores(emotionalScore, logicalScore);
        if (winner == Winner.TIE) {
            Matcher mention = WINNER_MENTION.matcher(text);
            if (mention.find()) {
                winner = Winner.fromToken(mention.group(1)).orElse(Winner.TIE);
            }
        }

        log.warn(
                "Judge output was not parseable JSON; heuristic verdict emotional={} logical={} winner={}",
                emotionalScore,
                logicalScore,
                winner.wireValue()
        );
        return new VerdictExtraction(
                new Verdict(emotionalScore, logicalScore, winner, HEURISTIC_REASONING, CriteriaScores.neutral()),
                VerdictSource.HEURISTIC,
                false,
                List.of("heuristic parse")
        );
    }

    private static int findScore(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return HEURISTIC_DEFAULT_SCORE;
        }
        return Verdict.clampScore(Long.parseLong(matcher.group(1)));
    }

    private static boolean isIntegral(JsonNode node) {
        return node != null && node.isIntegralNumber();
    }

    private static int coerceScore(JsonNode node, String fieldName, int maxScore, List<String> qualityIssues) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            qualityIssues.add(fieldName + " missing");
            return 0;
        }
        BigDecimal value;
        if (node.isNumber()) {
            if (node.isFloatingPointNumber() && !Double.isFinite(node.doubleValue())) {
                return coerceNonFinite(node.doubleValue(), fieldName, maxScore, qualityIssues);
            }
            value = node.decimalValue();
        } else if (node.isTextual()) {
            try {
                value = new BigDecimal(node.textValue().trim());
            } catch (NumberFormatException ex) {
                qualityIssues.add(fieldName + " is not numeric");
                return 0;
            }
        } else {
            qualityIssues.add(fieldName + " is not numeric");
            return 0;
        }
        // compare before any rescaling: setScale on a huge exponent materializes every digit
        if (value.compareTo(ROUNDING_HALF) < 0) {
            return 0;
        }
        if (value.compareTo(BigDecimal.valueOf(maxScore)) >= 0) {
            return maxScore;
        }
        return value.round(SCORE_DIGITS).setScale(0, RoundingMode.HALF_UP).intValue();
    }

    private static int coerceNonFinite(double value, String fieldName, int maxScore, List<String> qualityIssues) {
        qualityIssues.add(fieldName + " is not a finite number");
        return value == Double.POSITIVE_INFINITY ? maxScore : 0;
    }

    private static String coerceReasoning(JsonNode node, List<String> qualityIssues) {
        if (node == null || node.isNull()) {
            qualityIssues.add("reasoning missing");
            return "";
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        return node.toString();
    }
}
