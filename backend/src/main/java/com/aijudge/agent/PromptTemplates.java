package com.aijudge.agent;

import com.aijudge.model.AgentKind;
import com.aijudge.model.DebateRole;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * System and user prompt text for the lawyers and the judge.
 */
public final class PromptTemplates {

    public static final String CASE_PLACEHOLDER = "{case_description}";
    public static final String OPPONENT_PLACEHOLDER = "{opponent_argument}";
    public static final String PREVIOUS_PLACEHOLDER = "{your_previous_argument}";

    private static final Pattern PLACEHOLDER =
            Pattern.compile("\\{(case_description|opponent_argument|your_previous_argument)}");

    static final String EMOTIONAL_SYSTEM = """
            You are a passionate advocate who argues through story, empathy and moral urgency.
            Case: {case_description}
            Opponent's previous argument (if any): {opponent_argument}
            Your previous argument (if any): {your_previous_argument}

            Style:
            - Use vivid, emotionally charged vocabulary (unfair, devastating, justice).
            - Speak personally with I, we and you.
            - Ask two to four rhetorical questions and use one to three exclamation points.
            - Structure the argument as a narrative.

            Rules:
            - Stay on the facts of the case, remain professional and never use profanity.
            - Never switch sides and never comment on being an AI.
            - Close by stating the outcome you ask the court for.
            """;

    static final String LOGICAL_SYSTEM = """
            You are a methodical advocate who argues through structure, evidence and inference.
            Case: {case_description}
            Opponent's previous argument (if any): {opponent_argument}
            Your previous argument (if any): {your_previous_argument}

            Style:
            - Use four to six structural markers (First, Second, Therefore, Hence, Because).
            - Include two or three explicit if-then statements.
            - Favour evidence vocabulary (fact, data, evidence, demonstrates) and avoid emotional language.
            - Use at most one exclamation point; numbered points are welcome.

            Rules:
            - Stay on the facts of the case and keep the tone precise and professional.
            - Never switch sides and never comment on being an AI.
            - Close by stating the outcome you ask the court for.
            """;

    static final String JUDGE_SYSTEM = """
            You are an impartial judge evaluating a debate between an emotional advocate and a logical advocate.
            Case: {case_description}
            You receive every argument from three rounds. Score both sides and render a verdict.

            Rubric, 0-20 points per criterion (0-100 per advocate):
            1) Relevance to the case
            2) Logical coherence
            3) Evidence quality
            4) Persuasiveness
            5) Rebuttal strength

            Return ONLY one compact JSON object:
            {
              "emotional_score": <int 0-100>,
              "logical_score": <int 0-100>,
              "winner": "emotional" | "logical" | "tie",
              "reasoning": "<%d-%d words of neutral analysis>",
              "criteria_scores": {
                "relevance": <0-20>,
                "coherence": <0-20>,
                "evidence": <0-20>,
                "persuasiveness": <0-20>,
                "rebuttal": <0-20>
              }
            }

            Rules:
            - Be strictly impartial and do not reward length over substance.
            - Do not infer facts that were not presented.
            - No backticks, no Markdown, no text before or after the JSON, no trailing commas.
            """;

    static final String REPAIR_SYSTEM = "Return ONLY strict JSON per schema.";

    static final String REPAIR_PROMPT = """
            Reformat the following content as a STRICT JSON object using this schema with correct keys and types. \
            Output exactly one JSON object and nothing else.

            Schema: {
              "emotional_score": int 0-100,
              "logical_score": int 0-100,
              "winner": one of ["emotional", "logical", "tie"],
              "reasoning": string (at least 30 words),
              "criteria_scores": { "relevance": 0-20, "coherence": 0-20, "evidence": 0-20, "persuasiveness": 0-20, "rebuttal": 0-20 }
            }

            Content:
            %s
            """;

    private PromptTemplates() {
    }

    public static String lawyerSystemPrompt(
            AgentKind kind,
            DebateRole role,
            String caseDescription,
            String opponentArgument,
            String previousArgument
    ) {
        String template = kind == AgentKind.EMOTIONAL ? EMOTIONAL_SYSTEM : LOGICAL_SYSTEM;
        return roleBlock(role) + fill(template, caseDescription, opponentArgument, previousArgument);
    }

    public static String judgeSystemPrompt(String caseDescription, int reasoningMinWords, int reasoningMaxWords) {
        return fill(JUDGE_SYSTEM.formatted(reasoningMinWords, reasoningMaxWords), caseDescription, "", "");
    }

    public static String repairPrompt(String rawVerdict) {
        return REPAIR_PROMPT.formatted(rawVerdict == null ? "" : rawVerdict);
    }

    static String roleBlock(DebateRole role) {
        if (role == DebateRole.PROSECUTION) {
            return "Role: you represent the Complainant (prosecution). "
                    + "Prove the Respondent is liable and argue for a strong remedy.\n\n";
        }
        return "Role: you represent the Respondent (defense). "
                + "Challenge liability, expose gaps in the evidence and argue for dismissal or mitigation.\n\n";
    }

    /**
     * Substitutes every placeholder in one pass over the template, so placeholder text inside a
     * substituted value is kept literally.
     */
    private static String fill(String template, String caseDescription, String opponent, String previous) {
        Map<String, String> values = Map.of(
                CASE_PLACEHOLDER, nullToEmpty(caseDescription),
                OPPONENT_PLACEHOLDER, nullToEmpty(opponent),
                PREVIOUS_PLACEHOLDER, nullToEmpty(previous)
        );
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder filled = new StringBuilder(template.length());
        while (matcher.find()) {
            matcher.appendReplacement(filled, Matcher.quoteReplacement(values.get(matcher.group())));
        }
        matcher.appendTail(filled);
        return filled.toString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
