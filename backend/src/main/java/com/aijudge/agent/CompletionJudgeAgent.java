package com.aijudge.agent;

import com.aijudge.model.Argument;
import com.aijudge.provider.CompletionClient;
import com.aijudge.provider.CompletionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Judge backed by a completion call in JSON mode at a fixed, deterministic temperature.
 */
public class CompletionJudgeAgent implements JudgeAgent {

    private static final Logger log = LoggerFactory.getLogger(CompletionJudgeAgent.class);
    private static final int EXPECTED_ARGUMENTS = 6;
    private static final Map<String, Object> JSON_OPTIONS = Map.of(
            CompletionRequest.OPTION_FORMAT,
            CompletionRequest.FORMAT_JSON
    );

    private final CompletionClient completionClient;
    private final double temperature;
    private final int maxTokens;
    private final int reasoningMinWords;
    private final int reasoningMaxWords;

    public CompletionJudgeAgent(
            CompletionClient completionClient,
            double temperature,
            int maxTokens,
            int reasoningMinWords,
            int reasoningMaxWords
    ) {
        this.completionClient = Objects.requireNonNull(completionClient, "completionClient is required");
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.reasoningMinWords = reasoningMinWords;
        this.reasoningMaxWords = reasoningMaxWords;
    }

    @Override
    public String evaluate(String caseDescription, List<Argument> arguments) {
        if (arguments.size() != EXPECTED_ARGUMENTS) {
            log.warn("Judge received {} arguments; expected {}", arguments.size(), EXPECTED_ARGUMENTS);
        }
        String prompt = "Evaluate the following debate transcript according to the rubric "
                + "and output ONLY the JSON object described.\n\nTranscript:\n"
                + formatTranscript(arguments);
        return completionClient.generate(new CompletionRequest(
                prompt,
                PromptTemplates.judgeSystemPrompt(caseDescription, reasoningMinWords, reasoningMaxWords),
                temperature,
                maxTokens,
                JSON_OPTIONS
        ));
    }

    @Override
    public String reformat(String rawVerdict) {
        return completionClient.generate(new CompletionRequest(
                PromptTemplates.repairPrompt(rawVerdict),
                PromptTemplates.REPAIR_SYSTEM,
                0.0d,
                maxTokens,
                JSON_OPTIONS
        ));
    }

    static String formatTranscript(List<Argument> arguments) {
        StringBuilder transcript = new StringBuilder();
        for (Argument argument : arguments) {
            if (transcript.length() > 0) {
                transcript.append('\n');
            }
            String speaker = argument.lawyer().wireValue();
            transcript.append('[')
                    .append(Character.toUpperCase(speaker.charAt(0)))
                    .append(speaker.substring(1))
                    .append(" | Round ")
                    .append(argument.roundNumber())
                    .append("]\n")
                    .append(argument.content().trim())
                    .append('\n');
        }
        return transcript.toString();
    }
}
