package com.aijudge.agent;

import com.aijudge.debate.ResponseNormalizer;
import com.aijudge.model.WordBand;
import com.aijudge.provider.CompletionClient;
import com.aijudge.provider.CompletionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Calls the completion service for one argument and forces the result into the word band.
 * A response shorter than the band minimum is retried with the escalated prompt while attempts remain.
 */
public class ArgumentGenerator {

    private static final Logger log = LoggerFactory.getLogger(ArgumentGenerator.class);

    private final CompletionClient completionClient;
    private final ResponseNormalizer responseNormalizer;
    private final WordBand band;
    private final int lengthCorrectionAttempts;

    public ArgumentGenerator(
            CompletionClient completionClient,
            ResponseNormalizer responseNormalizer,
            WordBand band,
            int lengthCorrectionAttempts
    ) {
        this.completionClient = Objects.requireNonNull(completionClient, "completionClient is required");
        this.responseNormalizer = Objects.requireNonNull(responseNormalizer, "responseNormalizer is required");
        this.band = Objects.requireNonNull(band, "band is required");
        if (lengthCorrectionAttempts <= 0) {
            throw new IllegalArgumentException("lengthCorrectionAttempts must be greater than zero");
        }
        this.lengthCorrectionAttempts = lengthCorrectionAttempts;
    }

    public WordBand band() {
        return band;
    }

    public String generate(String systemPrompt, String userPrompt, String escalatedUserPrompt, double temperature) {
        String prompt = userPrompt;
        String lastText = "";
        for (int attempt = 1; attempt <= lengthCorrectionAttempts; attempt++) {
            lastText = responseNormalizer.clean(completionClient.generate(new CompletionRequest(
                    prompt,
                    systemPrompt,
                    temperature,
                    band.tokenCeiling()
            )));
            int words = ResponseNormalizer.countWords(lastText);
            if (words >= band.minWords()) {
                return responseNormalizer.normalize(lastText, band);
            }
            log.debug(
                    "Generated argument too short ({} < {} words), attempt {}/{}",
                    words,
                    band.minWords(),
                    attempt,
                    lengthCorrectionAttempts
            );
            prompt = escalatedUserPrompt;
        }
        log.warn("Argument stayed under {} words after {} attempt(s); padding", band.minWords(), lengthCorrectionAttempts);
        return responseNormalizer.normalize(lastText, band);
    }
}
