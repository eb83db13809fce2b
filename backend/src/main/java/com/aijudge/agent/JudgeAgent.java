package com.aijudge.agent;

import com.aijudge.model.Argument;

import java.util.List;

/**
 * Produces raw verdict text. Parsing is left to {@link com.aijudge.debate.VerdictExtractor}.
 */
public interface JudgeAgent {

    String evaluate(String caseDescription, List<Argument> arguments);

    /**
     * Asks the model to restate an earlier response strictly in the verdict schema.
     */
    String reformat(String rawVerdict);
}
