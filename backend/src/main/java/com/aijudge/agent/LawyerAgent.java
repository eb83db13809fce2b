package com.aijudge.agent;

import com.aijudge.model.AgentKind;

/**
 * One debating persona. Each operation returns text already normalized to the argument word band.
 */
public interface LawyerAgent {

    AgentKind kind();

    String opening(String caseDescription);

    /**
     * @param opponentOpening the other lawyer's round-1 text
     */
    String counter(String caseDescription, String opponentOpening);

    /**
     * @param opponentCounter the other lawyer's round-2 text
     * @param ownCounter this lawyer's own round-2 text
     */
    String rebuttal(String caseDescription, String opponentCounter, String ownCounter);
}
