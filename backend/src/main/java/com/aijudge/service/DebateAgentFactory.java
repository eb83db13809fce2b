package com.aijudge.service;

import com.aijudge.agent.ArgumentGenerator;
import com.aijudge.agent.CompletionJudgeAgent;
import com.aijudge.agent.LawyerPersona;
import com.aijudge.agent.PersonaLawyerAgent;
import com.aijudge.config.AiJudgeRuntimeProperties;
import com.aijudge.config.CompletionProperties;
import com.aijudge.config.JudgeProperties;
import com.aijudge.debate.DebateParticipants;
import com.aijudge.debate.ResponseNormalizer;
import com.aijudge.model.AgentKind;
import com.aijudge.model.DebateRole;
import com.aijudge.model.WordBand;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds the two lawyers and the judge for one debate from configuration.
 */
@Component
@RequiredArgsConstructor
public class DebateAgentFactory {

    private final CompletionGateway completionGateway;
    private final ResponseNormalizer responseNormalizer;
    private final AiJudgeRuntimeProperties runtimeProperties;
    private final CompletionProperties completionProperties;
    private final JudgeProperties judgeProperties;

    public DebateParticipants create(DebateRole emotionalRole) {
        DebateRole emotionalSide = emotionalRole == null ? DebateRole.PROSECUTION : emotionalRole;
        ArgumentGenerator argumentGenerator = new ArgumentGenerator(
                completionGateway,
                responseNormalizer,
                argumentBand(),
                Math.max(1, runtimeProperties.getDebate().getLengthCorrectionAttempts())
        );
        CompletionProperties.Temperatures temperatures = completionProperties.getTemperatures();

        return new DebateParticipants(
                new PersonaLawyerAgent(
                        new LawyerPersona(AgentKind.EMOTIONAL, emotionalSide, temperatures.getEmotional()),
                        argumentGenerator
                ),
                new PersonaLawyerAgent(
                        new LawyerPersona(AgentKind.LOGICAL, emotionalSide.opposite(), temperatures.getLogical()),
                        argumentGenerator
                ),
                new CompletionJudgeAgent(
                        completionGateway,
                        temperatures.getJudge(),
                        judgeMaxTokens(),
                        judgeProperties.getReasoningMinWords(),
                        judgeProperties.getReasoningMaxWords()
                )
        );
    }

    public WordBand argumentBand() {
        AiJudgeRuntimeProperties.Debate debate = runtimeProperties.getDebate();
        return new WordBand(debate.getMinWords(), debate.getMaxWords());
    }

    int judgeMaxTokens() {
        return WordBand.tokenCeiling(judgeProperties.getReasoningMaxWords()) + judgeProperties.getJsonOverheadTokens();
    }
}
