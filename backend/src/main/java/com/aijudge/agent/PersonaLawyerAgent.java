package com.aijudge.agent;

import com.aijudge.model.AgentKind;
import com.aijudge.model.DebateRole;
import com.aijudge.model.DebateRound;
import com.aijudge.model.WordBand;

import java.util.Objects;

/**
 * Lawyer defined by a persona (style, side, temperature) on top of the shared {@link ArgumentGenerator}.
 */
public class PersonaLawyerAgent implements LawyerAgent {

    private final LawyerPersona persona;
    private final ArgumentGenerator argumentGenerator;

    public PersonaLawyerAgent(LawyerPersona persona, ArgumentGenerator argumentGenerator) {
        this.persona = Objects.requireNonNull(persona, "persona is required");
        this.argumentGenerator = Objects.requireNonNull(argumentGenerator, "argumentGenerator is required");
    }

    public LawyerPersona persona() {
        return persona;
    }

    @Override
    public AgentKind kind() {
        return persona.kind();
    }

    @Override
    public String opening(String caseDescription) {
        return generate(DebateRound.OPENING, caseDescription, "", "");
    }

    @Override
    public String counter(String caseDescription, String opponentOpening) {
        return generate(DebateRound.COUNTER, caseDescription, opponentOpening, "");
    }

    @Override
    public String rebuttal(String caseDescription, String opponentCounter, String ownCounter) {
        return generate(DebateRound.REBUTTAL, caseDescription, opponentCounter, ownCounter);
    }

    private String generate(DebateRound round, String caseDescription, String opponentArgument, String previousArgument) {
        String systemPrompt = PromptTemplates.lawyerSystemPrompt(
                persona.kind(),
                persona.role(),
                caseDescription,
                opponentArgument,
                previousArgument
        );
        return argumentGenerator.generate(
                systemPrompt,
                userPrompt(round),
                escalatedUserPrompt(round),
                persona.temperature()
        );
    }

    String userPrompt(DebateRound round) {
        WordBand band = argumentGenerator.band();
        return "Round: " + round.label() + ". "
                + sideInstruction()
                + " Target " + band.minWords() + "-" + band.maxWords() + " words."
                + " Do not include round headers or labels in the output. Do not switch sides.";
    }

    String escalatedUserPrompt(DebateRound round) {
        WordBand band = argumentGenerator.band();
        return "Round: " + round.label() + ". Your previous response was under " + band.minWords() + " words. "
                + sideInstruction()
                + " Develop every point more fully, " + band.minWords() + "-" + band.maxWords() + " words."
                + " Do not include round headers or labels in the output.";
    }

    private String sideInstruction() {
        String advocacy = persona.kind() == AgentKind.EMOTIONAL
                ? "emotional, narrative advocacy"
                : "structured, evidence-driven reasoning";
        if (persona.role() == DebateRole.PROSECUTION) {
            return "You represent the Complainant (prosecution). Using " + advocacy
                    + ", show the respondent is liable and state the remedy you seek.";
        }
        return "You represent the Respondent (defense). Using " + advocacy
                + ", challenge liability and state the dismissal or mitigation you seek.";
    }
}
