package com.aijudge.debate;

import com.aijudge.agent.JudgeAgent;
import com.aijudge.agent.LawyerAgent;
import com.aijudge.model.AgentKind;

import java.util.Objects;

public record DebateParticipants(
        LawyerAgent emotional,
        LawyerAgent logical,
        JudgeAgent judge
) {
    public DebateParticipants {
        Objects.requireNonNull(emotional, "emotional lawyer is required");
        Objects.requireNonNull(logical, "logical lawyer is required");
        Objects.requireNonNull(judge, "judge is required");
        if (emotional.kind() != AgentKind.EMOTIONAL || logical.kind() != AgentKind.LOGICAL) {
            throw new IllegalArgumentException("Lawyer agents must match their seats");
        }
    }

    public LawyerAgent lawyer(AgentKind kind) {
        return kind == AgentKind.EMOTIONAL ? emotional : logical;
    }
}
