package com.aijudge.agent;

import com.aijudge.model.AgentKind;
import com.aijudge.model.DebateRole;

import java.util.Objects;

public record LawyerPersona(
        AgentKind kind,
        DebateRole role,
        double temperature
) {
    public LawyerPersona {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(role, "role is required");
        if (temperature < 0.0d) {
            throw new IllegalArgumentException("temperature must not be negative");
        }
    }
}
