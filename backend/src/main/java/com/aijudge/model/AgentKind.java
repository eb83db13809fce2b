package com.aijudge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The two lawyer personas taking part in a debate.
 */
public enum AgentKind {
    EMOTIONAL("emotional"),
    LOGICAL("logical");

    private final String wireValue;

    AgentKind(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public AgentKind opponent() {
        return this == EMOTIONAL ? LOGICAL : EMOTIONAL;
    }

    @JsonCreator
    public static AgentKind fromWireValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("lawyer is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AgentKind kind : values()) {
            if (kind.wireValue.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("lawyer must be \"emotional\" or \"logical\"");
    }
}
