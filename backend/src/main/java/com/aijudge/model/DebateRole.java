package com.aijudge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Side of the case a lawyer argues for.
 */
public enum DebateRole {
    PROSECUTION("prosecution"),
    DEFENSE("defense");

    private final String wireValue;

    DebateRole(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public DebateRole opposite() {
        return this == PROSECUTION ? DEFENSE : PROSECUTION;
    }

    @JsonCreator
    public static DebateRole fromWireValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("role is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DebateRole role : values()) {
            if (role.wireValue.equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("role must be \"prosecution\" or \"defense\"");
    }
}
