package com.aijudge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DebateStatus {
    IN_PROGRESS("in_progress"),
    COMPLETE("complete"),
    FAILED("failed");

    private final String wireValue;

    DebateStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }

    @JsonCreator
    public static DebateStatus fromWireValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DebateStatus status : values()) {
            if (status.wireValue.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("status must be \"in_progress\", \"complete\", or \"failed\"");
    }
}
