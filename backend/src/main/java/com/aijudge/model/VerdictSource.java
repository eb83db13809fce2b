package com.aijudge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Extraction path that produced a verdict. Anything other than {@link #STRICT} or
 * {@link #REPAIRED} means the judge output could not be read as the expected object.
 */
public enum VerdictSource {
    STRICT("strict"),
    REPAIRED("repaired"),
    HEURISTIC("heuristic"),
    REFORMATTED("reformatted");

    private final String wireValue;

    VerdictSource(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean isDegraded() {
        return this == HEURISTIC;
    }

    @JsonCreator
    public static VerdictSource fromWireValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (VerdictSource source : values()) {
            if (source.wireValue.equals(normalized)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown verdict source: " + value);
    }
}
