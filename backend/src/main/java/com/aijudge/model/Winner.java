package com.aijudge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum Winner {
    EMOTIONAL("emotional"),
    LOGICAL("logical"),
    TIE("tie");

    private final String wireValue;

    Winner(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Higher score wins, equal scores tie.
     */
    public static Winner fromScores(int emotionalScore, int logicalScore) {
        if (emotionalScore > logicalScore) {
            return EMOTIONAL;
        }
        if (logicalScore > emotionalScore) {
            return LOGICAL;
        }
        return TIE;
    }

    public static Optional<Winner> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        for (Winner winner : values()) {
            if (winner.wireValue.equals(normalized)) {
                return Optional.of(winner);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static Winner fromWireValue(String value) {
        return fromToken(value).orElseThrow(() -> new IllegalArgumentException(
                "winner must be \"emotional\", \"logical\", or \"tie\""
        ));
    }
}
