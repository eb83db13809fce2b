package com.aijudge.debate;

import com.aijudge.model.WordBand;

import java.util.Objects;

/**
 * @param callAttempts attempts per lawyer or judge call before the debate fails
 * @param parallelAgents run the two lawyers of a round concurrently
 * @param repairEnabled ask the judge to reformat output that was only readable heuristically
 */
public record DebateSettings(
        WordBand argumentBand,
        int callAttempts,
        boolean parallelAgents,
        boolean repairEnabled
) {
    public DebateSettings {
        Objects.requireNonNull(argumentBand, "argumentBand is required");
        if (callAttempts <= 0) {
            throw new IllegalArgumentException("callAttempts must be greater than zero");
        }
    }
}
