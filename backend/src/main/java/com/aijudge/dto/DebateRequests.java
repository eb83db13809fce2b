package com.aijudge.dto;

import com.aijudge.model.DebateRole;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public final class DebateRequests {

    private DebateRequests() {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record CreateCaseRequest(
            @NotBlank
            @Size(min = 3, max = 200)
            String title,
            @NotBlank
            @Size(min = 10, max = 10_000)
            String description
    ) {
    }

    /**
     * @param emotionalRole side argued by the emotional lawyer; prosecution when omitted
     */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record StartDebateRequest(
            DebateRole emotionalRole
    ) {
    }
}
