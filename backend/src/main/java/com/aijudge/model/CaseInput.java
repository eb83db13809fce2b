package com.aijudge.model;

import org.springframework.util.StringUtils;

import java.util.UUID;

/**
 * A dispute submitted for debate.
 */
public record CaseInput(
        UUID caseId,
        String title,
        String description
) {
    public CaseInput {
        if (!StringUtils.hasText(title)) {
            throw new IllegalArgumentException("title is required");
        }
        if (!StringUtils.hasText(description)) {
            throw new IllegalArgumentException("description is required");
        }
        title = title.trim();
        description = description.trim();
    }
}
