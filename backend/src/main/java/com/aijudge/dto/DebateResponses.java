package com.aijudge.dto;

import com.aijudge.model.AgentKind;
import com.aijudge.model.DebateRole;
import com.aijudge.model.DebateStatus;
import com.aijudge.model.VerdictSource;
import com.aijudge.model.Winner;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class DebateResponses {

    private DebateResponses() {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record CaseCreated(
            UUID caseId
    ) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record DebateStarted(
            UUID debateId,
            DebateStatus status
    ) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record CaseDetail(
            UUID caseId,
            String title,
            String description
    ) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ArgumentDetail(
            AgentKind lawyer,
            int roundNumber,
            String content,
            int wordCount
    ) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record CriteriaScoresDetail(
            int relevance,
            int coherence,
            int evidence,
            int persuasiveness,
            int rebuttal
    ) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record VerdictDetail(
            int emotionalScore,
            int logicalScore,
            Winner winner,
            String reasoning,
            CriteriaScoresDetail criteriaScores
    ) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record DebateDetail(
            UUID debateId,
            @JsonProperty("case")
            CaseDetail caseDetail,
            List<List<ArgumentDetail>> rounds,
            VerdictDetail verdict,
            DebateStatus status,
            OffsetDateTime timestamp,
            VerdictSource verdictSource,
            DebateRole emotionalRole
    ) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record DebateSummary(
            UUID debateId,
            UUID caseId,
            String caseTitle,
            DebateStatus status,
            Winner winner,
            OffsetDateTime timestamp
    ) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Statistics(
            int emotionalWins,
            int logicalWins,
            int totalDebates
    ) {
    }
}
