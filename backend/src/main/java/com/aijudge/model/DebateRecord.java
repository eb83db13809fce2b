package com.aijudge.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Persisted debate. Rounds and verdict are stored as JSON documents written by
 * {@link DebateTranscriptJsonCodec}.
 */
@Getter
@Setter
@Entity
@Table(name = "debates")
public class DebateRecord {

    @Id
    @Column(name = "debate_id", nullable = false, updatable = false)
    private UUID debateId;

    @Column(name = "case_id", nullable = false, updatable = false)
    private UUID caseId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private DebateStatus status = DebateStatus.IN_PROGRESS;

    @Enumerated(EnumType.STRING)
    @Column(name = "emotional_role", nullable = false, length = 32)
    private DebateRole emotionalRole = DebateRole.PROSECUTION;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "rounds_json", nullable = false, columnDefinition = "jsonb")
    private JsonNode roundsJson;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "verdict_json", nullable = false, columnDefinition = "jsonb")
    private JsonNode verdictJson;

    @Enumerated(EnumType.STRING)
    @Column(name = "verdict_source", length = 32)
    private VerdictSource verdictSource;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    /**
     * Worker running the debate. The claim lapses when {@code claimedAt} is older than the lease.
     */
    @Column(name = "claimed_by", length = 64)
    private String claimedBy;

    @Column(name = "claimed_at")
    private OffsetDateTime claimedAt;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
