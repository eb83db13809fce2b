package com.aijudge.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Single-row win counters. The row with id {@link #SINGLETON_ID} is seeded by migration.
 */
@Getter
@Setter
@Entity
@Table(name = "debate_statistics")
public class DebateStatistics {

    public static final int SINGLETON_ID = 1;

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private Integer id = SINGLETON_ID;

    @Column(name = "emotional_wins", nullable = false)
    private int emotionalWins;

    @Column(name = "logical_wins", nullable = false)
    private int logicalWins;

    @Column(name = "total_debates", nullable = false)
    private int totalDebates;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    /**
     * Counts one completed debate. Ties only increase the total.
     */
    public void recordOutcome(Winner winner, OffsetDateTime now) {
        if (winner == Winner.EMOTIONAL) {
            emotionalWins++;
        } else if (winner == Winner.LOGICAL) {
            logicalWins++;
        }
        totalDebates++;
        updatedAt = now;
    }
}
