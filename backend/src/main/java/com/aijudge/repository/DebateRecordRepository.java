package com.aijudge.repository;

import com.aijudge.model.DebateRecord;
import com.aijudge.model.DebateStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DebateRecordRepository extends JpaRepository<DebateRecord, UUID> {

    List<DebateRecord> findAllByOrderByCreatedAtDesc();

    @Query("""
            select d.debateId from DebateRecord d
            where d.status = :status and (d.claimedAt is null or d.claimedAt < :claimExpiredBefore)
            order by d.createdAt asc
            """)
    List<UUID> findUnclaimedDebateIds(
            @Param("status") DebateStatus status,
            @Param("claimExpiredBefore") OffsetDateTime claimExpiredBefore
    );

    @Modifying
    @Query("""
            update DebateRecord d set d.claimedAt = :claimedAt
            where d.claimedBy = :workerId and d.status = :status and d.debateId in :debateIds
            """)
    int renewClaims(
            @Param("workerId") String workerId,
            @Param("debateIds") Collection<UUID> debateIds,
            @Param("status") DebateStatus status,
            @Param("claimedAt") OffsetDateTime claimedAt
    );

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select d from DebateRecord d where d.debateId = :debateId")
    Optional<DebateRecord> findByDebateIdForUpdate(@Param("debateId") UUID debateId);
}
