package com.aijudge.repository;

import com.aijudge.model.DebateStatistics;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DebateStatisticsRepository extends JpaRepository<DebateStatistics, Integer> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from DebateStatistics s where s.id = :id")
    Optional<DebateStatistics> findByIdForUpdate(@Param("id") Integer id);
}
