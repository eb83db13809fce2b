package com.aijudge.repository;

import com.aijudge.model.DebateCase;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface DebateCaseRepository extends JpaRepository<DebateCase, UUID> {
}
