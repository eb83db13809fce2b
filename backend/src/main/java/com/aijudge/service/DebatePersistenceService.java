package com.aijudge.service;

import com.aijudge.model.DebateCase;
import com.aijudge.model.DebateRecord;
import com.aijudge.model.DebateRole;
import com.aijudge.model.DebateStatistics;
import com.aijudge.model.DebateStatus;
import com.aijudge.model.DebateTranscript;
import com.aijudge.model.DebateTranscriptJsonCodec;
import com.aijudge.repository.DebateCaseRepository;
import com.aijudge.repository.DebateRecordRepository;
import com.aijudge.repository.DebateStatisticsRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores transcript snapshots and the worker claims on debates. Each write locks the debate row,
 * and a debate reaching {@code complete} also locks and updates the statistics row in the same
 * transaction.
 */
@Service
@RequiredArgsConstructor
public class DebatePersistenceService {

    private static final Logger log = LoggerFactory.getLogger(DebatePersistenceService.class);
    private static final int MAX_ERROR_MESSAGE_LENGTH = 1_024;

    private final DebateRecordRepository debateRecordRepository;
    private final DebateCaseRepository debateCaseRepository;
    private final DebateStatisticsRepository debateStatisticsRepository;

    /**
     * Claims a debate that is still in progress for {@code workerId} and returns its transcript and
     * role. Empty when the debate is gone, finished, or held by an unexpired claim of any worker.
     */
    @Transactional
    public Optional<PendingDebate> claimPendingDebate(UUID debateId, String workerId, Duration lease) {
        DebateRecord record = debateRecordRepository.findByDebateIdForUpdate(debateId).orElse(null);
        if (record == null) {
            log.warn("Debate {} no longer exists", debateId);
            return Optional.empty();
        }
        if (record.getStatus() != DebateStatus.IN_PROGRESS) {
            log.debug("Debate {} is already {}", debateId, record.getStatus());
            return Optional.empty();
        }
        OffsetDateTime now = OffsetDateTime.now();
        if (isClaimActive(record, now, lease)) {
            log.debug("Debate {} is claimed by {} since {}", debateId, record.getClaimedBy(), record.getClaimedAt());
            return Optional.empty();
        }
        if (record.getClaimedBy() != null) {
            log.info("Claim of {} on debate {} expired; {} takes it over", record.getClaimedBy(), debateId, workerId);
        }
        record.setClaimedBy(workerId);
        record.setClaimedAt(now);
        debateRecordRepository.save(record);
        DebateCase debateCase = loadCase(record.getCaseId());
        return Optional.of(new PendingDebate(toTranscript(record, debateCase), record.getEmotionalRole()));
    }

    /**
     * Ids of in-progress debates nobody holds an unexpired claim on, oldest first.
     */
    @Transactional(readOnly = true)
    public List<UUID> findUnclaimedDebateIds(Duration lease) {
        return debateRecordRepository.findUnclaimedDebateIds(
                DebateStatus.IN_PROGRESS,
                OffsetDateTime.now().minus(lease)
        );
    }

    @Transactional
    public int renewClaims(String workerId, Collection<UUID> debateIds) {
        if (debateIds.isEmpty()) {
            return 0;
        }
        return debateRecordRepository.renewClaims(workerId, debateIds, DebateStatus.IN_PROGRESS, OffsetDateTime.now());
    }

    /**
     * Stores a snapshot written by the worker holding the claim and renews that claim. Snapshots
     * from any other worker are dropped.
     */
    @Transactional
    public void saveSnapshot(String workerId, DebateTranscript snapshot) {
        DebateRecord record = debateRecordRepository.findByDebateIdForUpdate(snapshot.debateId()).orElse(null);
        if (record == null) {
            log.warn("Dropping snapshot for missing debate {}", snapshot.debateId());
            return;
        }
        if (record.getStatus().isTerminal()) {
            log.debug("Ignoring snapshot for debate {} already {}", snapshot.debateId(), record.getStatus());
            return;
        }
        if (!Objects.equals(workerId, record.getClaimedBy())) {
            log.warn("Dropping snapshot for debate {} from {}: claimed by {}",
                    snapshot.debateId(), workerId, record.getClaimedBy());
            return;
        }

        OffsetDateTime now = OffsetDateTime.now();
        record.setRoundsJson(DebateTranscriptJsonCodec.roundsToJson(snapshot.rounds()));
        record.setVerdictJson(DebateTranscriptJsonCodec.verdictToJson(snapshot.verdict()));
        record.setStatus(snapshot.status());
        record.setVerdictSource(snapshot.verdictSource());
        record.setClaimedAt(now);
        record.setUpdatedAt(now);

        if (snapshot.status() == DebateStatus.FAILED) {
            record.setErrorMessage(truncate(snapshot.verdict().reasoning()));
            record.setCompletedAt(now);
        } else if (snapshot.status() == DebateStatus.COMPLETE) {
            record.setCompletedAt(now);
            recordOutcome(snapshot, now);
        }
        debateRecordRepository.save(record);
    }

    /**
     * Marks a debate failed after an error outside the orchestrator, keeping stored rounds. A debate
     * claimed by another worker is left alone.
     */
    @Transactional
    public void markFailed(UUID debateId, String workerId, String message) {
        DebateRecord record = debateRecordRepository.findByDebateIdForUpdate(debateId).orElse(null);
        if (record == null || record.getStatus().isTerminal()) {
            return;
        }
        if (record.getClaimedBy() != null && !record.getClaimedBy().equals(workerId)) {
            log.warn("Not failing debate {} for {}: claimed by {}", debateId, workerId, record.getClaimedBy());
            return;
        }
        DebateTranscript failed = toTranscript(record, loadCase(record.getCaseId())).failed(message);
        OffsetDateTime now = OffsetDateTime.now();
        record.setVerdictJson(DebateTranscriptJsonCodec.verdictToJson(failed.verdict()));
        record.setStatus(DebateStatus.FAILED);
        record.setVerdictSource(null);
        record.setErrorMessage(truncate(failed.verdict().reasoning()));
        record.setCompletedAt(now);
        record.setUpdatedAt(now);
        debateRecordRepository.save(record);
    }

    public DebateTranscript toTranscript(DebateRecord record, DebateCase debateCase) {
        return new DebateTranscript(
                record.getDebateId(),
                debateCase.toCaseInput(),
                DebateTranscriptJsonCodec.roundsFromJson(record.getRoundsJson()),
                DebateTranscriptJsonCodec.verdictFromJson(record.getVerdictJson()),
                record.getStatus(),
                record.getCreatedAt(),
                record.getVerdictSource()
        );
    }

    private void recordOutcome(DebateTranscript snapshot, OffsetDateTime now) {
        DebateStatistics statistics = debateStatisticsRepository.findByIdForUpdate(DebateStatistics.SINGLETON_ID)
                .orElseGet(DebateStatistics::new);
        statistics.recordOutcome(snapshot.verdict().winner(), now);
        debateStatisticsRepository.save(statistics);
    }

    private static boolean isClaimActive(DebateRecord record, OffsetDateTime now, Duration lease) {
        return record.getClaimedAt() != null && record.getClaimedAt().isAfter(now.minus(lease));
    }

    private DebateCase loadCase(UUID caseId) {
        return debateCaseRepository.findById(caseId)
                .orElseThrow(() -> new IllegalStateException("Debate case not found: " + caseId));
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }

    public record PendingDebate(
            DebateTranscript transcript,
            DebateRole emotionalRole
    ) {
    }
}
