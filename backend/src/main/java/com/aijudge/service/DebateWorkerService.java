package com.aijudge.service;

import com.aijudge.config.AiJudgeRuntimeProperties;
import com.aijudge.debate.DebateOrchestrator;
import com.aijudge.model.DebateTranscript;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Consumes the run queue and executes each debate on the worker pool. A debate runs only after this
 * worker claims it, so a debate queued twice, locally or by another instance, runs once. A failure
 * in one debate is recorded on that debate only.
 */
@Service
@ConditionalOnProperty(
        prefix = "aijudge.worker",
        name = "enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class DebateWorkerService {

    private static final Logger log = LoggerFactory.getLogger(DebateWorkerService.class);

    private final String workerId = "worker-" + UUID.randomUUID();
    private final Set<UUID> scheduledDebateIds = ConcurrentHashMap.newKeySet();

    private final DebateRunQueue debateRunQueue;
    private final DebatePersistenceService debatePersistenceService;
    private final DebateAgentFactory debateAgentFactory;
    private final DebateOrchestrator debateOrchestrator;
    private final AiJudgeRuntimeProperties runtimeProperties;
    private final Executor debateWorkerExecutor;

    public DebateWorkerService(
            DebateRunQueue debateRunQueue,
            DebatePersistenceService debatePersistenceService,
            DebateAgentFactory debateAgentFactory,
            DebateOrchestrator debateOrchestrator,
            AiJudgeRuntimeProperties runtimeProperties,
            @Qualifier("debateWorkerExecutor") Executor debateWorkerExecutor
    ) {
        this.debateRunQueue = debateRunQueue;
        this.debatePersistenceService = debatePersistenceService;
        this.debateAgentFactory = debateAgentFactory;
        this.debateOrchestrator = debateOrchestrator;
        this.runtimeProperties = runtimeProperties;
        this.debateWorkerExecutor = debateWorkerExecutor;
    }

    @PostConstruct
    void registerQueueConsumer() {
        debateRunQueue.setConsumer(this::consumeQueueMessage);
    }

    /**
     * Renews the claims of debates running here, then queues every in-progress debate with no
     * unexpired claim: debates interrupted by a shutdown and debates whose worker stopped renewing.
     */
    @Scheduled(
            fixedDelayString = "${aijudge.worker.recovery-interval-ms:60000}",
            initialDelayString = "${aijudge.worker.recovery-initial-delay-ms:5000}"
    )
    public void recoverUnclaimedDebates() {
        try {
            debatePersistenceService.renewClaims(workerId, Set.copyOf(scheduledDebateIds));
            List<UUID> unclaimed = debatePersistenceService.findUnclaimedDebateIds(claimLease());
            int queued = 0;
            for (UUID debateId : unclaimed) {
                if (!scheduledDebateIds.contains(debateId) && debateRunQueue.enqueue(debateId)) {
                    queued++;
                }
            }
            if (queued > 0) {
                log.info("Re-queued {} unclaimed debate(s)", queued);
            } else {
                log.debug("Debate recovery found nothing to re-queue");
            }
        } catch (RuntimeException ex) {
            log.error("Debate recovery failed; retrying on the next run", ex);
        }
    }

    void consumeQueueMessage(UUID debateId) {
        if (!scheduledDebateIds.add(debateId)) {
            log.debug("Debate {} is already scheduled on {}", debateId, workerId);
            return;
        }
        try {
            debateWorkerExecutor.execute(() -> runDebate(debateId));
        } catch (RejectedExecutionException ex) {
            scheduledDebateIds.remove(debateId);
            log.error("Debate worker pool rejected debate {}", debateId, ex);
            markFailedQuietly(debateId, "worker pool is not accepting debates");
        }
    }

    void runDebate(UUID debateId) {
        try {
            DebatePersistenceService.PendingDebate pending =
                    debatePersistenceService.claimPendingDebate(debateId, workerId, claimLease()).orElse(null);
            if (pending == null) {
                return;
            }
            log.info("Starting debate {} on {} (emotional lawyer argues {})",
                    debateId, workerId, pending.emotionalRole().wireValue());
            DebateTranscript result = debateOrchestrator.run(
                    pending.transcript(),
                    debateAgentFactory.create(pending.emotionalRole()),
                    snapshot -> debatePersistenceService.saveSnapshot(workerId, snapshot)
            );
            log.info("Debate {} finished with status {}", debateId, result.status().wireValue());
        } catch (RuntimeException ex) {
            log.error("Debate {} aborted by unexpected error", debateId, ex);
            markFailedQuietly(debateId, ex.getMessage());
        } finally {
            scheduledDebateIds.remove(debateId);
        }
    }

    String workerId() {
        return workerId;
    }

    private Duration claimLease() {
        return Duration.ofSeconds(Math.max(1L, runtimeProperties.getWorker().getClaimLeaseSeconds()));
    }

    private void markFailedQuietly(UUID debateId, String message) {
        try {
            debatePersistenceService.markFailed(debateId, workerId, message);
        } catch (RuntimeException persistFailure) {
            log.error("Could not record failure for debate {}", debateId, persistFailure);
        }
    }
}
