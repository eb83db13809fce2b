package com.aijudge.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Objects;
import java.util.UUID;

/**
 * Enqueues a debate run. Inside a transaction the id is queued only after commit, so the worker
 * never sees a debate id whose row is not yet visible.
 */
@Service
@RequiredArgsConstructor
public class DebateRunQueuePublisher {

    private final DebateRunQueue debateRunQueue;

    public void publishDebateReady(UUID debateId) {
        Objects.requireNonNull(debateId, "debateId is required");
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    debateRunQueue.enqueue(debateId);
                }
            });
            return;
        }
        debateRunQueue.enqueue(debateId);
    }
}
