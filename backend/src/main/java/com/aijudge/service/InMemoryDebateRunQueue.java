package com.aijudge.service;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local run queue. It is the default queue and the fallback of {@link RedisDebateRunQueue}.
 * An id leaves the waiting set when it is handed to the consumer, so the same debate can be queued
 * again while it runs. The worker and the debate claim decide whether it runs twice.
 */
@Service
public class InMemoryDebateRunQueue implements DebateRunQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDebateRunQueue.class);

    private final BlockingQueue<UUID> waiting = new LinkedBlockingQueue<>();
    private final Set<UUID> waitingIds = ConcurrentHashMap.newKeySet();
    private final AtomicReference<Thread> dispatcher = new AtomicReference<>();

    private volatile boolean open = true;

    @Override
    public boolean enqueue(UUID debateId) {
        Objects.requireNonNull(debateId, "debateId is required");
        if (!open) {
            throw new IllegalStateException("Debate run queue is closed");
        }
        if (!waitingIds.add(debateId)) {
            log.debug("Debate {} is already waiting in the run queue", debateId);
            return false;
        }
        waiting.add(debateId);
        return true;
    }

    @Override
    public void setConsumer(DebateRunQueueConsumer consumer) {
        Objects.requireNonNull(consumer, "consumer is required");
        Thread thread = new Thread(() -> dispatch(consumer), "aijudge-debate-dispatcher");
        thread.setDaemon(true);
        if (!dispatcher.compareAndSet(null, thread)) {
            throw new IllegalStateException("Debate run queue already has a consumer");
        }
        thread.start();
    }

    @PreDestroy
    void close() {
        open = false;
        Thread thread = dispatcher.get();
        if (thread != null) {
            thread.interrupt();
        }
    }

    int waitingCount() {
        return waitingIds.size();
    }

    private void dispatch(DebateRunQueueConsumer consumer) {
        while (open) {
            UUID debateId;
            try {
                debateId = waiting.take();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return;
            }
            waitingIds.remove(debateId);
            try {
                consumer.accept(debateId);
            } catch (RuntimeException ex) {
                log.error("Dispatching debate {} failed", debateId, ex);
            }
        }
    }
}
