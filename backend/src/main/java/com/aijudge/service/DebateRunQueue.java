package com.aijudge.service;

import java.util.UUID;

/**
 * Hands debate ids from the API and the recovery sweep to the worker. A debate id waits in the
 * queue at most once.
 */
public interface DebateRunQueue {

    /**
     * Queues a run of the debate.
     *
     * @return {@code false} when the id is already waiting
     */
    boolean enqueue(UUID debateId);

    /**
     * Registers the single consumer and starts dispatching to it.
     */
    void setConsumer(DebateRunQueueConsumer consumer);
}
