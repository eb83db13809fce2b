package com.aijudge.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryDebateRunQueueTest {

    private InMemoryDebateRunQueue queue;

    @BeforeEach
    void setUp() {
        queue = new InMemoryDebateRunQueue();
    }

    @AfterEach
    void tearDown() {
        queue.close();
    }

    @Test
    void debatesWaitForConsumerAndAreDeliveredInOrder() throws InterruptedException {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        queue.enqueue(first);
        queue.enqueue(second);

        List<UUID> received = new CopyOnWriteArrayList<>();
        CountDownLatch delivered = new CountDownLatch(2);
        queue.setConsumer(debateId -> {
            received.add(debateId);
            delivered.countDown();
        });

        assertTrue(delivered.await(5, TimeUnit.SECONDS));
        assertEquals(List.of(first, second), received);
        assertEquals(0, queue.waitingCount());
    }

    @Test
    void debateWaitingAlreadyIsNotQueuedTwice() throws InterruptedException {
        UUID debateId = UUID.randomUUID();
        UUID other = UUID.randomUUID();

        assertTrue(queue.enqueue(debateId));
        assertFalse(queue.enqueue(debateId));
        assertTrue(queue.enqueue(other));
        assertEquals(2, queue.waitingCount());

        List<UUID> received = new CopyOnWriteArrayList<>();
        CountDownLatch delivered = new CountDownLatch(2);
        queue.setConsumer(id -> {
            received.add(id);
            delivered.countDown();
        });

        assertTrue(delivered.await(5, TimeUnit.SECONDS));
        assertEquals(List.of(debateId, other), received);
    }

    @Test
    void debateCanBeQueuedAgainOnceDispatched() throws InterruptedException {
        UUID debateId = UUID.randomUUID();
        CountDownLatch dispatched = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        queue.setConsumer(id -> {
            dispatched.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });

        queue.enqueue(debateId);
        assertTrue(dispatched.await(5, TimeUnit.SECONDS));

        assertTrue(queue.enqueue(debateId));
        assertFalse(queue.enqueue(debateId));
        release.countDown();
    }

    @Test
    void consumerFailureDoesNotStopDispatching() throws InterruptedException {
        UUID failing = UUID.randomUUID();
        UUID healthy = UUID.randomUUID();
        CountDownLatch delivered = new CountDownLatch(1);
        queue.setConsumer(debateId -> {
            if (debateId.equals(failing)) {
                throw new IllegalStateException("consumer failed");
            }
            delivered.countDown();
        });

        queue.enqueue(failing);
        queue.enqueue(healthy);

        assertTrue(delivered.await(5, TimeUnit.SECONDS));
    }

    @Test
    void secondConsumerIsRejected() {
        queue.setConsumer(debateId -> {
        });

        IllegalStateException thrown = assertThrows(
                IllegalStateException.class,
                () -> queue.setConsumer(debateId -> {
                })
        );

        assertEquals("Debate run queue already has a consumer", thrown.getMessage());
    }

    @Test
    void enqueueAfterCloseIsRejected() {
        queue.close();

        IllegalStateException thrown = assertThrows(
                IllegalStateException.class,
                () -> queue.enqueue(UUID.randomUUID())
        );

        assertEquals("Debate run queue is closed", thrown.getMessage());
    }
}
