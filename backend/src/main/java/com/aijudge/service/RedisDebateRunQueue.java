package com.aijudge.service;

import com.aijudge.config.AiJudgeRuntimeProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Run queue shared by every instance through a Redis list of debate ids. Pushes skip ids already in
 * the list. While Redis is unreachable, ids go to the local {@link InMemoryDebateRunQueue} and the
 * Redis list is polled again after {@link #RETRY_DELAY}.
 */
@Service
@Primary
@ConditionalOnProperty(
        prefix = "aijudge.worker",
        name = "queue-mode",
        havingValue = "redis"
)
public class RedisDebateRunQueue implements DebateRunQueue {

    private static final Logger log = LoggerFactory.getLogger(RedisDebateRunQueue.class);

    // LPOS needs Redis 6.0.6 or newer
    static final RedisScript<Long> PUSH_IF_ABSENT = new DefaultRedisScript<>(
            "if redis.call('LPOS', KEYS[1], ARGV[1]) then return 0 end "
                    + "redis.call('RPUSH', KEYS[1], ARGV[1]) "
                    + "return 1",
            Long.class
    );
    static final Duration RETRY_DELAY = Duration.ofSeconds(5);

    private final StringRedisTemplate redisTemplate;
    private final AiJudgeRuntimeProperties runtimeProperties;
    private final InMemoryDebateRunQueue localQueue;
    private final AtomicReference<Thread> dispatcher = new AtomicReference<>();

    private volatile boolean open = true;
    private volatile boolean redisUnreachable;

    public RedisDebateRunQueue(
            StringRedisTemplate redisTemplate,
            AiJudgeRuntimeProperties runtimeProperties,
            InMemoryDebateRunQueue localQueue
    ) {
        this.redisTemplate = redisTemplate;
        this.runtimeProperties = runtimeProperties;
        this.localQueue = localQueue;
    }

    @Override
    public boolean enqueue(UUID debateId) {
        Objects.requireNonNull(debateId, "debateId is required");
        if (!open) {
            throw new IllegalStateException("Debate run queue is closed");
        }
        try {
            Long pushed = redisTemplate.execute(PUSH_IF_ABSENT, List.of(queueKey()), debateId.toString());
            markReachable();
            if (pushed == null || pushed == 0L) {
                log.debug("Debate {} is already waiting in the Redis run queue", debateId);
                return false;
            }
            return true;
        } catch (DataAccessException ex) {
            markUnreachable(ex);
            return localQueue.enqueue(debateId);
        }
    }

    @Override
    public void setConsumer(DebateRunQueueConsumer consumer) {
        Objects.requireNonNull(consumer, "consumer is required");
        Thread thread = new Thread(() -> dispatch(consumer), "aijudge-debate-redis-dispatcher");
        thread.setDaemon(true);
        if (!dispatcher.compareAndSet(null, thread)) {
            throw new IllegalStateException("Debate run queue already has a consumer");
        }
        localQueue.setConsumer(consumer);
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

    boolean isRedisUnreachable() {
        return redisUnreachable;
    }

    /**
     * Blocks up to the pop timeout for the next id and hands it to {@code consumer}.
     *
     * @return whether a debate was dispatched
     */
    boolean dispatchNext(DebateRunQueueConsumer consumer) {
        String payload = redisTemplate.opsForList().leftPop(queueKey(), popTimeout());
        markReachable();
        if (payload == null) {
            return false;
        }
        UUID debateId;
        try {
            debateId = UUID.fromString(payload.trim());
        } catch (IllegalArgumentException ex) {
            log.warn("Discarding malformed entry '{}' from the Redis run queue", payload);
            return false;
        }
        consumer.accept(debateId);
        return true;
    }

    private void dispatch(DebateRunQueueConsumer consumer) {
        while (open) {
            try {
                dispatchNext(consumer);
            } catch (DataAccessException ex) {
                markUnreachable(ex);
                if (!pause(RETRY_DELAY)) {
                    return;
                }
            } catch (RuntimeException ex) {
                log.error("Dispatching from the Redis run queue failed", ex);
                if (!pause(RETRY_DELAY)) {
                    return;
                }
            }
        }
    }

    private String queueKey() {
        String key = runtimeProperties.getWorker().getRedisQueueKey();
        if (key == null || key.isBlank()) {
            throw new IllegalStateException("aijudge.worker.redis-queue-key must not be blank");
        }
        return key.trim();
    }

    private Duration popTimeout() {
        long seconds = runtimeProperties.getWorker().getRedisPopTimeoutSeconds();
        if (seconds <= 0) {
            throw new IllegalStateException("aijudge.worker.redis-pop-timeout-seconds must be greater than zero");
        }
        return Duration.ofSeconds(seconds);
    }

    private void markUnreachable(DataAccessException ex) {
        if (!redisUnreachable) {
            redisUnreachable = true;
            log.warn("Redis run queue is unreachable ({}); using the local queue until it recovers",
                    ex.getMessage());
        }
    }

    private void markReachable() {
        if (redisUnreachable) {
            redisUnreachable = false;
            log.info("Redis run queue is reachable again");
        }
    }

    private static boolean pause(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
