package com.aijudge.service;

import com.aijudge.config.AiJudgeRuntimeProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class RedisDebateRunQueueIntegrationTest {

    @Container
    private static final GenericContainer<?> REDIS = new GenericContainer<>("redis:7-alpine")
            .withExposedPorts(6379);

    private LettuceConnectionFactory lettuceConnectionFactory;
    private StringRedisTemplate stringRedisTemplate;
    private InMemoryDebateRunQueue localQueue;
    private RedisDebateRunQueue redisQueue;
    private String queueKey;

    @BeforeEach
    void setUp() {
        queueKey = "aijudge:test:debate:queue:" + UUID.randomUUID();
        lettuceConnectionFactory = new LettuceConnectionFactory(
                new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379))
        );
        lettuceConnectionFactory.afterPropertiesSet();
        lettuceConnectionFactory.start();

        stringRedisTemplate = new StringRedisTemplate(lettuceConnectionFactory);
        stringRedisTemplate.afterPropertiesSet();

        AiJudgeRuntimeProperties runtimeProperties = new AiJudgeRuntimeProperties();
        runtimeProperties.getWorker().setRedisQueueKey(queueKey);
        runtimeProperties.getWorker().setRedisPopTimeoutSeconds(1);

        localQueue = new InMemoryDebateRunQueue();
        redisQueue = new RedisDebateRunQueue(stringRedisTemplate, runtimeProperties, localQueue);
    }

    @AfterEach
    void tearDown() {
        if (redisQueue != null) {
            redisQueue.close();
        }
        if (localQueue != null) {
            localQueue.close();
        }
        if (stringRedisTemplate != null && queueKey != null) {
            stringRedisTemplate.delete(queueKey);
        }
        if (lettuceConnectionFactory != null) {
            lettuceConnectionFactory.destroy();
        }
    }

    @Test
    void debatesQueuedBeforeConsumerRegistrationAreDeliveredInOrder() throws InterruptedException {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        assertTrue(redisQueue.enqueue(first));
        assertTrue(redisQueue.enqueue(second));

        CountDownLatch consumedLatch = new CountDownLatch(2);
        List<UUID> consumed = new CopyOnWriteArrayList<>();
        redisQueue.setConsumer(debateId -> {
            consumed.add(debateId);
            consumedLatch.countDown();
        });

        assertTrue(consumedLatch.await(5, TimeUnit.SECONDS), "Timed out waiting for queued debates");
        assertEquals(List.of(first, second), consumed);
        assertEquals(0L, stringRedisTemplate.opsForList().size(queueKey));
        assertFalse(redisQueue.isRedisUnreachable());
    }

    @Test
    void sameDebateQueuedTwiceOccupiesOneListEntry() {
        UUID debateId = UUID.randomUUID();
        UUID other = UUID.randomUUID();

        assertTrue(redisQueue.enqueue(debateId));
        assertFalse(redisQueue.enqueue(debateId));
        assertTrue(redisQueue.enqueue(other));

        assertEquals(
                List.of(debateId.toString(), other.toString()),
                stringRedisTemplate.opsForList().range(queueKey, 0, -1)
        );
    }
}
