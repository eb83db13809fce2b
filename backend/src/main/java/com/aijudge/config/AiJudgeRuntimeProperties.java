package com.aijudge.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Runtime switches for debate execution: provider mode, worker and per-debate limits.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "aijudge")
public class AiJudgeRuntimeProperties {

    /**
     * Serve completions from the deterministic in-process generator instead of Ollama.
     */
    private boolean mockProvider = true;

    private Worker worker = new Worker();
    private Debate debate = new Debate();

    @Getter
    @Setter
    public static class Worker {
        private boolean enabled = true;
        private int threads = 4;
        private String queueMode = "in_memory";
        private String redisQueueKey = "aijudge:debate:queue";
        private long redisPopTimeoutSeconds = 1;

        /**
         * A claimed debate whose claim is older than this is run again by any worker.
         */
        private long claimLeaseSeconds = 300;
        private long recoveryIntervalMs = 60_000;
        private long recoveryInitialDelayMs = 5_000;
    }

    @Getter
    @Setter
    public static class Debate {
        private int minWords = 250;
        private int maxWords = 350;
        private int rounds = 3;

        /**
         * Attempts per agent or judge call before the debate is marked failed.
         */
        private int callAttempts = 3;

        /**
         * Completion calls a lawyer may spend reaching the minimum word count.
         */
        private int lengthCorrectionAttempts = 2;
        private long backoffMillis = 1_500;
        private boolean parallelAgents = true;
    }
}
