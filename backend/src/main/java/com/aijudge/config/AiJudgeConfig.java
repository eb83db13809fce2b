package com.aijudge.config;

import com.aijudge.debate.DebateOrchestrator;
import com.aijudge.debate.DebateSettings;
import com.aijudge.debate.ResponseNormalizer;
import com.aijudge.debate.RetryExecutor;
import com.aijudge.debate.VerdictExtractor;
import com.aijudge.model.DebateRound;
import com.aijudge.model.WordBand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AiJudgeConfig {

    private static final Logger log = LoggerFactory.getLogger(AiJudgeConfig.class);

    @Bean
    public RestClient ollamaRestClient(CompletionProperties completionProperties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(Duration.ofSeconds(Math.max(1, completionProperties.getConnectTimeoutSeconds())));
        factory.setReadTimeout(Duration.ofSeconds(Math.max(1, completionProperties.getTimeoutSeconds())));

        log.info("Ollama client targets {} with model {}",
                completionProperties.getBaseUrl(), completionProperties.getModel());
        return RestClient.builder()
                .baseUrl(completionProperties.getBaseUrl())
                .requestFactory(factory)
                .build();
    }

    @Bean
    public ResponseNormalizer responseNormalizer() {
        return new ResponseNormalizer();
    }

    @Bean
    public VerdictExtractor verdictExtractor() {
        return new VerdictExtractor();
    }

    @Bean(name = "debateWorkerExecutor", destroyMethod = "shutdownNow")
    public ExecutorService debateWorkerExecutor(AiJudgeRuntimeProperties runtimeProperties) {
        int threads = Math.max(1, runtimeProperties.getWorker().getThreads());
        return Executors.newFixedThreadPool(threads, namedDaemonThreads("aijudge-debate-worker-"));
    }

    @Bean(name = "debateAgentExecutor", destroyMethod = "shutdownNow")
    public ExecutorService debateAgentExecutor(AiJudgeRuntimeProperties runtimeProperties) {
        // two lawyers per running debate
        int threads = Math.max(2, runtimeProperties.getWorker().getThreads() * 2);
        return Executors.newFixedThreadPool(threads, namedDaemonThreads("aijudge-debate-agent-"));
    }

    @Bean
    public DebateOrchestrator debateOrchestrator(
            VerdictExtractor verdictExtractor,
            @Qualifier("debateAgentExecutor") ExecutorService debateAgentExecutor,
            AiJudgeRuntimeProperties runtimeProperties,
            JudgeProperties judgeProperties
    ) {
        AiJudgeRuntimeProperties.Debate debate = runtimeProperties.getDebate();
        if (debate.getRounds() != DebateRound.values().length) {
            throw new IllegalStateException("aijudge.debate.rounds must be " + DebateRound.values().length
                    + " but was " + debate.getRounds());
        }

        DebateSettings settings = new DebateSettings(
                new WordBand(debate.getMinWords(), debate.getMaxWords()),
                debate.getCallAttempts(),
                debate.isParallelAgents(),
                judgeProperties.isRepairEnabled()
        );
        return new DebateOrchestrator(
                verdictExtractor,
                new RetryExecutor(debate.getBackoffMillis()),
                debateAgentExecutor,
                settings
        );
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
