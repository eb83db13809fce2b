package com.aijudge.service;

import com.aijudge.config.AiJudgeRuntimeProperties;
import com.aijudge.config.CompletionProperties;
import com.aijudge.debate.RetryExecutor;
import com.aijudge.provider.CompletionClient;
import com.aijudge.provider.CompletionFailureKind;
import com.aijudge.provider.CompletionRequest;
import com.aijudge.provider.CompletionServiceException;
import com.aijudge.provider.MockCompletionClient;
import com.aijudge.provider.OllamaCompletionClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves the completion provider and executes a call under a wall-clock timeout with bounded retry.
 */
@Service
public class CompletionGateway implements CompletionClient {

    private final AiJudgeRuntimeProperties runtimeProperties;
    private final CompletionProperties completionProperties;
    private final MockCompletionClient mockCompletionClient;
    private final OllamaCompletionClient ollamaCompletionClient;
    private final RetryExecutor retryExecutor;

    @Autowired
    public CompletionGateway(
            AiJudgeRuntimeProperties runtimeProperties,
            CompletionProperties completionProperties,
            MockCompletionClient mockCompletionClient,
            OllamaCompletionClient ollamaCompletionClient
    ) {
        this(
                runtimeProperties,
                completionProperties,
                mockCompletionClient,
                ollamaCompletionClient,
                new RetryExecutor(completionProperties.getBackoffMillis())
        );
    }

    CompletionGateway(
            AiJudgeRuntimeProperties runtimeProperties,
            CompletionProperties completionProperties,
            MockCompletionClient mockCompletionClient,
            OllamaCompletionClient ollamaCompletionClient,
            RetryExecutor retryExecutor
    ) {
        this.runtimeProperties = runtimeProperties;
        this.completionProperties = completionProperties;
        this.mockCompletionClient = mockCompletionClient;
        this.ollamaCompletionClient = ollamaCompletionClient;
        this.retryExecutor = retryExecutor;
    }

    @Override
    public String generate(CompletionRequest request) {
        CompletionClient client = runtimeProperties.isMockProvider() ? mockCompletionClient : ollamaCompletionClient;
        return retryExecutor.execute(
                "completion call",
                resolveMaxAttempts(),
                () -> generateWithTimeout(client, request)
        );
    }

    private String generateWithTimeout(CompletionClient client, CompletionRequest request) {
        int timeoutSeconds = resolveTimeoutSeconds();
        FutureTask<String> completionTask = new FutureTask<>(() -> client.generate(request));
        Thread worker = new Thread(completionTask, "aijudge-completion-call");
        worker.setDaemon(true);
        worker.start();

        try {
            return completionTask.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException ex) {
            completionTask.cancel(true);
            throw new CompletionServiceException(
                    CompletionFailureKind.TIMEOUT,
                    "Generation exceeded " + timeoutSeconds + "s",
                    ex
            );
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof CompletionServiceException) {
                throw (CompletionServiceException) cause;
            }
            throw new CompletionServiceException(
                    CompletionFailureKind.UNAVAILABLE,
                    "Completion call failed: " + cause.getMessage(),
                    cause
            );
        } catch (InterruptedException ex) {
            completionTask.cancel(true);
            Thread.currentThread().interrupt();
            throw new CompletionServiceException(
                    CompletionFailureKind.TIMEOUT,
                    "Interrupted while waiting for completion",
                    ex
            );
        }
    }

    private int resolveTimeoutSeconds() {
        int timeoutSeconds = completionProperties.getTimeoutSeconds();
        if (timeoutSeconds <= 0) {
            throw new IllegalStateException("aijudge.completion.timeout-seconds must be greater than zero");
        }
        return timeoutSeconds;
    }

    private int resolveMaxAttempts() {
        return Math.max(1, completionProperties.getMaxAttempts());
    }
}
