package com.aijudge.provider;

import com.aijudge.config.CompletionProperties;
import com.aijudge.model.Argument;
import com.aijudge.model.WordBand;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Calls a local Ollama server through {@code POST /api/generate} with streaming disabled.
 * One call per invocation; retries and the wall-clock limit are applied by the caller.
 */
@Component
public class OllamaCompletionClient implements CompletionClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaCompletionClient.class);
    private static final String GENERATE_PATH = "/api/generate";
    private static final List<String> RESOURCE_EXHAUSTED_SIGNALS = List.of(
            "out of memory",
            "vram",
            "cuda error"
    );

    private final RestClient restClient;
    private final CompletionProperties completionProperties;

    public OllamaCompletionClient(
            @Qualifier("ollamaRestClient") RestClient restClient,
            CompletionProperties completionProperties
    ) {
        this.restClient = restClient;
        this.completionProperties = completionProperties;
    }

    @Override
    public String generate(CompletionRequest request) {
        String model = resolveModel();
        long startedAt = System.nanoTime();

        JsonNode response;
        try {
            response = restClient.post()
                    .uri(GENERATE_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(buildPayload(model, request))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException ex) {
            throw classifyResponseFailure(model, ex);
        } catch (ResourceAccessException ex) {
            throw classifyAccessFailure(ex);
        } catch (RestClientException ex) {
            throw new CompletionServiceException(
                    CompletionFailureKind.MALFORMED,
                    "Unreadable response from Ollama: " + ex.getMessage(),
                    ex
            );
        }

        String text = extractText(response);
        int responseWords = Argument.countWords(text);
        if (responseWords < completionProperties.getMinResponseWords()) {
            throw new CompletionServiceException(
                    CompletionFailureKind.MALFORMED,
                    "Malformed or empty response from model (" + responseWords + " words)"
            );
        }

        long elapsedMillis = (System.nanoTime() - startedAt) / 1_000_000L;
        log.info(
                "Ollama call ok: model={}, prompt_words={}, response_words={}, approx_tokens={}, latency_ms={}",
                model,
                Argument.countWords(request.prompt()),
                responseWords,
                WordBand.tokenCeiling(responseWords),
                elapsedMillis
        );
        return text;
    }

    private Map<String, Object> buildPayload(String model, CompletionRequest request) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("temperature", request.temperature());
        options.put("num_predict", request.maxTokens());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("prompt", request.prompt());
        if (StringUtils.hasText(request.systemPrompt())) {
            payload.put("system", request.systemPrompt());
        }
        payload.put("stream", false);
        request.options().forEach((key, value) -> {
            if (CompletionRequest.OPTION_FORMAT.equals(key)) {
                payload.put(key, value);
            } else {
                options.put(key, value);
            }
        });
        payload.put("options", options);
        return payload;
    }

    private static String extractText(JsonNode response) {
        if (response == null || !response.isObject()) {
            throw new CompletionServiceException(
                    CompletionFailureKind.MALFORMED,
                    "Ollama response must be a JSON object"
            );
        }
        JsonNode textNode = response.get("response");
        if (textNode == null || !textNode.isTextual()) {
            throw new CompletionServiceException(
                    CompletionFailureKind.MALFORMED,
                    "Ollama response is missing the 'response' field"
            );
        }
        return textNode.textValue().trim();
    }

    private CompletionServiceException classifyResponseFailure(String model, RestClientResponseException ex) {
        String body = ex.getResponseBodyAsString().toLowerCase(Locale.ROOT);
        if (containsResourceExhaustedSignal(body)) {
            return new CompletionServiceException(
                    CompletionFailureKind.RESOURCE_EXHAUSTED,
                    "VRAM exhausted while generating; try a smaller model or shorter prompt",
                    ex
            );
        }
        if (ex.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
            return new CompletionServiceException(
                    CompletionFailureKind.MODEL_NOT_FOUND,
                    "Model not found in Ollama: ensure it's pulled (" + model + ")",
                    ex
            );
        }
        return new CompletionServiceException(
                CompletionFailureKind.UNAVAILABLE,
                "Ollama returned HTTP " + ex.getStatusCode().value(),
                ex
        );
    }

    private CompletionServiceException classifyAccessFailure(ResourceAccessException ex) {
        if (ex.getCause() instanceof SocketTimeoutException) {
            return new CompletionServiceException(
                    CompletionFailureKind.TIMEOUT,
                    "Ollama did not answer within " + completionProperties.getTimeoutSeconds() + "s",
                    ex
            );
        }
        return new CompletionServiceException(
                CompletionFailureKind.UNAVAILABLE,
                "Cannot reach Ollama server. Is it running?",
                ex
        );
    }

    private static boolean containsResourceExhaustedSignal(String body) {
        for (String signal : RESOURCE_EXHAUSTED_SIGNALS) {
            if (body.contains(signal)) {
                return true;
            }
        }
        return false;
    }

    private String resolveModel() {
        String model = completionProperties.getModel();
        if (!StringUtils.hasText(model)) {
            throw new IllegalStateException("aijudge.completion.model must not be blank");
        }
        return model.trim();
    }
}
