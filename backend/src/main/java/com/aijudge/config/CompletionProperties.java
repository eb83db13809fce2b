package com.aijudge.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Completion service connection and sampling settings.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "aijudge.completion")
public class CompletionProperties {

    private String model = "llama3:8b";
    private String baseUrl = "http://localhost:11434";
    private int timeoutSeconds = 120;
    private int connectTimeoutSeconds = 5;
    private int maxAttempts = 3;
    private long backoffMillis = 1_500;

    /**
     * Responses with fewer words are treated as malformed.
     */
    private int minResponseWords = 10;

    private Temperatures temperatures = new Temperatures();

    @Getter
    @Setter
    public static class Temperatures {
        private double emotional = 0.8;
        private double logical = 0.25;
        private double judge = 0.0;
    }
}
