package com.aijudge.provider;

/**
 * Provider abstraction for a single text-generation call.
 */
@FunctionalInterface
public interface CompletionClient {

    /**
     * Returns the generated text, or throws {@link CompletionServiceException}.
     */
    String generate(CompletionRequest request);
}
