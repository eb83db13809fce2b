package com.aijudge.provider;

public enum CompletionFailureKind {
    TIMEOUT,
    UNAVAILABLE,
    MODEL_NOT_FOUND,
    RESOURCE_EXHAUSTED,
    MALFORMED
}
