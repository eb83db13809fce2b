package com.aijudge.provider;

import java.util.Objects;

/**
 * Failure of a completion call, classified by {@link CompletionFailureKind}.
 */
public class CompletionServiceException extends RuntimeException {

    private final CompletionFailureKind kind;

    public CompletionServiceException(CompletionFailureKind kind, String message) {
        this(kind, message, null);
    }

    public CompletionServiceException(CompletionFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind is required");
    }

    public CompletionFailureKind getKind() {
        return kind;
    }
}
