package com.aijudge.debate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs an operation up to a fixed number of attempts with linear backoff
 * ({@code backoff * attempt} between attempts).
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final long backoffMillis;
    private final Sleeper sleeper;

    public RetryExecutor(long backoffMillis) {
        this(backoffMillis, Thread::sleep);
    }

    public RetryExecutor(long backoffMillis, Sleeper sleeper) {
        if (backoffMillis < 0) {
            throw new IllegalArgumentException("backoffMillis must not be negative");
        }
        this.backoffMillis = backoffMillis;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper is required");
    }

    /**
     * Returns the first successful result, or rethrows the last failure once {@code attempts} are spent.
     * An interrupt during backoff restores the interrupt flag and rethrows the last failure immediately.
     */
    public <T> T execute(String label, int attempts, Supplier<T> operation) {
        if (attempts <= 0) {
            throw new IllegalArgumentException("attempts must be greater than zero");
        }
        Objects.requireNonNull(operation, "operation is required");

        RuntimeException lastError = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return operation.get();
            } catch (RuntimeException ex) {
                lastError = ex;
                if (attempt == attempts) {
                    break;
                }
                long delay = backoffMillis * attempt;
                log.warn(
                        "{}: attempt {}/{} failed ({}), retrying in {}ms",
                        label,
                        attempt,
                        attempts,
                        describe(ex),
                        delay
                );
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        log.warn("{}: giving up after {} attempt(s): {}", label, attempts, describe(lastError));
        throw lastError;
    }

    private static String describe(RuntimeException ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
