package courier.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-task retry budget and backoff, attached to a task name at registration and never
 * changed afterwards.
 *
 * <p>{@code maxRetries} is the total number of attempts a task gets: {@code 0} and {@code 1}
 * both mean a single attempt with no redelivery.
 *
 * @param maxRetries attempt budget, {@code >= 0}
 * @param baseDelay  delay unit for the backoff formula, not negative
 * @param backoff    growth strategy
 */
public record RetryPolicy(int maxRetries, Duration baseDelay, BackoffStrategy backoff) {

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
        }
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(backoff, "backoff");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
    }

    /**
     * Exactly one attempt, never redelivered.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(0, Duration.ZERO, BackoffStrategy.FIXED);
    }

    public static RetryPolicy fixed(int maxRetries, Duration baseDelay) {
        return new RetryPolicy(maxRetries, baseDelay, BackoffStrategy.FIXED);
    }

    public static RetryPolicy exponential(int maxRetries, Duration baseDelay) {
        return new RetryPolicy(maxRetries, baseDelay, BackoffStrategy.EXPONENTIAL);
    }

    /**
     * Computes the redelivery delay after a failure of the given attempt, capped at
     * {@code ceiling}.
     *
     * @param attempt zero-based attempt that failed
     * @param ceiling maximum delay
     * @return the delay, between zero and {@code ceiling}
     */
    public Duration delayFor(int attempt, Duration ceiling) {
        Objects.requireNonNull(ceiling, "ceiling");
        long baseMs = baseDelay.toMillis();
        long capMs = ceiling.toMillis();
        long multiplier = backoff.multiplier(attempt);
        if (baseMs == 0L || multiplier == 0L) {
            return Duration.ZERO;
        }
        // Guard against overflow: if multiplier exceeds capMs/baseMs, cap directly
        long delayMs = multiplier > capMs / baseMs ? capMs : baseMs * multiplier;
        return Duration.ofMillis(Math.min(capMs, delayMs));
    }
}
