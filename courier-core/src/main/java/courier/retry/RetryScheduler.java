package courier.retry;

import courier.TaskEnvelope;
import courier.TaskOutcome;

import java.time.Duration;
import java.util.Objects;

/**
 * Turns an attempt outcome into a {@link RetryDecision}.
 *
 * <p>Pure and thread-safe: it never sleeps and never touches the broker. Delayed redelivery is
 * carried out by the worker through a {@link courier.spi.RedeliveryScheduler}.
 *
 * <ul>
 *   <li>{@code Success} → {@link RetryDecision.Acknowledge}</li>
 *   <li>{@code FatalFailure} → {@link RetryDecision.GiveUp}</li>
 *   <li>{@code RetryableFailure} with {@code attempt + 1 >= maxRetries} →
 *       {@link RetryDecision.GiveUp} (exhausted)</li>
 *   <li>otherwise {@link RetryDecision.Redeliver} with {@code attempt + 1} after
 *       {@link RetryPolicy#delayFor(int, Duration)}</li>
 * </ul>
 */
public final class RetryScheduler {
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(600);

    private static final RetryDecision.Acknowledge ACKNOWLEDGE = new RetryDecision.Acknowledge();

    private final Duration maxDelay;

    public RetryScheduler() {
        this(DEFAULT_MAX_DELAY);
    }

    /**
     * @param maxDelay ceiling applied to every computed redelivery delay
     */
    public RetryScheduler(Duration maxDelay) {
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay must not be negative");
        }
        this.maxDelay = maxDelay;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    public RetryDecision decide(TaskEnvelope envelope, RetryPolicy policy, TaskOutcome outcome) {
        Objects.requireNonNull(envelope, "envelope");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(outcome, "outcome");

        if (outcome instanceof TaskOutcome.Success) {
            return ACKNOWLEDGE;
        }
        if (outcome instanceof TaskOutcome.FatalFailure fatal) {
            return new RetryDecision.GiveUp(fatal.reason(), false);
        }
        TaskOutcome.RetryableFailure retryable = (TaskOutcome.RetryableFailure) outcome;
        int attempt = envelope.attempt();
        if (attempt + 1 >= policy.maxRetries()) {
            return new RetryDecision.GiveUp("Retries exhausted after " + (attempt + 1)
                    + " attempt(s): " + retryable.reason(), true);
        }
        return new RetryDecision.Redeliver(envelope.nextAttempt(), policy.delayFor(attempt, maxDelay));
    }
}
