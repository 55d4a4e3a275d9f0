package courier.retry;

import courier.TaskEnvelope;

import java.time.Duration;
import java.util.Objects;

/**
 * What the worker does with a delivery after an attempt, as decided by {@link RetryScheduler}.
 */
public sealed interface RetryDecision
        permits RetryDecision.Acknowledge, RetryDecision.Redeliver, RetryDecision.GiveUp {

    /**
     * The attempt succeeded; acknowledge and forget.
     */
    record Acknowledge() implements RetryDecision {
    }

    /**
     * Publish {@code next} after {@code delay}, then acknowledge the current delivery.
     *
     * @param next  copy of the envelope with the attempt incremented
     * @param delay redelivery delay
     */
    record Redeliver(TaskEnvelope next, Duration delay) implements RetryDecision {
        public Redeliver {
            Objects.requireNonNull(next, "next");
            Objects.requireNonNull(delay, "delay");
        }
    }

    /**
     * Acknowledge and record a permanent failure.
     *
     * @param reason    why the task failed
     * @param exhausted {@code true} when a retryable failure ran out of attempts
     */
    record GiveUp(String reason, boolean exhausted) implements RetryDecision {
        public GiveUp {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
