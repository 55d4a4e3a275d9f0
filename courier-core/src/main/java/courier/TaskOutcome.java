package courier;

import java.util.Objects;

/**
 * Result of one execution attempt, returned by {@link TaskHandler#handle(TaskEnvelope)} and
 * interpreted by the {@linkplain courier.retry.RetryScheduler retry scheduler}.
 *
 * <ul>
 *   <li>{@link Success}: the work is done; the delivery is acknowledged.</li>
 *   <li>{@link RetryableFailure}: transient problem (timeout, rate limit); the task is
 *       redelivered with backoff until its retry budget runs out.</li>
 *   <li>{@link FatalFailure}: permanent problem (missing entity, invalid recipient); the
 *       delivery is acknowledged and recorded as a permanent failure.</li>
 * </ul>
 */
public sealed interface TaskOutcome
        permits TaskOutcome.Success, TaskOutcome.RetryableFailure, TaskOutcome.FatalFailure {

    /**
     * Singleton success result.
     */
    Success SUCCESS = new Success();

    static Success success() {
        return SUCCESS;
    }

    static RetryableFailure retryable(String reason) {
        return new RetryableFailure(reason);
    }

    static FatalFailure fatal(String reason) {
        return new FatalFailure(reason);
    }

    /**
     * Short label used in logs and metrics: {@code SUCCESS}, {@code RETRYABLE} or {@code FATAL}.
     */
    String label();

    record Success() implements TaskOutcome {
        @Override
        public String label() {
            return "SUCCESS";
        }
    }

    /**
     * @param reason human-readable cause, never null
     */
    record RetryableFailure(String reason) implements TaskOutcome {
        public RetryableFailure {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public String label() {
            return "RETRYABLE";
        }
    }

    /**
     * @param reason human-readable cause, never null
     */
    record FatalFailure(String reason) implements TaskOutcome {
        public FatalFailure {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public String label() {
            return "FATAL";
        }
    }
}
