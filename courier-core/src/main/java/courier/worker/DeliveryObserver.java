package courier.worker;

import courier.TaskEnvelope;

/**
 * Receives a {@link DeliveryRecord} for every delivery attempt the worker pool settles.
 *
 * <p>Called from worker threads; implementations must be thread-safe and fast. Exceptions are
 * logged and ignored.
 *
 * @see LoggingDeliveryObserver
 * @see courier.dead.DeadTaskLog
 */
public interface DeliveryObserver {

    /**
     * Called once per settled attempt, whatever its outcome.
     *
     * @param record the attempt record
     */
    void onAttempt(DeliveryRecord record);

    /**
     * Called exactly once when a task is given up on: fatal outcome, retries exhausted or no
     * registered handler. Follows the matching {@link #onAttempt} call.
     *
     * @param record   the final attempt record
     * @param envelope the envelope as it was last delivered
     */
    default void onPermanentFailure(DeliveryRecord record, TaskEnvelope envelope) {
    }
}
