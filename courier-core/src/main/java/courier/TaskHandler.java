package courier;

/**
 * Executable logic bound to a task name in the {@link courier.registry.TaskRegistry}.
 *
 * <h2>Execution Model</h2>
 * <p>Handlers run synchronously on a worker thread. A handler may block on network I/O;
 * that only occupies its own worker, never the others.
 *
 * <h2>Outcomes</h2>
 * <p>Handlers report their result as data by returning a {@link TaskOutcome}. Exceptions
 * are still caught at the worker boundary and classified:
 * <ul>
 *   <li>{@link FatalTaskException} becomes a {@link TaskOutcome.FatalFailure}</li>
 *   <li>any other exception becomes a {@link TaskOutcome.RetryableFailure}</li>
 * </ul>
 *
 * <h2>Idempotency</h2>
 * <p>Delivery is at-least-once. A handler may run more than once for the same
 * {@link TaskEnvelope#id()} and must re-read authoritative state instead of trusting
 * payload snapshots.
 */
@FunctionalInterface
public interface TaskHandler {

    /**
     * Executes one attempt.
     *
     * @param task the delivered envelope
     * @return the attempt outcome, never null
     * @throws Exception if execution fails; classified by the worker
     */
    TaskOutcome handle(TaskEnvelope task) throws Exception;
}
