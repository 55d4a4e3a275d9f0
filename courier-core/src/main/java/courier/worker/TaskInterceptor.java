package courier.worker;

import courier.TaskEnvelope;
import courier.TaskOutcome;

/**
 * Cross-cutting hook around handler execution.
 *
 * <p>Interceptors run in this order:
 * <ol>
 *   <li>{@link #beforeExecute} in registration order</li>
 *   <li>handler execution</li>
 *   <li>{@link #afterExecute} in reverse registration order</li>
 * </ol>
 *
 * <p>If {@code beforeExecute} throws, the handler is skipped and the exception is classified
 * like a handler exception. {@code afterExecute} exceptions are logged and swallowed.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * WorkerPool.builder()
 *     .interceptor(TaskInterceptor.before(task ->
 *         MDC.put("taskId", task.id().toString())))
 *     .interceptor(TaskInterceptor.after((task, outcome) -> MDC.clear()))
 *     .build();
 * }</pre>
 */
public interface TaskInterceptor {

    /**
     * Called before the handler is invoked.
     *
     * @param task the envelope about to be executed
     * @throws Exception to skip the handler; classified like a handler failure
     */
    default void beforeExecute(TaskEnvelope task) throws Exception {
    }

    /**
     * Called after the handler returned or failed.
     *
     * @param task    the executed envelope
     * @param outcome the classified outcome of this attempt
     */
    default void afterExecute(TaskEnvelope task, TaskOutcome outcome) {
    }

    static TaskInterceptor before(BeforeHook hook) {
        return new TaskInterceptor() {
            @Override
            public void beforeExecute(TaskEnvelope task) throws Exception {
                hook.accept(task);
            }
        };
    }

    static TaskInterceptor after(AfterHook hook) {
        return new TaskInterceptor() {
            @Override
            public void afterExecute(TaskEnvelope task, TaskOutcome outcome) {
                hook.accept(task, outcome);
            }
        };
    }

    @FunctionalInterface
    interface BeforeHook {
        void accept(TaskEnvelope task) throws Exception;
    }

    @FunctionalInterface
    interface AfterHook {
        void accept(TaskEnvelope task, TaskOutcome outcome);
    }
}
