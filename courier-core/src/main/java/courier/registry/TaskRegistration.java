package courier.registry;

import courier.TaskHandler;
import courier.retry.RetryPolicy;

import java.util.Objects;

/**
 * A registered task: its handler, retry policy and the queue it is published to by default.
 *
 * @param name     unique task name
 * @param handler  handler invoked by workers
 * @param policy   retry budget and backoff
 * @param queue    default queue for dispatch
 */
public record TaskRegistration(String name, TaskHandler handler, RetryPolicy policy, String queue) {

    public TaskRegistration {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(queue, "queue");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be empty");
        }
        if (queue.isEmpty()) {
            throw new IllegalArgumentException("queue cannot be empty");
        }
    }
}
