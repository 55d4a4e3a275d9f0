package courier.registry;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only lookup of task handlers by name.
 *
 * <p>Workers and dispatchers share one registry. It is fully built before any worker
 * starts and never mutated afterwards, so lookups need no synchronization.
 *
 * @see DefaultTaskRegistry
 */
public interface TaskRegistry {

    /**
     * Looks up a task by name.
     *
     * @param taskName the task name carried by an envelope
     * @return the registration, or empty if the name is unknown
     */
    Optional<TaskRegistration> resolve(String taskName);

    /**
     * Returns every registered task name.
     */
    Set<String> taskNames();

    /**
     * Looks up a task, failing if it is not registered.
     *
     * @param taskName the task name
     * @return the registration
     * @throws UnknownTaskException if the name is unknown
     */
    default TaskRegistration require(String taskName) {
        return resolve(taskName).orElseThrow(() -> new UnknownTaskException(taskName));
    }

    /**
     * Verifies that all the given names are registered.
     *
     * @param taskNames names expected by a caller
     * @throws UnknownTaskException naming the first missing task
     */
    default void requireRegistered(Collection<String> taskNames) {
        for (String name : taskNames) {
            require(name);
        }
    }
}
