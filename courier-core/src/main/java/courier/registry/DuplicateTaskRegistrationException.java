package courier.registry;

/**
 * Thrown when the same task name is registered twice.
 */
public class DuplicateTaskRegistrationException extends RuntimeException {
    private final String taskName;

    public DuplicateTaskRegistrationException(String taskName) {
        super("Task already registered: " + taskName);
        this.taskName = taskName;
    }

    public String taskName() {
        return taskName;
    }
}
