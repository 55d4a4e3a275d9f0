package courier.registry;

/**
 * Thrown when a task name has no registered handler.
 */
public class UnknownTaskException extends RuntimeException {
    private final String taskName;

    public UnknownTaskException(String taskName) {
        super("No handler registered for task: " + taskName);
        this.taskName = taskName;
    }

    public String taskName() {
        return taskName;
    }
}
