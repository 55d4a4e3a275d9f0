package courier;

/**
 * Identifies a registered task.
 *
 * <p>Usually implemented by an enum so that callers and handlers share compile-time constants:
 * <pre>{@code
 * public enum Notifications implements TaskName {
 *   SEND_WELCOME_EMAIL("send_welcome_email");
 *
 *   private final String taskName;
 *
 *   Notifications(String taskName) {
 *     this.taskName = taskName;
 *   }
 *
 *   public String taskName() {
 *     return taskName;
 *   }
 * }
 * }</pre>
 *
 * @see courier.registry.TaskRegistry
 */
public interface TaskName {

    /**
     * Returns the wire name of this task. The value travels inside every envelope and is used
     * to resolve the handler on the worker side.
     *
     * @return the task name, never null or empty
     */
    String taskName();
}
