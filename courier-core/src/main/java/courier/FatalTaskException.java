package courier;

/**
 * Thrown from handler code to mark the current attempt as a permanent failure.
 *
 * <p>Equivalent to returning {@link TaskOutcome#fatal(String)}; useful when the failure is
 * detected deep in a call stack. The task is acknowledged and never redelivered.
 */
public class FatalTaskException extends RuntimeException {

    public FatalTaskException(String message) {
        super(message);
    }

    public FatalTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
