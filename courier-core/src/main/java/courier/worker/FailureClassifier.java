package courier.worker;

import courier.FatalTaskException;
import courier.TaskOutcome;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maps a throwable escaping a handler to a {@link TaskOutcome}.
 *
 * <ul>
 *   <li>{@link FatalTaskException} → {@code FatalFailure}</li>
 *   <li>{@link InterruptedException} → {@code RetryableFailure}; the interrupt flag is restored</li>
 *   <li>any other exception → {@code RetryableFailure}</li>
 *   <li>{@link Error} → {@code RetryableFailure}, logged at {@code SEVERE}; the broker redelivers</li>
 * </ul>
 */
public final class FailureClassifier {
    private static final Logger logger = Logger.getLogger(FailureClassifier.class.getName());

    private FailureClassifier() {
    }

    public static TaskOutcome classify(Throwable failure) {
        if (failure instanceof FatalTaskException) {
            return TaskOutcome.fatal(describe(failure));
        }
        if (failure instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return TaskOutcome.retryable("Interrupted");
        }
        if (failure instanceof Error) {
            logger.log(Level.SEVERE, "Handler raised an error", failure);
        }
        return TaskOutcome.retryable(describe(failure));
    }

    static String describe(Throwable failure) {
        String message = failure.getMessage();
        String type = failure.getClass().getSimpleName();
        return message == null || message.isEmpty() ? type : type + ": " + message;
    }
}
