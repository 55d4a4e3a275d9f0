package courier.travel.notification;

import courier.TaskEnvelope;
import courier.TaskHandler;
import courier.TaskOutcome;
import courier.travel.booking.BookingDirectory;
import courier.travel.mail.EmailMessage;
import courier.travel.mail.EmailSender;
import courier.travel.mail.SendResult;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Template for notification handlers: re-read authoritative state, render, send, map the
 * transport result to a {@link TaskOutcome}.
 *
 * <p>Subclasses implement {@link #compose(TaskEnvelope)} and report one of four things through
 * {@link Composition}: a message to send, a skip (state contradicts the email; the task
 * succeeds without sending), a wait (state has not caught up with the task yet; retried with
 * backoff), or a missing entity (fatal). Exceptions thrown while composing,
 * such as a directory outage, reach the worker and are retried.
 *
 * <p>Sending twice is tolerated; handlers keep no record of earlier sends.
 */
public abstract class AbstractEmailHandler implements TaskHandler {
    private static final Logger logger = Logger.getLogger(AbstractEmailHandler.class.getName());

    protected final BookingDirectory directory;
    protected final EmailSender sender;
    protected final EmailTemplates templates;

    protected AbstractEmailHandler(BookingDirectory directory, EmailSender sender, EmailTemplates templates) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.templates = Objects.requireNonNull(templates, "templates");
    }

    @Override
    public final TaskOutcome handle(TaskEnvelope task) {
        Composition composition = compose(task);
        if (composition instanceof Composition.Missing missing) {
            return TaskOutcome.fatal(missing.reason());
        }
        if (composition instanceof Composition.Wait wait) {
            logger.log(Level.FINE, "Deferring {0} for task {1}: {2}",
                    new Object[] {task.taskName(), task.id(), wait.reason()});
            return TaskOutcome.retryable(wait.reason());
        }
        if (composition instanceof Composition.Skip skip) {
            logger.log(Level.INFO, "Skipping {0} for task {1}: {2}",
                    new Object[] {task.taskName(), task.id(), skip.reason()});
            return TaskOutcome.success();
        }
        EmailMessage message = ((Composition.Send) composition).message();
        SendResult result = sender.send(message);
        if (result instanceof SendResult.Sent) {
            logger.log(Level.INFO, "{0} sent to {1}", new Object[] {task.taskName(), message.to()});
            return TaskOutcome.success();
        }
        if (result instanceof SendResult.TransientError error) {
            return TaskOutcome.retryable(error.reason());
        }
        if (result instanceof SendResult.PermanentError error) {
            return TaskOutcome.fatal(error.reason());
        }
        throw new IllegalStateException("EmailSender returned " + result);
    }

    /**
     * Loads current state for the task and decides what to send.
     */
    protected abstract Composition compose(TaskEnvelope task);

    /**
     * Returns a payload argument, or {@code null} when it is absent or blank.
     */
    protected static String argument(TaskEnvelope task, String name) {
        String value = task.argument(name);
        return value == null || value.isBlank() ? null : value;
    }

    /**
     * What a handler decided to do for one attempt.
     */
    protected sealed interface Composition
            permits Composition.Send, Composition.Skip, Composition.Wait, Composition.Missing {

        static Composition send(EmailMessage message) {
            return new Send(message);
        }

        static Composition skip(String reason) {
            return new Skip(reason);
        }

        static Composition waitFor(String reason) {
            return new Wait(reason);
        }

        static Composition missing(String reason) {
            return new Missing(reason);
        }

        record Send(EmailMessage message) implements Composition {
            public Send {
                Objects.requireNonNull(message, "message");
            }
        }

        record Skip(String reason) implements Composition {
        }

        record Wait(String reason) implements Composition {
        }

        record Missing(String reason) implements Composition {
        }
    }
}
