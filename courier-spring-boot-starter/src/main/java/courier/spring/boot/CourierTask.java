package courier.spring.boot;

import courier.retry.BackoffStrategy;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Registers a Spring bean as the handler of a task.
 *
 * <p>The annotated bean must implement {@link courier.TaskHandler}.
 *
 * <pre>{@code
 * @Component
 * @CourierTask(value = "send_review_reminder_email", maxRetries = 5, baseDelayMs = 30_000)
 * public class ReviewReminderHandler implements TaskHandler {
 *     public TaskOutcome handle(TaskEnvelope task) { ... }
 * }
 * }</pre>
 *
 * @see courier.TaskHandler
 * @see CourierTaskScanner
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface CourierTask {

    /**
     * Task name. Must be unique across the application.
     */
    String value();

    /**
     * Default queue. Empty means the registry default, {@code emails}.
     */
    String queue() default "";

    /**
     * Redeliveries after the first attempt. {@code 0} disables retries.
     */
    int maxRetries() default 0;

    /**
     * Delay before the first redelivery, in milliseconds.
     */
    long baseDelayMs() default 0;

    BackoffStrategy backoff() default BackoffStrategy.EXPONENTIAL;
}
