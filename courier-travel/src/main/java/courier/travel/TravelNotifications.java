package courier.travel;

import courier.registry.DefaultTaskRegistry;
import courier.retry.RetryPolicy;
import courier.travel.booking.BookingDirectory;
import courier.travel.mail.EmailSender;
import courier.travel.notification.BookingConfirmationEmailHandler;
import courier.travel.notification.EmailTemplates;
import courier.travel.notification.PaymentConfirmationEmailHandler;
import courier.travel.notification.PaymentFailedEmailHandler;

import java.time.Duration;
import java.util.Objects;

/**
 * Registers the notification handlers on a task registry.
 *
 * <pre>{@code
 * DefaultTaskRegistry registry = TravelNotifications.register(
 *         DefaultTaskRegistry.builder(), directory, sender, new EmailTemplates("no-reply@example.com"))
 *     .build();
 * }</pre>
 */
public final class TravelNotifications {
    public static final String DEFAULT_QUEUE = "emails";

    private TravelNotifications() {
    }

    /**
     * Three retries, 60 s base delay, exponential backoff.
     */
    public static RetryPolicy defaultPolicy() {
        return RetryPolicy.exponential(3, Duration.ofSeconds(60));
    }

    public static DefaultTaskRegistry.Builder register(DefaultTaskRegistry.Builder registry,
            BookingDirectory directory, EmailSender sender, EmailTemplates templates) {
        return register(registry, directory, sender, templates, defaultPolicy(), DEFAULT_QUEUE);
    }

    /**
     * Registers all three notification tasks with the same policy and queue.
     *
     * @throws courier.registry.DuplicateTaskRegistrationException if one of the names is taken
     */
    public static DefaultTaskRegistry.Builder register(DefaultTaskRegistry.Builder registry,
            BookingDirectory directory, EmailSender sender, EmailTemplates templates,
            RetryPolicy policy, String queue) {
        Objects.requireNonNull(registry, "registry");
        return registry
                .register(NotificationTasks.BOOKING_CONFIRMATION,
                        new BookingConfirmationEmailHandler(directory, sender, templates), policy, queue)
                .register(NotificationTasks.PAYMENT_CONFIRMATION,
                        new PaymentConfirmationEmailHandler(directory, sender, templates), policy, queue)
                .register(NotificationTasks.PAYMENT_FAILED,
                        new PaymentFailedEmailHandler(directory, sender, templates), policy, queue);
    }
}
