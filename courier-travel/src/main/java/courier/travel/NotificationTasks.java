package courier.travel;

import courier.TaskName;

/**
 * Notification tasks and their payload arguments.
 */
public enum NotificationTasks implements TaskName {
    /** Payload: {@code bookingId}. */
    BOOKING_CONFIRMATION("send_booking_confirmation_email"),
    /** Payload: {@code transactionRef}, {@code bookingId}. */
    PAYMENT_CONFIRMATION("send_payment_confirmation_email"),
    /** Payload: {@code transactionRef}, {@code bookingId}. */
    PAYMENT_FAILED("send_payment_failed_email");

    public static final String BOOKING_ID = "bookingId";
    public static final String TRANSACTION_REF = "transactionRef";

    private final String taskName;

    NotificationTasks(String taskName) {
        this.taskName = taskName;
    }

    @Override
    public String taskName() {
        return taskName;
    }
}
