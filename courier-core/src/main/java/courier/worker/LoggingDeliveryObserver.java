package courier.worker;

import courier.TaskEnvelope;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes delivery records to the {@value #LOGGER_NAME} logger.
 *
 * <p>Successes are logged at {@code FINE}, retryable failures at {@code WARNING}, permanent
 * failures at {@code SEVERE}.
 */
public final class LoggingDeliveryObserver implements DeliveryObserver {
    public static final String LOGGER_NAME = "courier.delivery";

    private final Logger logger;

    public LoggingDeliveryObserver() {
        this(Logger.getLogger(LOGGER_NAME));
    }

    LoggingDeliveryObserver(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void onAttempt(DeliveryRecord record) {
        Level level = switch (record.outcome()) {
            case "SUCCESS" -> Level.FINE;
            case "RETRYABLE" -> Level.WARNING;
            default -> Level.INFO;
        };
        if (logger.isLoggable(level)) {
            logger.log(level, record.toLogLine());
        }
    }

    @Override
    public void onPermanentFailure(DeliveryRecord record, TaskEnvelope envelope) {
        logger.log(Level.SEVERE, "permanent_failure " + record.toLogLine());
    }
}
