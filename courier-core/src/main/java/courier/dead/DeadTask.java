package courier.dead;

import courier.TaskEnvelope;
import courier.worker.DeliveryRecord;

import java.util.Objects;

/**
 * A task the worker pool gave up on.
 *
 * @param envelope the envelope as last delivered
 * @param record   the final delivery record, carrying the failure reason
 */
public record DeadTask(TaskEnvelope envelope, DeliveryRecord record) {

    public DeadTask {
        Objects.requireNonNull(envelope, "envelope");
        Objects.requireNonNull(record, "record");
    }

    public String reason() {
        return record.reason();
    }
}
