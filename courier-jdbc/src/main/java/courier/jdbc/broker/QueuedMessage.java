package courier.jdbc.broker;

import java.time.Instant;
import java.util.Objects;

/**
 * One row of the message table, as inserted by the broker and as returned by a claim.
 *
 * @param messageId   ULID assigned at insert; unique per physical message
 * @param taskId      envelope id, or {@code null} for raw messages
 * @param taskName    task name, or {@code null} for raw messages
 * @param queue       logical queue name
 * @param body        encoded envelope
 * @param contentType codec content type of {@code body}
 * @param availableAt earliest instant the message may be claimed
 */
public record QueuedMessage(
        String messageId,
        String taskId,
        String taskName,
        String queue,
        String body,
        String contentType,
        Instant availableAt
) {

    public QueuedMessage {
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(contentType, "contentType");
        Objects.requireNonNull(availableAt, "availableAt");
    }
}
