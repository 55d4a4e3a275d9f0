package courier.worker;

import courier.TaskEnvelope;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Structured record of one delivery attempt.
 *
 * @param taskId       envelope id
 * @param taskName     task name
 * @param queue        queue the delivery came from
 * @param attempt      zero-based attempt
 * @param outcome      {@code SUCCESS}, {@code RETRYABLE} or {@code FATAL}
 * @param reason       failure reason, {@code null} on success
 * @param durationMs   time spent executing, 0 when the handler never ran
 * @param timestampEnd when the attempt finished
 */
public record DeliveryRecord(
        UUID taskId,
        String taskName,
        String queue,
        int attempt,
        String outcome,
        String reason,
        long durationMs,
        Instant timestampEnd) {

    public DeliveryRecord {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(taskName, "taskName");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(timestampEnd, "timestampEnd");
    }

    static DeliveryRecord of(TaskEnvelope task, String queue, String outcome, String reason,
            long durationMs) {
        return new DeliveryRecord(task.id(), task.taskName(), queue, task.attempt(), outcome, reason,
                durationMs, Instant.now());
    }

    /**
     * Renders the record as a single {@code key=value} line. Values containing spaces or quotes
     * are quoted.
     */
    public String toLogLine() {
        StringBuilder line = new StringBuilder(160);
        append(line, "taskId", taskId.toString());
        append(line, "taskName", taskName);
        append(line, "queue", queue);
        append(line, "attempt", Integer.toString(attempt));
        append(line, "outcome", outcome);
        if (reason != null) {
            append(line, "reason", reason);
        }
        append(line, "durationMs", Long.toString(durationMs));
        append(line, "timestampEnd", timestampEnd.toString());
        return line.toString();
    }

    private static void append(StringBuilder line, String key, String value) {
        if (line.length() > 0) {
            line.append(' ');
        }
        line.append(key).append('=');
        if (value == null) {
            line.append('-');
        } else if (value.isEmpty() || value.indexOf(' ') >= 0 || value.indexOf('"') >= 0
                || value.indexOf('=') >= 0) {
            line.append('"').append(value.replace("\\", "\\\\").replace("\"", "\\\"")
                    .replace("\n", "\\n")).append('"');
        } else {
            line.append(value);
        }
    }
}
