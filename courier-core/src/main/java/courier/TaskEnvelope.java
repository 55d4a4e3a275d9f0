package courier;

import com.github.f4b6a3.ulid.UlidCreator;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable unit of deferred work placed on the broker.
 *
 * <p>Each envelope is assigned a time-ordered UUID (a monotonic ULID) by default. The payload
 * is an ordered mapping of named string arguments; its encoded size is limited to
 * {@value #MAX_PAYLOAD_BYTES} bytes. The only field that changes over the envelope's life is
 * {@link #attempt()}, and it changes by copy: {@link #nextAttempt()} returns a new envelope
 * with the same identity and {@code attempt + 1}.
 *
 * <p>The attempt count travels with the envelope so that a crashed worker's retry history
 * is not lost.
 *
 * @see TaskDispatcher
 * @see courier.codec.EnvelopeCodec
 */
public final class TaskEnvelope {
    public static final int MAX_PAYLOAD_BYTES = 4 * 1024;
    public static final int CURRENT_SCHEMA_VERSION = 1;

    private final UUID id;
    private final String taskName;
    private final String queue;
    private final Map<String, String> payload;
    private final int attempt;
    private final int maxRetries;
    private final Instant createdAt;
    private final int schemaVersion;

    private TaskEnvelope(Builder builder) {
        this.id = builder.id == null ? newTaskId() : builder.id;
        this.taskName = Objects.requireNonNull(builder.taskName, "taskName");
        if (taskName.isEmpty()) {
            throw new IllegalArgumentException("taskName cannot be empty");
        }
        this.queue = Objects.requireNonNull(builder.queue, "queue");
        if (queue.isEmpty()) {
            throw new IllegalArgumentException("queue cannot be empty");
        }
        if (builder.attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, got: " + builder.attempt);
        }
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + builder.maxRetries);
        }
        if (builder.schemaVersion < 1) {
            throw new IllegalArgumentException("schemaVersion must be >= 1, got: " + builder.schemaVersion);
        }
        this.attempt = builder.attempt;
        this.maxRetries = builder.maxRetries;
        this.createdAt = builder.createdAt == null ? Instant.now() : builder.createdAt;
        this.schemaVersion = builder.schemaVersion;

        Map<String, String> copy = new LinkedHashMap<>();
        int size = 0;
        for (Map.Entry<String, String> entry : builder.payload.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("payload cannot contain null keys");
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("payload value for '" + entry.getKey() + "' is null");
            }
            size += entry.getKey().getBytes(StandardCharsets.UTF_8).length
                    + entry.getValue().getBytes(StandardCharsets.UTF_8).length;
            copy.put(entry.getKey(), entry.getValue());
        }
        if (size > MAX_PAYLOAD_BYTES) {
            throw new IllegalArgumentException("Payload exceeds maximum size of " + MAX_PAYLOAD_BYTES + " bytes");
        }
        this.payload = Collections.unmodifiableMap(copy);
    }

    /**
     * Creates a builder for the given task name.
     *
     * @param taskName the registered task name
     * @return a new builder
     */
    public static Builder builder(String taskName) {
        return new Builder(taskName);
    }

    /**
     * Creates a builder for a type-safe task name.
     *
     * @param taskName the task name
     * @return a new builder
     */
    public static Builder builder(TaskName taskName) {
        Objects.requireNonNull(taskName, "taskName");
        return new Builder(taskName.taskName());
    }

    /**
     * Returns a copy of this envelope for the next delivery cycle: same id, task, queue,
     * payload and creation time, with {@code attempt + 1}.
     *
     * @return the redelivery copy
     */
    public TaskEnvelope nextAttempt() {
        return toBuilder().attempt(attempt + 1).build();
    }

    /**
     * Returns a builder pre-populated with every field of this envelope.
     *
     * @return a builder copy
     */
    public Builder toBuilder() {
        return new Builder(taskName)
                .id(id)
                .queue(queue)
                .payload(payload)
                .attempt(attempt)
                .maxRetries(maxRetries)
                .createdAt(createdAt)
                .schemaVersion(schemaVersion);
    }

    public UUID id() {
        return id;
    }

    public String taskName() {
        return taskName;
    }

    public String queue() {
        return queue;
    }

    /**
     * Returns the named arguments in insertion order.
     *
     * @return an unmodifiable ordered map
     */
    public Map<String, String> payload() {
        return payload;
    }

    /**
     * Returns a single named argument.
     *
     * @param name argument name
     * @return the value, or {@code null} if absent
     */
    public String argument(String name) {
        return payload.get(name);
    }

    /**
     * Returns the zero-based delivery cycle this envelope belongs to.
     */
    public int attempt() {
        return attempt;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /**
     * Returns the payload schema version. Handlers compare it against the version they
     * understand; the version only increases when argument names or meanings change.
     */
    public int schemaVersion() {
        return schemaVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaskEnvelope)) return false;
        TaskEnvelope that = (TaskEnvelope) o;
        return attempt == that.attempt && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return 31 * id.hashCode() + attempt;
    }

    @Override
    public String toString() {
        return "TaskEnvelope{id=" + id
                + ", taskName=" + taskName
                + ", queue=" + queue
                + ", attempt=" + attempt
                + ", maxRetries=" + maxRetries + '}';
    }

    /**
     * Builder for {@link TaskEnvelope}.
     */
    public static final class Builder {
        private final String taskName;
        private UUID id;
        private String queue;
        private final Map<String, String> payload = new LinkedHashMap<>();
        private int attempt;
        private int maxRetries;
        private Instant createdAt;
        private int schemaVersion = CURRENT_SCHEMA_VERSION;

        private Builder(String taskName) {
            this.taskName = taskName;
        }

        /**
         * Sets the envelope identity.
         *
         * <p>Optional. Defaults to a monotonic ULID rendered as a UUID.
         *
         * @param id the envelope id
         * @return this builder
         */
        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        /**
         * Sets the queue (routing key) the envelope is published to.
         *
         * <p><b>Required.</b>
         *
         * @param queue logical queue name, e.g. {@code "emails"}
         * @return this builder
         */
        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        /**
         * Adds one named argument. Arguments keep insertion order.
         *
         * @param name  argument name
         * @param value argument value
         * @return this builder
         */
        public Builder argument(String name, String value) {
            this.payload.put(name, value);
            return this;
        }

        /**
         * Adds every entry of the given map, in its iteration order.
         *
         * @param arguments named arguments
         * @return this builder
         */
        public Builder payload(Map<String, String> arguments) {
            Objects.requireNonNull(arguments, "arguments");
            this.payload.putAll(arguments);
            return this;
        }

        /**
         * Sets the delivery cycle.
         *
         * <p>Optional. Defaults to {@code 0}.
         *
         * @param attempt zero-based attempt
         * @return this builder
         */
        public Builder attempt(int attempt) {
            this.attempt = attempt;
            return this;
        }

        /**
         * Sets the retry budget copied from the task's registered policy.
         *
         * <p>Optional. Defaults to {@code 0} (exactly one attempt).
         *
         * @param maxRetries retry budget
         * @return this builder
         */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Sets the creation time.
         *
         * <p>Optional. Defaults to {@link Instant#now()}.
         *
         * @param createdAt creation timestamp
         * @return this builder
         */
        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        /**
         * Sets the payload schema version.
         *
         * <p>Optional. Defaults to {@value TaskEnvelope#CURRENT_SCHEMA_VERSION}.
         *
         * @param schemaVersion schema version, at least 1
         * @return this builder
         */
        public Builder schemaVersion(int schemaVersion) {
            this.schemaVersion = schemaVersion;
            return this;
        }

        /**
         * Builds an immutable {@link TaskEnvelope}.
         *
         * @return a new envelope
         * @throws IllegalArgumentException if a name is empty, a count is negative, the payload
         *                                  contains nulls or exceeds {@value TaskEnvelope#MAX_PAYLOAD_BYTES} bytes
         */
        public TaskEnvelope build() {
            return new TaskEnvelope(this);
        }
    }

    private static UUID newTaskId() {
        return UlidCreator.getMonotonicUlid().toUuid();
    }
}
