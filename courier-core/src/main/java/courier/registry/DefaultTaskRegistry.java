package courier.registry;

import courier.TaskHandler;
import courier.TaskName;
import courier.retry.RetryPolicy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable {@link TaskRegistry} assembled with a {@link Builder}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * TaskRegistry registry = DefaultTaskRegistry.builder()
 *     .register(NotificationTasks.BOOKING_CONFIRMATION, bookingHandler,
 *         RetryPolicy.exponential(3, Duration.ofSeconds(60)), "emails")
 *     .register("reindex_property", reindexHandler)
 *     .build();
 * }</pre>
 *
 * <p>Registering the same name twice fails with {@link DuplicateTaskRegistrationException}
 * immediately; the last registration never silently wins.
 */
public final class DefaultTaskRegistry implements TaskRegistry {
    public static final String DEFAULT_QUEUE = "default";

    private final Map<String, TaskRegistration> registrations;

    private DefaultTaskRegistry(Map<String, TaskRegistration> registrations) {
        this.registrations = Collections.unmodifiableMap(new LinkedHashMap<>(registrations));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<TaskRegistration> resolve(String taskName) {
        if (taskName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(registrations.get(taskName));
    }

    @Override
    public Set<String> taskNames() {
        return registrations.keySet();
    }

    /** Builder for {@link DefaultTaskRegistry}. */
    public static final class Builder {
        private final Map<String, TaskRegistration> registrations = new LinkedHashMap<>();
        private RetryPolicy defaultPolicy = RetryPolicy.noRetry();
        private String defaultQueue = DEFAULT_QUEUE;

        private Builder() {
        }

        /**
         * Sets the policy used by registrations that do not name one.
         *
         * <p>Optional. Defaults to {@link RetryPolicy#noRetry()}.
         *
         * @param defaultPolicy the fallback policy
         * @return this builder
         */
        public Builder defaultPolicy(RetryPolicy defaultPolicy) {
            this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "defaultPolicy");
            return this;
        }

        /**
         * Sets the queue used by registrations that do not name one.
         *
         * <p>Optional. Defaults to {@value DefaultTaskRegistry#DEFAULT_QUEUE}.
         *
         * @param defaultQueue the fallback queue
         * @return this builder
         */
        public Builder defaultQueue(String defaultQueue) {
            this.defaultQueue = Objects.requireNonNull(defaultQueue, "defaultQueue");
            return this;
        }

        public Builder register(String name, TaskHandler handler) {
            return register(name, handler, defaultPolicy, defaultQueue);
        }

        public Builder register(String name, TaskHandler handler, RetryPolicy policy) {
            return register(name, handler, policy, defaultQueue);
        }

        public Builder register(TaskName name, TaskHandler handler, RetryPolicy policy, String queue) {
            Objects.requireNonNull(name, "name");
            return register(name.taskName(), handler, policy, queue);
        }

        /**
         * Registers a handler under a unique name.
         *
         * @param name    task name
         * @param handler handler invoked by workers
         * @param policy  retry policy
         * @param queue   default queue
         * @return this builder
         * @throws DuplicateTaskRegistrationException if the name is already registered
         */
        public Builder register(String name, TaskHandler handler, RetryPolicy policy, String queue) {
            return register(new TaskRegistration(name, handler, policy, queue));
        }

        public Builder register(TaskRegistration registration) {
            Objects.requireNonNull(registration, "registration");
            if (registrations.putIfAbsent(registration.name(), registration) != null) {
                throw new DuplicateTaskRegistrationException(registration.name());
            }
            return this;
        }

        public DefaultTaskRegistry build() {
            return new DefaultTaskRegistry(registrations);
        }
    }
}
