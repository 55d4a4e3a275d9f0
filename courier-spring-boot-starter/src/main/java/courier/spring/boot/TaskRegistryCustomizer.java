package courier.spring.boot;

import courier.registry.DefaultTaskRegistry;

/**
 * Callback that contributes registrations to the auto-configured task registry before it is
 * built.
 */
@FunctionalInterface
public interface TaskRegistryCustomizer {

    void customize(DefaultTaskRegistry.Builder registry);
}
