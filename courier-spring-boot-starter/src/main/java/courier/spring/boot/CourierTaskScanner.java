package courier.spring.boot;

import courier.TaskHandler;
import courier.registry.DefaultTaskRegistry;
import courier.retry.RetryPolicy;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.core.annotation.AnnotationUtils;

import java.time.Duration;
import java.util.Map;

/**
 * Finds beans annotated with {@link CourierTask} and registers them as task handlers.
 *
 * @see CourierTask
 */
public class CourierTaskScanner {

    private final ListableBeanFactory beanFactory;

    public CourierTaskScanner(ListableBeanFactory beanFactory) {
        this.beanFactory = beanFactory;
    }

    /**
     * Registers every annotated bean.
     *
     * @throws BeanCreationException if an annotated bean is not a {@link TaskHandler} or its
     *                               annotation is invalid
     */
    public void registerAll(DefaultTaskRegistry.Builder registry) {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(CourierTask.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof TaskHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @CourierTask must implement TaskHandler, but "
                                + bean.getClass().getName() + " does not");
            }
            // proxies hide the annotation on the target class
            CourierTask annotation = AnnotationUtils.findAnnotation(bean.getClass(), CourierTask.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @CourierTask annotation on " + bean.getClass().getName());
            }
            if (annotation.value().isBlank()) {
                throw new BeanCreationException(beanName, "@CourierTask must name the task");
            }

            RetryPolicy policy;
            try {
                policy = new RetryPolicy(annotation.maxRetries(),
                        Duration.ofMillis(annotation.baseDelayMs()), annotation.backoff());
            } catch (IllegalArgumentException e) {
                throw new BeanCreationException(beanName, "Invalid @CourierTask retry settings", e);
            }
            if (annotation.queue().isEmpty()) {
                registry.register(annotation.value(), handler, policy);
            } else {
                registry.register(annotation.value(), handler, policy, annotation.queue());
            }
        }
    }
}
