package courier.spring.boot;

import courier.retry.BackoffStrategy;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CourierPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            CourierProperties props = ctx.getBean(CourierProperties.class);
            assertEquals(CourierProperties.BrokerType.MEMORY, props.getBroker().getType());
            assertEquals("courier_message", props.getBroker().getTableName());
            assertEquals(Duration.ofMinutes(5), props.getBroker().getLeaseTimeout());
            assertEquals(Duration.ofMillis(200), props.getBroker().getPollInterval());
            assertTrue(props.getWorker().isEnabled());
            assertEquals(4, props.getWorker().getConcurrency());
            assertEquals(List.of("emails"), props.getWorker().getQueues());
            assertEquals(Duration.ofSeconds(10), props.getWorker().getGracePeriod());
            assertEquals(Duration.ofMinutes(10), props.getRetry().getMaxDelay());
            assertEquals(3, props.getDispatch().getEnqueueAttempts());
            assertEquals(Duration.ofMillis(200), props.getDispatch().getEnqueueBackoff());
            assertTrue(props.getNotifications().isEnabled());
            assertEquals(3, props.getNotifications().getMaxRetries());
            assertEquals(Duration.ofSeconds(60), props.getNotifications().getBaseDelay());
            assertEquals(BackoffStrategy.EXPONENTIAL, props.getNotifications().getBackoff());
            assertEquals("emails", props.getNotifications().getQueue());
            assertNull(props.getNotifications().getFromAddress());
            assertNull(props.getChapa().getSecretKey());
            assertEquals("https://api.chapa.co/v1", props.getChapa().getBaseUrl());
            assertEquals(Duration.ofSeconds(30), props.getChapa().getTimeout());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("courier", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "courier.broker.type=JDBC",
                "courier.broker.table-name=task_queue",
                "courier.broker.lease-timeout=PT1M",
                "courier.broker.poll-interval=50ms",
                "courier.worker.enabled=false",
                "courier.worker.concurrency=8",
                "courier.worker.queues=emails,reports",
                "courier.worker.grace-period=PT30S",
                "courier.retry.max-delay=PT1H",
                "courier.dispatch.enqueue-attempts=5",
                "courier.dispatch.enqueue-backoff=1s",
                "courier.notifications.max-retries=0",
                "courier.notifications.from-address=no-reply@travel.example",
                "courier.notifications.time-zone=Africa/Addis_Ababa",
                "courier.chapa.secret-key=CHASECK_TEST-abc",
                "courier.chapa.webhook-secret=whsec",
                "courier.metrics.enabled=false",
                "courier.metrics.name-prefix=bookings"
        ).run(ctx -> {
            CourierProperties props = ctx.getBean(CourierProperties.class);
            assertEquals(CourierProperties.BrokerType.JDBC, props.getBroker().getType());
            assertEquals("task_queue", props.getBroker().getTableName());
            assertEquals(Duration.ofMinutes(1), props.getBroker().getLeaseTimeout());
            assertEquals(Duration.ofMillis(50), props.getBroker().getPollInterval());
            assertFalse(props.getWorker().isEnabled());
            assertEquals(8, props.getWorker().getConcurrency());
            assertEquals(List.of("emails", "reports"), props.getWorker().getQueues());
            assertEquals(Duration.ofSeconds(30), props.getWorker().getGracePeriod());
            assertEquals(Duration.ofHours(1), props.getRetry().getMaxDelay());
            assertEquals(5, props.getDispatch().getEnqueueAttempts());
            assertEquals(Duration.ofSeconds(1), props.getDispatch().getEnqueueBackoff());
            assertEquals(0, props.getNotifications().getMaxRetries());
            assertEquals("no-reply@travel.example", props.getNotifications().getFromAddress());
            assertEquals("Africa/Addis_Ababa", props.getNotifications().getTimeZone());
            assertEquals("CHASECK_TEST-abc", props.getChapa().getSecretKey());
            assertEquals("whsec", props.getChapa().getWebhookSecret());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("bookings", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(CourierProperties.class)
    static class PropsConfig {
    }
}
