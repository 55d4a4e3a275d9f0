package courier.jdbc.broker;

import courier.Courier;
import courier.TaskOutcome;
import courier.jdbc.DataSourceConnectionProvider;
import courier.registry.DefaultTaskRegistry;
import courier.retry.RetryPolicy;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Worker pool and dispatcher running over the durable broker.
 */
class JdbcBrokerCourierTest {
    private static SimpleDataSource dataSource;

    @BeforeAll
    static void initSchema() throws Exception {
        dataSource = SimpleDataSource.h2();
        dataSource.applySchema("/schema/h2.sql");
    }

    private static JdbcBroker broker() {
        return JdbcBroker.builder()
                .connectionProvider(new DataSourceConnectionProvider(dataSource))
                .pollInterval(Duration.ofMillis(10))
                .build();
    }

    @Test
    void retryableFailureIsRedeliveredThroughTheTable() throws Exception {
        JdbcBroker broker = broker();
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch succeeded = new CountDownLatch(1);
        DefaultTaskRegistry registry = DefaultTaskRegistry.builder()
                .register("send_payment_success_email", task -> {
                    if (calls.incrementAndGet() == 1) {
                        return TaskOutcome.retryable("smtp timeout");
                    }
                    succeeded.countDown();
                    return TaskOutcome.success();
                }, RetryPolicy.fixed(3, Duration.ofMillis(100)), "emails")
                .build();

        try (Courier courier = Courier.builder()
                .broker(broker)
                .registry(registry)
                .concurrency(2)
                .pollTimeout(Duration.ofMillis(50))
                .build()) {
            courier.dispatcher().dispatch("send_payment_success_email", Map.of("bookingId", "b7"));
            assertTrue(succeeded.await(10, TimeUnit.SECONDS));
        }

        assertEquals(2, calls.get());
        assertEquals(0, broker.storedCount("emails"));
    }

    @Test
    void storeIsDetectedFromConnection() {
        assertEquals("h2", broker().store().name());
    }
}
