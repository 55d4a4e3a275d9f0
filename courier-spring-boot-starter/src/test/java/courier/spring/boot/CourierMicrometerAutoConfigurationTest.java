package courier.spring.boot;

import courier.Courier;
import courier.micrometer.MicrometerMetricsExporter;
import courier.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CourierMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(CourierMicrometerAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerExporterByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerMetricsExporter"));
            assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("courier.metrics.name-prefix=bookings.courier").run(ctx -> {
            MeterRegistry registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("bookings.courier.tasks.enqueued").counter());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("courier.metrics.enabled=false").run(ctx -> {
            assertFalse(ctx.containsBean("micrometerMetricsExporter"));
        });
    }

    @Test
    void backsOffWithoutMeterRegistry() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(CourierMicrometerAutoConfiguration.class))
                .run(ctx -> assertFalse(ctx.containsBean("micrometerMetricsExporter")));
    }

    @Test
    void backsOffWhenCustomMetricsExporterPresent() {
        runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
            assertFalse(ctx.getBean(MetricsExporter.class) instanceof MicrometerMetricsExporter);
        });
    }

    @Test
    void metersAreRemovedWhenContextCloses() {
        runner.run(ctx -> {
            MeterRegistry registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("courier.tasks.dead").counter());
            ctx.close();
            assertNull(registry.find("courier.tasks.dead").counter());
            assertNull(registry.find("courier.worker.in.flight").gauge());
        });
    }

    @Test
    void courierReportsDispatches() {
        runner.withConfiguration(AutoConfigurations.of(CourierAutoConfiguration.class))
                .withPropertyValues("courier.worker.enabled=false")
                .withUserConfiguration(TaskConfig.class)
                .run(ctx -> {
                    ctx.getBean(Courier.class).dispatcher().dispatch("noop", Map.of());
                    MeterRegistry registry = ctx.getBean(MeterRegistry.class);
                    assertEquals(1.0, registry.get("courier.tasks.enqueued").counter().count());
                });
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomExporterConfig {
        @Bean
        MetricsExporter customExporter() {
            return MetricsExporter.NOOP;
        }
    }

    @Configuration
    static class TaskConfig {
        @Bean
        TaskRegistryCustomizer noopTask() {
            return registry -> registry.register("noop", task -> courier.TaskOutcome.success());
        }
    }
}
