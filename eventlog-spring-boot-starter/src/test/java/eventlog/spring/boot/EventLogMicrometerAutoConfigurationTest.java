package eventlog.spring.boot;

import eventlog.SliceRange;
import eventlog.micrometer.MicrometerQueryMetrics;
import eventlog.spi.QueryMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

class EventLogMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(EventLogMicrometerAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerMetricsByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerQueryMetrics"));
            assertInstanceOf(MicrometerQueryMetrics.class, ctx.getBean(QueryMetrics.class));
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("eventlog.metrics.name-prefix=carts.eventlog").run(ctx -> {
            ctx.getBean(QueryMetrics.class).incrementStoreFailure();
            MeterRegistry registry = ctx.getBean(MeterRegistry.class);
            assertEquals(1.0, registry.get("carts.eventlog.store.failures").counter().count());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("eventlog.metrics.enabled=false").run(ctx ->
                assertFalse(ctx.containsBean("micrometerQueryMetrics")));
    }

    @Test
    void backsOffWhenCustomMetricsPresent() {
        runner.withUserConfiguration(CustomMetricsConfig.class).run(ctx ->
                assertFalse(ctx.getBean(QueryMetrics.class) instanceof MicrometerQueryMetrics));
    }

    @Test
    void queriesReportThroughMicrometer() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        DataSourceAutoConfiguration.class,
                        EventLogMicrometerAutoConfiguration.class,
                        EventLogAutoConfiguration.class))
                .withUserConfiguration(MeterRegistryConfig.class)
                .withPropertyValues(
                        "spring.datasource.url=jdbc:h2:mem:eventlog_metrics_test;DB_CLOSE_DELAY=-1",
                        "spring.datasource.driver-class-name=org.h2.Driver")
                .run(ctx -> {
                    ctx.getBean(QueryMetrics.class).recordPoll(new SliceRange("Cart", 0, 1023), 3, 2);
                    MeterRegistry registry = ctx.getBean(MeterRegistry.class);
                    assertEquals(1, registry.get("eventlog.poll").tags("slices", "0-1023").timer().count());
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
    static class CustomMetricsConfig {
        @Bean
        QueryMetrics customQueryMetrics() {
            return QueryMetrics.NOOP;
        }
    }
}
