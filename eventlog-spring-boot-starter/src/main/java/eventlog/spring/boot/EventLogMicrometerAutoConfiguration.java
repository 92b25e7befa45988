package eventlog.spring.boot;

import eventlog.micrometer.MicrometerQueryMetrics;
import eventlog.spi.QueryMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerQueryMetrics} when Micrometer is on the classpath and
 * {@code eventlog.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link EventLogAutoConfiguration} so the {@link QueryMetrics} bean is
 * available to {@link eventlog.query.EventLogQueries}.
 */
@AutoConfiguration(before = EventLogAutoConfiguration.class)
@ConditionalOnClass({MicrometerQueryMetrics.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "eventlog.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(EventLogProperties.class)
public class EventLogMicrometerAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(QueryMetrics.class)
    public MicrometerQueryMetrics micrometerQueryMetrics(MeterRegistry meterRegistry, EventLogProperties props) {
        return new MicrometerQueryMetrics(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
