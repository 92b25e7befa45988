package eventlog.spring.boot;

import eventlog.EventLogSettings;
import eventlog.jdbc.DataSourceConnectionProvider;
import eventlog.jdbc.offset.JdbcOffsetStore;
import eventlog.jdbc.store.AbstractJdbcEventQueryStore;
import eventlog.jdbc.store.JdbcEventQueryStores;
import eventlog.poller.ExponentialBackoffRetryPolicy;
import eventlog.poller.RetryPolicy;
import eventlog.query.EventLogQueries;
import eventlog.spi.ConnectionProvider;
import eventlog.spi.OffsetStore;
import eventlog.spi.QueryMetrics;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for journal queries.
 *
 * <p>Detects the query store from the {@link DataSource} URL and wires an
 * {@link EventLogQueries} facade from {@link EventLogProperties}. Pollers are not started here;
 * applications build one {@link eventlog.poller.SliceRangePoller} per slice range from
 * {@link EventLogQueries#cursor} and the {@link OffsetStore} and {@link RetryPolicy} beans.
 *
 * @see EventLogProperties
 * @see EventLogMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(EventLogQueries.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(EventLogProperties.class)
public class EventLogAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public AbstractJdbcEventQueryStore eventQueryStore(DataSource dataSource, EventLogProperties props) {
        AbstractJdbcEventQueryStore detected = JdbcEventQueryStores.detect(dataSource);
        if (detected.tableName().equals(props.getTableName())) {
            return detected;
        }
        return detected.withTableName(props.getTableName());
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public EventLogSettings eventLogSettings(EventLogProperties props) {
        return EventLogSettings.builder()
                .numberOfSlices(props.getNumberOfSlices())
                .pageSize(props.getQuery().getPageSize())
                .lagTolerance(props.getQuery().getLagTolerance())
                .pollInterval(props.getPoller().getPollInterval())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy eventLogRetryPolicy(EventLogProperties props) {
        return new ExponentialBackoffRetryPolicy(
                props.getPoller().getRetry().getBaseDelayMs(), props.getPoller().getRetry().getMaxDelayMs());
    }

    @Bean
    @ConditionalOnMissingBean(OffsetStore.class)
    public JdbcOffsetStore offsetStore(ConnectionProvider connectionProvider, EventLogProperties props) {
        return new JdbcOffsetStore(connectionProvider, props.getOffsetTableName());
    }

    @Bean
    @ConditionalOnMissingBean
    public EventLogQueries eventLogQueries(ConnectionProvider connectionProvider,
            AbstractJdbcEventQueryStore eventQueryStore,
            EventLogSettings settings,
            ObjectProvider<QueryMetrics> metricsProvider) {
        EventLogQueries.Builder builder = EventLogQueries.builder()
                .connectionProvider(connectionProvider)
                .store(eventQueryStore)
                .settings(settings);
        QueryMetrics metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        return builder.build();
    }
}
