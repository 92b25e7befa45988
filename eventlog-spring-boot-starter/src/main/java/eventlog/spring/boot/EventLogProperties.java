package eventlog.spring.boot;

import eventlog.EventLogSettings;
import eventlog.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for journal queries and slice-range pollers.
 *
 * @see EventLogAutoConfiguration
 */
@ConfigurationProperties(prefix = "eventlog")
public class EventLogProperties {

    /**
     * Number of slices the writer hashes persistence ids into. Must match the writer.
     */
    private int numberOfSlices = EventLogSettings.DEFAULT_NUMBER_OF_SLICES;

    /**
     * Journal table, optionally schema-qualified.
     */
    private String tableName = TableNames.DEFAULT_JOURNAL_TABLE;

    /**
     * Offset table; seen keys go to {@code <offset-table-name>_seen}.
     */
    private String offsetTableName = TableNames.DEFAULT_OFFSET_TABLE;

    private final Query query = new Query();
    private final Poller poller = new Poller();
    private final Metrics metrics = new Metrics();

    public int getNumberOfSlices() {
        return numberOfSlices;
    }

    public void setNumberOfSlices(int numberOfSlices) {
        this.numberOfSlices = numberOfSlices;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public String getOffsetTableName() {
        return offsetTableName;
    }

    public void setOffsetTableName(String offsetTableName) {
        this.offsetTableName = offsetTableName;
    }

    public Query getQuery() {
        return query;
    }

    public Poller getPoller() {
        return poller;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Query {
        private int pageSize = EventLogSettings.DEFAULT_PAGE_SIZE;
        private Duration lagTolerance = EventLogSettings.DEFAULT_LAG_TOLERANCE;

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }

        public Duration getLagTolerance() {
            return lagTolerance;
        }

        public void setLagTolerance(Duration lagTolerance) {
            this.lagTolerance = lagTolerance;
        }
    }

    public static class Poller {
        private Duration pollInterval = EventLogSettings.DEFAULT_POLL_INTERVAL;
        private final Retry retry = new Retry();

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Retry getRetry() {
            return retry;
        }
    }

    public static class Retry {
        private long baseDelayMs = 200;
        private long maxDelayMs = 30_000;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "eventlog";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
