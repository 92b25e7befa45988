package eventlog;

import java.time.Duration;

/**
 * Query-side settings shared by the cursor, the replay, the enumerator and the poller.
 *
 * <p>Create instances via {@link #builder()}. Invalid values fail at {@link Builder#build()}
 * with {@link InvalidConfigurationException}.
 */
public final class EventLogSettings {
    public static final int DEFAULT_NUMBER_OF_SLICES = 1024;
    public static final int DEFAULT_PAGE_SIZE = 1000;
    public static final Duration DEFAULT_LAG_TOLERANCE = Duration.ofMillis(500);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(3);

    private final int numberOfSlices;
    private final int pageSize;
    private final Duration lagTolerance;
    private final Duration pollInterval;

    private EventLogSettings(Builder builder) {
        if (builder.numberOfSlices <= 0) {
            throw new InvalidConfigurationException("numberOfSlices must be > 0, got: " + builder.numberOfSlices);
        }
        if (builder.pageSize <= 0) {
            throw new InvalidConfigurationException("pageSize must be > 0, got: " + builder.pageSize);
        }
        if (builder.lagTolerance == null || builder.lagTolerance.isNegative()) {
            throw new InvalidConfigurationException("lagTolerance must be >= 0");
        }
        if (builder.pollInterval == null || builder.pollInterval.isNegative() || builder.pollInterval.isZero()) {
            throw new InvalidConfigurationException("pollInterval must be > 0");
        }
        this.numberOfSlices = builder.numberOfSlices;
        this.pageSize = builder.pageSize;
        this.lagTolerance = builder.lagTolerance;
        this.pollInterval = builder.pollInterval;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Settings with every default.
     */
    public static EventLogSettings defaults() {
        return builder().build();
    }

    public int numberOfSlices() {
        return numberOfSlices;
    }

    public int pageSize() {
        return pageSize;
    }

    public Duration lagTolerance() {
        return lagTolerance;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    /**
     * Builder for {@link EventLogSettings}.
     */
    public static final class Builder {
        private int numberOfSlices = DEFAULT_NUMBER_OF_SLICES;
        private int pageSize = DEFAULT_PAGE_SIZE;
        private Duration lagTolerance = DEFAULT_LAG_TOLERANCE;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;

        private Builder() {
        }

        /**
         * Sets the fixed partition count used by writers.
         *
         * <p>Optional. Defaults to {@code 1024}. Must be &gt; 0 and identical to the writer's value.
         *
         * @param numberOfSlices total slice count
         * @return this builder
         */
        public Builder numberOfSlices(int numberOfSlices) {
            this.numberOfSlices = numberOfSlices;
            return this;
        }

        /**
         * Sets the maximum number of rows returned per query round trip.
         *
         * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
         *
         * @param pageSize rows per page
         * @return this builder
         */
        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        /**
         * Sets how far behind the database clock the slice cursor stays. Rows newer than
         * {@code now - lagTolerance} are left for a later poll so that transactions still in flight
         * cannot commit an older timestamp behind the cursor. Should be at least the longest
         * write transaction.
         *
         * <p>Optional. Defaults to 500 ms. {@link Duration#ZERO} disables the bound.
         *
         * @param lagTolerance the lag, must be &ge; 0
         * @return this builder
         */
        public Builder lagTolerance(Duration lagTolerance) {
            this.lagTolerance = lagTolerance;
            return this;
        }

        /**
         * Sets the poller's sleep between polls that returned less than a full page.
         *
         * <p>Optional. Defaults to 3 s. Must be &gt; 0.
         *
         * @param pollInterval the interval
         * @return this builder
         */
        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public EventLogSettings build() {
            return new EventLogSettings(this);
        }
    }
}
