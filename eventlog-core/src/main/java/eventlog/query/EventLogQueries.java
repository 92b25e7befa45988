package eventlog.query;

import eventlog.EventEnvelope;
import eventlog.EventLogSettings;
import eventlog.PersistenceIds;
import eventlog.SliceRange;
import eventlog.StoreUnavailableException;
import eventlog.spi.ConnectionProvider;
import eventlog.spi.EventQueryStore;
import eventlog.spi.QueryMetrics;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point that wires the timestamp oracle, per-identity replay, identity enumeration and
 * slice cursors over one journal.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * EventLogQueries queries = EventLogQueries.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .store(JdbcEventQueryStores.detect(dataSource))
 *     .settings(EventLogSettings.builder().numberOfSlices(1024).build())
 *     .build();
 *
 * List<EventEnvelope> history = queries.replay("Cart|42", 1, Long.MAX_VALUE);
 *
 * for (SliceRange range : queries.sliceRanges("Cart", 4)) {
 *     SliceRangeCursor cursor = queries.cursor(range);
 *     // hand each cursor to its own SliceRangePoller
 * }
 * }</pre>
 *
 * @see SliceRangeCursor
 * @see PersistenceIdReplay
 * @see PersistenceIdEnumerator
 */
public final class EventLogQueries {
    private final ConnectionProvider connectionProvider;
    private final EventQueryStore store;
    private final EventLogSettings settings;
    private final QueryMetrics metrics;
    private final TimestampOracle oracle;
    private final PersistenceIdReplay replay;
    private final PersistenceIdEnumerator enumerator;

    private EventLogQueries(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(builder.store, "store");
        this.settings = builder.settings != null ? builder.settings : EventLogSettings.defaults();
        this.metrics = builder.metrics != null ? builder.metrics : QueryMetrics.NOOP;
        this.oracle = new TimestampOracle(connectionProvider, store);
        this.replay = new PersistenceIdReplay(connectionProvider, store,
                settings.numberOfSlices(), settings.pageSize(), metrics);
        this.enumerator = new PersistenceIdEnumerator(connectionProvider, store, metrics);
    }

    public static Builder builder() {
        return new Builder();
    }

    public EventLogSettings settings() {
        return settings;
    }

    public TimestampOracle timestampOracle() {
        return oracle;
    }

    public PersistenceIdReplay persistenceIdReplay() {
        return replay;
    }

    public PersistenceIdEnumerator persistenceIdEnumerator() {
        return enumerator;
    }

    /**
     * Returns the database's current time.
     */
    public Instant currentDbTimestamp() {
        return oracle.now();
    }

    /**
     * Creates a cursor over {@code range} with the configured page size and lag tolerance.
     */
    public SliceRangeCursor cursor(SliceRange range) {
        return SliceRangeCursor.builder()
                .connectionProvider(connectionProvider)
                .store(store)
                .sliceRange(range)
                .settings(settings)
                .metrics(metrics)
                .build();
    }

    /**
     * Splits all slices of {@code entityType} into {@code numberOfRanges} disjoint ranges.
     */
    public List<SliceRange> sliceRanges(String entityType, int numberOfRanges) {
        return SliceRange.ranges(entityType, settings.numberOfSlices(), numberOfRanges);
    }

    /**
     * Returns the slice of a persistence id under the configured slice count.
     */
    public int sliceOf(String persistenceId) {
        return PersistenceIds.sliceOf(persistenceId, settings.numberOfSlices());
    }

    /**
     * @see PersistenceIdReplay#replay(String, long, long)
     */
    public List<EventEnvelope> replay(String persistenceId, long fromSeqNr, long toSeqNr) {
        return replay.replay(persistenceId, fromSeqNr, toSeqNr);
    }

    /**
     * @see PersistenceIdReplay#replay(String, long, long, int)
     */
    public List<EventEnvelope> replay(String persistenceId, long fromSeqNr, long toSeqNr, int pageSize) {
        return replay.replay(persistenceId, fromSeqNr, toSeqNr, pageSize);
    }

    /**
     * Lists up to {@code limit} persistence ids after {@code afterId}, or from the start when it is empty.
     */
    public List<String> listIdentities(Optional<String> afterId, long limit) {
        return afterId.isPresent()
                ? enumerator.listIdentities(afterId.get(), limit)
                : enumerator.listIdentities(limit);
    }

    /**
     * Looks up the commit timestamp of one event.
     *
     * @param persistenceId the id
     * @param seqNr         the sequence number
     * @return the {@code db_timestamp}, or empty if the event does not exist or is deleted
     * @throws eventlog.InvalidConfigurationException if the id is malformed
     * @throws StoreUnavailableException             if the database cannot be reached
     */
    public Optional<Instant> timestampOfEvent(String persistenceId, long seqNr) {
        String entityType = PersistenceIds.entityTypeOf(persistenceId);
        int slice = sliceOf(persistenceId);
        try (Connection conn = connectionProvider.getConnection()) {
            return store.timestampOfEvent(conn, entityType, slice, persistenceId, seqNr);
        } catch (SQLException e) {
            metrics.incrementStoreFailure();
            throw new StoreUnavailableException("Failed to read timestamp of " + persistenceId + "/" + seqNr, e);
        }
    }

    /**
     * Builder for {@link EventLogQueries}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private EventQueryStore store;
        private EventLogSettings settings;
        private QueryMetrics metrics;

        private Builder() {
        }

        /**
         * <b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder store(EventQueryStore store) {
            this.store = store;
            return this;
        }

        /**
         * Optional. Defaults to {@link EventLogSettings#defaults()}.
         */
        public Builder settings(EventLogSettings settings) {
            this.settings = settings;
            return this;
        }

        /**
         * Optional. Defaults to {@link QueryMetrics#NOOP}.
         */
        public Builder metrics(QueryMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public EventLogQueries build() {
            return new EventLogQueries(this);
        }
    }
}
