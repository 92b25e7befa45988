package eventlog.query;

import eventlog.EventEnvelope;
import eventlog.EventLogSettings;
import eventlog.InvalidConfigurationException;
import eventlog.ResumePoint;
import eventlog.SliceRange;
import eventlog.StoreUnavailableException;
import eventlog.spi.ConnectionProvider;
import eventlog.spi.EventQueryStore;
import eventlog.spi.QueryMetrics;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lag-compensating cursor over one slice range of the journal.
 *
 * <p>Each {@link #poll(ResumePoint)} reads rows with {@code db_timestamp >= lastSeenTimestamp},
 * bounded above by {@code now - lagTolerance} so rows of transactions still committing cannot
 * land behind the cursor. The lower bound is inclusive; rows at the boundary instant that the
 * resume point has already seen are dropped. Events come out in {@code (dbTimestamp, seqNr)}
 * order, and one cursor never returns the same {@code (persistenceId, seqNr)} twice as long as
 * callers chain the returned resume points.
 *
 * <p>The cursor holds no mutable state: a poll is a synchronous step from one resume point to the
 * next and leaves the input untouched when it fails. Instances are thread-safe, but a slice range
 * is meant to be driven by a single worker.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see eventlog.poller.SliceRangePoller
 */
public final class SliceRangeCursor {
    private static final Logger logger = Logger.getLogger(SliceRangeCursor.class.getName());

    private final ConnectionProvider connectionProvider;
    private final EventQueryStore store;
    private final TimestampOracle oracle;
    private final SliceRange sliceRange;
    private final int pageSize;
    private final Duration lagTolerance;
    private final QueryMetrics metrics;

    private SliceRangeCursor(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(builder.store, "store");
        this.sliceRange = Objects.requireNonNull(builder.sliceRange, "sliceRange");

        if (builder.pageSize <= 0) {
            throw new InvalidConfigurationException("pageSize must be > 0, got: " + builder.pageSize);
        }
        if (builder.lagTolerance == null || builder.lagTolerance.isNegative()) {
            throw new InvalidConfigurationException("lagTolerance must be >= 0");
        }
        if (builder.numberOfSlices != null && sliceRange.maxSlice() >= builder.numberOfSlices) {
            throw new InvalidConfigurationException("maxSlice " + sliceRange.maxSlice()
                    + " is out of bounds for " + builder.numberOfSlices + " slices");
        }

        this.pageSize = builder.pageSize;
        this.lagTolerance = builder.lagTolerance;
        this.oracle = new TimestampOracle(connectionProvider, store);
        this.metrics = builder.metrics != null ? builder.metrics : QueryMetrics.NOOP;
    }

    public static Builder builder() {
        return new Builder();
    }

    public SliceRange sliceRange() {
        return sliceRange;
    }

    public int pageSize() {
        return pageSize;
    }

    public Duration lagTolerance() {
        return lagTolerance;
    }

    /**
     * Reads the next page after {@code from}, acquiring and releasing one connection.
     *
     * @param from resume point of the previous poll
     * @return new events and the next resume point
     * @throws StoreUnavailableException      if the database cannot be reached
     * @throws eventlog.RowDecodeException    if a row breaks the schema contract
     */
    public CursorPage poll(ResumePoint from) {
        return poll(from, null);
    }

    /**
     * Reads the next page after {@code from}, never past {@code until}.
     *
     * @param from  resume point of the previous poll
     * @param until exclusive upper bound on {@code db_timestamp}, or {@code null}
     * @return new events and the next resume point
     */
    public CursorPage poll(ResumePoint from, Instant until) {
        Objects.requireNonNull(from, "from");
        try (Connection conn = connectionProvider.getConnection()) {
            return poll(conn, from, until);
        } catch (SQLException e) {
            metrics.incrementStoreFailure();
            throw new StoreUnavailableException("Failed to poll slices " + sliceRange, e);
        }
    }

    /**
     * Reads the next page using a connection owned by the caller.
     *
     * @param conn  open connection; left open
     * @param from  resume point of the previous poll
     * @param until exclusive upper bound on {@code db_timestamp}, or {@code null}
     * @return new events and the next resume point
     */
    public CursorPage poll(Connection conn, ResumePoint from, Instant until) {
        Objects.requireNonNull(from, "from");
        long startNanos = System.nanoTime();
        try {
            Instant now = null;
            Instant upperBound = until;
            if (!lagTolerance.isZero()) {
                now = oracle.now(conn);
                Instant lagBound = now.minus(lagTolerance);
                if (upperBound == null || lagBound.isBefore(upperBound)) {
                    upperBound = lagBound;
                }
            }

            List<EventEnvelope> batch;
            if (upperBound != null && !upperBound.isAfter(from.lastSeenTimestamp())) {
                batch = List.of();
            } else {
                batch = fetch(conn, from, upperBound);
            }

            ResumePoint next = from.advance(batch);
            recordPoll(batch, now, startNanos);
            return new CursorPage(batch, next);
        } catch (StoreUnavailableException e) {
            metrics.incrementStoreFailure();
            throw e;
        }
    }

    private List<EventEnvelope> fetch(Connection conn, ResumePoint from, Instant upperBound) {
        // Seen rows at the boundary instant still occupy LIMIT slots; over-fetch by that many.
        int limit = (int) Math.min(Integer.MAX_VALUE, (long) pageSize + from.seenInSameInstant().size());
        List<EventEnvelope> rows = store.rowsBySlices(conn, sliceRange.entityType(),
                sliceRange.minSlice(), sliceRange.maxSlice(),
                from.lastSeenTimestamp(), upperBound, limit);

        List<EventEnvelope> batch = new ArrayList<>(Math.min(rows.size(), pageSize));
        for (EventEnvelope row : rows) {
            if (batch.size() == pageSize) {
                break;
            }
            if (row.dbTimestamp().equals(from.lastSeenTimestamp()) && from.isSeen(row.key())) {
                continue;
            }
            batch.add(row);
        }
        return batch;
    }

    private void recordPoll(List<EventEnvelope> batch, Instant now, long startNanos) {
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000L;
        metrics.recordPoll(sliceRange, batch.size(), elapsedMs);
        if (!batch.isEmpty()) {
            if (now != null) {
                Instant newest = batch.get(batch.size() - 1).dbTimestamp();
                metrics.recordPollLagMs(Math.max(0L, Duration.between(newest, now).toMillis()));
            }
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Read [" + batch.size() + "] events from slices ["
                        + sliceRange.minSlice() + " - " + sliceRange.maxSlice() + "]");
            }
        }
    }

    /**
     * Builder for {@link SliceRangeCursor}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private EventQueryStore store;
        private SliceRange sliceRange;
        private int pageSize = EventLogSettings.DEFAULT_PAGE_SIZE;
        private Duration lagTolerance = EventLogSettings.DEFAULT_LAG_TOLERANCE;
        private Integer numberOfSlices;
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
         * <b>Required.</b> Fixed for the lifetime of the cursor.
         */
        public Builder sliceRange(SliceRange sliceRange) {
            this.sliceRange = sliceRange;
            return this;
        }

        /**
         * Optional. Defaults to {@code 1000}. Must be &gt; 0.
         */
        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        /**
         * Optional. Defaults to 500 ms. Must be &ge; 0; zero removes the upper bound.
         */
        public Builder lagTolerance(Duration lagTolerance) {
            this.lagTolerance = lagTolerance;
            return this;
        }

        /**
         * Optional. When set, the slice range must lie within {@code [0, numberOfSlices)}.
         */
        public Builder numberOfSlices(int numberOfSlices) {
            this.numberOfSlices = numberOfSlices;
            return this;
        }

        /**
         * Applies page size, lag tolerance and slice count from shared settings.
         */
        public Builder settings(EventLogSettings settings) {
            return pageSize(settings.pageSize())
                    .lagTolerance(settings.lagTolerance())
                    .numberOfSlices(settings.numberOfSlices());
        }

        /**
         * Optional. Defaults to {@link QueryMetrics#NOOP}.
         */
        public Builder metrics(QueryMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Builds the cursor. Makes no store call.
         *
         * @throws NullPointerException          if {@code connectionProvider}, {@code store}
         *                                       or {@code sliceRange} is null
         * @throws InvalidConfigurationException if {@code pageSize <= 0}, the lag is negative, or the
         *                                       range exceeds {@code numberOfSlices}
         */
        public SliceRangeCursor build() {
            return new SliceRangeCursor(this);
        }
    }
}
