package eventlog.query;

import eventlog.EventEnvelope;
import eventlog.InvalidConfigurationException;
import eventlog.PersistenceIds;
import eventlog.StoreUnavailableException;
import eventlog.spi.ConnectionProvider;
import eventlog.spi.EventQueryStore;
import eventlog.spi.QueryMetrics;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads the events of a single persistence id in strict sequence order.
 *
 * <p>The slice and entity type are derived from the id with the writer's conventions
 * ({@link PersistenceIds}); malformed ids are rejected before any store call. No lag bound
 * is applied since a sequence range is finite. Failures are surfaced, never retried.
 */
public final class PersistenceIdReplay {
    private static final Logger logger = Logger.getLogger(PersistenceIdReplay.class.getName());

    private final ConnectionProvider connectionProvider;
    private final EventQueryStore store;
    private final int numberOfSlices;
    private final int defaultPageSize;
    private final QueryMetrics metrics;

    public PersistenceIdReplay(ConnectionProvider connectionProvider, EventQueryStore store,
            int numberOfSlices, int defaultPageSize, QueryMetrics metrics) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(store, "store");
        if (numberOfSlices <= 0) {
            throw new InvalidConfigurationException("numberOfSlices must be > 0, got: " + numberOfSlices);
        }
        requirePositivePageSize(defaultPageSize);
        this.numberOfSlices = numberOfSlices;
        this.defaultPageSize = defaultPageSize;
        this.metrics = metrics != null ? metrics : QueryMetrics.NOOP;
    }

    /**
     * Reads one page with the default page size.
     *
     * @see #replay(String, long, long, int)
     */
    public List<EventEnvelope> replay(String persistenceId, long fromSeqNr, long toSeqNr) {
        return replay(persistenceId, fromSeqNr, toSeqNr, defaultPageSize);
    }

    /**
     * Reads events with {@code fromSeqNr <= seqNr <= toSeqNr}, ascending, at most {@code pageSize}.
     *
     * @param persistenceId the id, {@code "<entityType>|<entityId>"} or a bare id
     * @param fromSeqNr     lowest sequence number, inclusive
     * @param toSeqNr       highest sequence number, inclusive
     * @param pageSize      maximum number of events, must be &gt; 0
     * @return events in sequence order; empty when {@code fromSeqNr > toSeqNr}
     * @throws InvalidConfigurationException if the id is malformed or {@code pageSize <= 0}
     * @throws StoreUnavailableException     if the database cannot be reached
     */
    public List<EventEnvelope> replay(String persistenceId, long fromSeqNr, long toSeqNr, int pageSize) {
        String entityType = PersistenceIds.entityTypeOf(persistenceId);
        requirePositivePageSize(pageSize);
        if (fromSeqNr > toSeqNr) {
            return List.of();
        }
        int slice = PersistenceIds.sliceOf(persistenceId, numberOfSlices);

        long startNanos = System.nanoTime();
        List<EventEnvelope> events;
        try (Connection conn = connectionProvider.getConnection()) {
            events = store.eventsByPersistenceId(conn, entityType, slice, persistenceId,
                    fromSeqNr, toSeqNr, pageSize);
        } catch (SQLException e) {
            metrics.incrementStoreFailure();
            throw new StoreUnavailableException("Failed to read events for persistenceId " + persistenceId, e);
        } catch (StoreUnavailableException e) {
            metrics.incrementStoreFailure();
            throw e;
        }
        metrics.recordReplay(events.size(), (System.nanoTime() - startNanos) / 1_000_000L);
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Read [" + events.size() + "] events for persistenceId [" + persistenceId + "]");
        }
        return events;
    }

    /**
     * Reads the whole range page by page, handing each event to {@code consumer} in order.
     *
     * @param persistenceId the id
     * @param fromSeqNr     lowest sequence number, inclusive
     * @param toSeqNr       highest sequence number, inclusive
     * @param consumer      receives every event
     * @return the sequence number of the last event delivered, or {@code fromSeqNr - 1} if none
     */
    public long replayAll(String persistenceId, long fromSeqNr, long toSeqNr, Consumer<EventEnvelope> consumer) {
        Objects.requireNonNull(consumer, "consumer");
        long next = fromSeqNr;
        long last = fromSeqNr - 1;
        while (next <= toSeqNr) {
            List<EventEnvelope> page = replay(persistenceId, next, toSeqNr, defaultPageSize);
            for (EventEnvelope event : page) {
                consumer.accept(event);
                last = event.seqNr();
            }
            if (page.size() < defaultPageSize || last == Long.MAX_VALUE) {
                break;
            }
            next = last + 1;
        }
        return last;
    }

    private static void requirePositivePageSize(int pageSize) {
        if (pageSize <= 0) {
            throw new InvalidConfigurationException("pageSize must be > 0, got: " + pageSize);
        }
    }
}
