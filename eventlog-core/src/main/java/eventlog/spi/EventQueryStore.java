package eventlog.spi;

import eventlog.EventEnvelope;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read contract for the sliced event journal.
 *
 * <p>All methods receive an explicit {@link Connection}; the caller owns its lifecycle.
 * Every query excludes soft-deleted rows. Implementations live in the {@code eventlog-jdbc} module.
 *
 * <p>Failures surface as {@link eventlog.StoreUnavailableException} (the round trip failed) or
 * {@link eventlog.RowDecodeException} (a row broke the schema contract).
 *
 * @see eventlog.jdbc.store.AbstractJdbcEventQueryStore
 */
public interface EventQueryStore {

    /**
     * Returns the database's transaction start time.
     *
     * @param conn the JDBC connection
     * @return current database time
     */
    Instant currentDbTimestamp(Connection conn);

    /**
     * Reads rows of a slice range ordered by {@code (db_timestamp, seq_nr, persistence_id)}.
     *
     * <p>With a non-null {@code untilTimestamp} the bounded query variant is used
     * ({@code db_timestamp < untilTimestamp}); otherwise the unbounded one.
     *
     * @param conn           the JDBC connection
     * @param entityType     entity type to match
     * @param minSlice       lowest slice, inclusive
     * @param maxSlice       highest slice, inclusive
     * @param fromTimestamp  inclusive lower bound on {@code db_timestamp}
     * @param untilTimestamp exclusive upper bound, or {@code null} for none
     * @param limit          maximum number of rows
     * @return rows in cursor order
     */
    List<EventEnvelope> rowsBySlices(
            Connection conn, String entityType, int minSlice, int maxSlice,
            Instant fromTimestamp, Instant untilTimestamp, int limit);

    /**
     * Reads the events of one persistence id with {@code fromSeqNr <= seq_nr <= toSeqNr},
     * ordered by {@code seq_nr}.
     *
     * @param conn          the JDBC connection
     * @param entityType    entity type parsed from the id
     * @param slice         slice computed from the id
     * @param persistenceId the id
     * @param fromSeqNr     lowest sequence number, inclusive
     * @param toSeqNr       highest sequence number, inclusive
     * @param limit         maximum number of rows
     * @return events in sequence order
     */
    List<EventEnvelope> eventsByPersistenceId(
            Connection conn, String entityType, int slice, String persistenceId,
            long fromSeqNr, long toSeqNr, int limit);

    /**
     * Returns the {@code db_timestamp} of one event, if it exists and is not deleted.
     *
     * @param conn          the JDBC connection
     * @param entityType    entity type parsed from the id
     * @param slice         slice computed from the id
     * @param persistenceId the id
     * @param seqNr         the sequence number
     * @return the commit timestamp, or empty
     */
    Optional<Instant> timestampOfEvent(
            Connection conn, String entityType, int slice, String persistenceId, long seqNr);

    /**
     * Lists distinct persistence ids in lexical order.
     *
     * @param conn    the JDBC connection
     * @param afterId exclusive lower bound, or {@code null} to start from the first id
     * @param limit   maximum number of ids
     * @return ids in ascending order
     */
    List<String> persistenceIds(Connection conn, String afterId, long limit);
}
