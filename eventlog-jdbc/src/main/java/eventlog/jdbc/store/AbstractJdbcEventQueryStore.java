package eventlog.jdbc.store;

import eventlog.EventEnvelope;
import eventlog.jdbc.EventRowDecoder;
import eventlog.jdbc.JdbcTemplate;
import eventlog.jdbc.TableNames;
import eventlog.spi.EventQueryStore;

import java.sql.Connection;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Base JDBC query store over the journal table.
 *
 * <p>All statements are built once per instance. The slice query exists in two fixed variants,
 * with and without an upper bound on {@code db_timestamp}, and so does the persistence id query.
 * Subclasses supply the database clock functions and the collation used to order persistence ids.
 * Register custom implementations via
 * {@code META-INF/services/eventlog.jdbc.store.AbstractJdbcEventQueryStore}.
 *
 * @see JdbcEventQueryStores
 */
public abstract class AbstractJdbcEventQueryStore implements EventQueryStore {

    private final String tableName;
    private final String currentTimestampSql;
    private final String slicesBoundedSql;
    private final String slicesUnboundedSql;
    private final String eventsByPersistenceIdSql;
    private final String timestampOfEventSql;
    private final String persistenceIdsSql;
    private final String persistenceIdsAfterSql;

    protected AbstractJdbcEventQueryStore() {
        this(TableNames.DEFAULT_JOURNAL_TABLE);
    }

    protected AbstractJdbcEventQueryStore(String tableName) {
        this.tableName = TableNames.validate(tableName);

        String columns = "slice, entity_type, persistence_id, seq_nr, db_timestamp, "
                + readTimestampFunction() + " AS read_db_timestamp, "
                + "event_ser_id, event_ser_manifest, event_payload, writer, adapter_manifest, "
                + "meta_ser_id, meta_ser_manifest, meta_payload";
        String sliceFilter = "SELECT " + columns + " FROM " + tableName
                + " WHERE entity_type = ? AND slice BETWEEN ? AND ? AND db_timestamp >= ?";
        String sliceOrder = " AND deleted = false ORDER BY db_timestamp, seq_nr, persistence_id"
                + idCollation() + " LIMIT ?";
        String pid = "persistence_id" + idCollation();

        this.currentTimestampSql = "SELECT " + currentTimestampFunction() + " AS db_timestamp";
        this.slicesBoundedSql = sliceFilter + " AND db_timestamp < ?" + sliceOrder;
        this.slicesUnboundedSql = sliceFilter + sliceOrder;
        this.eventsByPersistenceIdSql = "SELECT " + columns + " FROM " + tableName
                + " WHERE slice = ? AND entity_type = ? AND persistence_id = ?"
                + " AND seq_nr >= ? AND seq_nr <= ? AND deleted = false ORDER BY seq_nr LIMIT ?";
        this.timestampOfEventSql = "SELECT db_timestamp FROM " + tableName
                + " WHERE slice = ? AND entity_type = ? AND persistence_id = ? AND seq_nr = ? AND deleted = false";
        this.persistenceIdsSql = "SELECT persistence_id FROM " + tableName
                + " WHERE deleted = false GROUP BY persistence_id ORDER BY " + pid + " LIMIT ?";
        this.persistenceIdsAfterSql = "SELECT persistence_id FROM " + tableName
                + " WHERE deleted = false AND " + pid + " > ? GROUP BY persistence_id ORDER BY " + pid + " LIMIT ?";
    }

    /**
     * Unique identifier for this store (e.g., "postgresql", "h2").
     */
    public abstract String name();

    /**
     * JDBC URL prefixes this store handles (e.g., "jdbc:postgresql:").
     */
    public abstract List<String> jdbcUrlPrefixes();

    /**
     * Returns a store of the same dialect reading from another journal table.
     *
     * @param tableName table name, optionally schema-qualified
     */
    public abstract AbstractJdbcEventQueryStore withTableName(String tableName);

    /**
     * SQL expression for the transaction start time, used as the lag reference.
     */
    protected abstract String currentTimestampFunction();

    /**
     * SQL expression for the time the statement was executed, reported as the read timestamp.
     */
    protected abstract String readTimestampFunction();

    /**
     * Collation clause appended to {@code persistence_id} comparisons, or empty for the column default.
     */
    protected String idCollation() {
        return "";
    }

    public String tableName() {
        return tableName;
    }

    @Override
    public Instant currentDbTimestamp(Connection conn) {
        List<OffsetDateTime> rows = JdbcTemplate.query(conn, currentTimestampSql,
                rs -> rs.getObject(1, OffsetDateTime.class));
        return rows.get(0).toInstant();
    }

    @Override
    public List<EventEnvelope> rowsBySlices(Connection conn, String entityType, int minSlice, int maxSlice,
            Instant fromTimestamp, Instant untilTimestamp, int limit) {
        if (untilTimestamp == null) {
            return JdbcTemplate.queryDecoded(conn, slicesUnboundedSql, EventRowDecoder::bind,
                    entityType, minSlice, maxSlice, fromTimestamp, limit);
        }
        return JdbcTemplate.queryDecoded(conn, slicesBoundedSql, EventRowDecoder::bind,
                entityType, minSlice, maxSlice, fromTimestamp, untilTimestamp, limit);
    }

    @Override
    public List<EventEnvelope> eventsByPersistenceId(Connection conn, String entityType, int slice,
            String persistenceId, long fromSeqNr, long toSeqNr, int limit) {
        return JdbcTemplate.queryDecoded(conn, eventsByPersistenceIdSql, EventRowDecoder::bind,
                slice, entityType, persistenceId, fromSeqNr, toSeqNr, limit);
    }

    @Override
    public Optional<Instant> timestampOfEvent(Connection conn, String entityType, int slice,
            String persistenceId, long seqNr) {
        List<OffsetDateTime> rows = JdbcTemplate.query(conn, timestampOfEventSql,
                rs -> rs.getObject("db_timestamp", OffsetDateTime.class),
                slice, entityType, persistenceId, seqNr);
        return rows.stream().findFirst().map(OffsetDateTime::toInstant);
    }

    @Override
    public List<String> persistenceIds(Connection conn, String afterId, long limit) {
        if (afterId == null) {
            return JdbcTemplate.query(conn, persistenceIdsSql, rs -> rs.getString(1), limit);
        }
        return JdbcTemplate.query(conn, persistenceIdsAfterSql, rs -> rs.getString(1), afterId, limit);
    }
}
