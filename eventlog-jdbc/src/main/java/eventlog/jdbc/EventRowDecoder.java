package eventlog.jdbc;

import eventlog.DecodeResult;
import eventlog.EventEnvelope;
import eventlog.EventMetadata;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Decodes journal rows into {@link EventEnvelope}s.
 *
 * <p>{@link #bind(ResultSetMetaData)} checks once per result set that every column of the
 * journal contract is present with a compatible JDBC type and remembers the column positions.
 * Each row is then read by index; a {@code NULL} in a mandatory column yields
 * {@link DecodeResult.Failed} instead of an exception. Metadata columns are nullable: a
 * {@code NULL} {@code meta_payload} means {@link EventMetadata#none()}.
 */
public final class EventRowDecoder implements JdbcTemplate.RowDecoder<EventEnvelope> {

    private static final Set<Integer> INT_TYPES = Set.of(Types.INTEGER, Types.SMALLINT, Types.TINYINT);
    private static final Set<Integer> LONG_TYPES = Set.of(Types.BIGINT, Types.INTEGER, Types.NUMERIC, Types.DECIMAL);
    private static final Set<Integer> STRING_TYPES = Set.of(
            Types.VARCHAR, Types.CHAR, Types.LONGVARCHAR, Types.NVARCHAR, Types.NCHAR, Types.LONGNVARCHAR);
    private static final Set<Integer> BYTES_TYPES = Set.of(
            Types.BINARY, Types.VARBINARY, Types.LONGVARBINARY, Types.BLOB);
    private static final Set<Integer> TIMESTAMP_TYPES = Set.of(Types.TIMESTAMP, Types.TIMESTAMP_WITH_TIMEZONE);

    /** Column contract of {@link #bind(ResultSetMetaData)}: name to accepted JDBC types. */
    private static final Map<String, Set<Integer>> COLUMNS = Map.ofEntries(
            Map.entry("slice", INT_TYPES),
            Map.entry("entity_type", STRING_TYPES),
            Map.entry("persistence_id", STRING_TYPES),
            Map.entry("seq_nr", LONG_TYPES),
            Map.entry("db_timestamp", TIMESTAMP_TYPES),
            Map.entry("read_db_timestamp", TIMESTAMP_TYPES),
            Map.entry("event_ser_id", INT_TYPES),
            Map.entry("event_ser_manifest", STRING_TYPES),
            Map.entry("event_payload", BYTES_TYPES),
            Map.entry("writer", STRING_TYPES),
            Map.entry("adapter_manifest", STRING_TYPES),
            Map.entry("meta_ser_id", INT_TYPES),
            Map.entry("meta_ser_manifest", STRING_TYPES),
            Map.entry("meta_payload", BYTES_TYPES));

    private final int slice;
    private final int entityType;
    private final int persistenceId;
    private final int seqNr;
    private final int dbTimestamp;
    private final int readDbTimestamp;
    private final int eventSerId;
    private final int eventSerManifest;
    private final int eventPayload;
    private final int writer;
    private final int adapterManifest;
    private final int metaSerId;
    private final int metaSerManifest;
    private final int metaPayload;

    private EventRowDecoder(Map<String, Integer> positions) {
        this.slice = positions.get("slice");
        this.entityType = positions.get("entity_type");
        this.persistenceId = positions.get("persistence_id");
        this.seqNr = positions.get("seq_nr");
        this.dbTimestamp = positions.get("db_timestamp");
        this.readDbTimestamp = positions.get("read_db_timestamp");
        this.eventSerId = positions.get("event_ser_id");
        this.eventSerManifest = positions.get("event_ser_manifest");
        this.eventPayload = positions.get("event_payload");
        this.writer = positions.get("writer");
        this.adapterManifest = positions.get("adapter_manifest");
        this.metaSerId = positions.get("meta_ser_id");
        this.metaSerManifest = positions.get("meta_ser_manifest");
        this.metaPayload = positions.get("meta_payload");
    }

    /**
     * Validates the result set shape against the journal column contract.
     *
     * @param metaData metadata of the result set about to be read
     * @return a decoder bound to the column positions, or the first offending column
     * @throws SQLException if the metadata cannot be read
     */
    public static DecodeResult<JdbcTemplate.RowDecoder<EventEnvelope>> bind(ResultSetMetaData metaData)
            throws SQLException {
        Map<String, Integer> positions = new HashMap<>();
        Map<String, Integer> types = new HashMap<>();
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
            String label = metaData.getColumnLabel(i).toLowerCase(Locale.ROOT);
            positions.put(label, i);
            types.put(label, metaData.getColumnType(i));
        }
        for (Map.Entry<String, Set<Integer>> column : COLUMNS.entrySet()) {
            Integer type = types.get(column.getKey());
            if (type == null) {
                return DecodeResult.failed(column.getKey(), "column missing from result set");
            }
            if (!column.getValue().contains(type)) {
                return DecodeResult.failed(column.getKey(), "unexpected JDBC type " + type);
            }
        }
        return DecodeResult.ok(new EventRowDecoder(positions));
    }

    @Override
    public DecodeResult<EventEnvelope> decode(ResultSet rs) throws SQLException {
        String pid = rs.getString(persistenceId);
        if (pid == null) {
            return DecodeResult.failed("persistence_id", "unexpected NULL");
        }
        String type = rs.getString(entityType);
        if (type == null) {
            return DecodeResult.failed("entity_type", "unexpected NULL");
        }
        int sliceValue = rs.getInt(slice);
        if (rs.wasNull()) {
            return DecodeResult.failed("slice", "unexpected NULL");
        }
        long seqNrValue = rs.getLong(seqNr);
        if (rs.wasNull() || seqNrValue < 1) {
            return DecodeResult.failed("seq_nr", "expected a positive sequence number for " + pid);
        }
        Instant committedAt = instant(rs, dbTimestamp);
        if (committedAt == null) {
            return DecodeResult.failed("db_timestamp", "unexpected NULL for " + pid + "/" + seqNrValue);
        }
        int serId = rs.getInt(eventSerId);
        if (rs.wasNull()) {
            return DecodeResult.failed("event_ser_id", "unexpected NULL for " + pid + "/" + seqNrValue);
        }
        String serManifest = rs.getString(eventSerManifest);
        if (serManifest == null) {
            return DecodeResult.failed("event_ser_manifest", "unexpected NULL for " + pid + "/" + seqNrValue);
        }
        byte[] payload = rs.getBytes(eventPayload);
        if (payload == null) {
            return DecodeResult.failed("event_payload", "unexpected NULL for " + pid + "/" + seqNrValue);
        }
        String writerValue = rs.getString(writer);
        if (writerValue == null) {
            return DecodeResult.failed("writer", "unexpected NULL for " + pid + "/" + seqNrValue);
        }

        return DecodeResult.ok(EventEnvelope.builder(pid, seqNrValue)
                .entityType(type)
                .slice(sliceValue)
                .dbTimestamp(committedAt)
                .readTimestamp(instant(rs, readDbTimestamp))
                .payload(payload)
                .serializerId(serId)
                .serializerManifest(serManifest)
                .writerId(writerValue)
                .adapterManifest(rs.getString(adapterManifest))
                .metadata(metadata(rs))
                .build());
    }

    private EventMetadata metadata(ResultSet rs) throws SQLException {
        byte[] payload = rs.getBytes(metaPayload);
        if (payload == null) {
            return EventMetadata.none();
        }
        int serId = rs.getInt(metaSerId);
        String manifest = rs.getString(metaSerManifest);
        return EventMetadata.of(serId, manifest == null ? "" : manifest, payload);
    }

    /**
     * Reads a {@code timestamp with time zone} column, or {@code null}.
     */
    public static Instant instant(ResultSet rs, int column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }
}
