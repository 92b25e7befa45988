package eventlog.jdbc;

import eventlog.PersistenceIds;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Writes journal rows the way the event writer does, for tests that read them back.
 */
final class JournalFixture {
    static final String INSERT_SQL = "INSERT INTO event_journal (slice, entity_type, persistence_id, seq_nr, "
            + "db_timestamp, event_ser_id, event_ser_manifest, event_payload, deleted, writer, adapter_manifest, "
            + "meta_ser_id, meta_ser_manifest, meta_payload) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?)";

    private final DataSource dataSource;
    private final int numberOfSlices;

    JournalFixture(DataSource dataSource, int numberOfSlices) {
        this.dataSource = dataSource;
        this.numberOfSlices = numberOfSlices;
    }

    static void createSchema(DataSource dataSource, String resource) throws SQLException, IOException {
        String schema = loadResource(resource);
        try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
            for (String stmt : schema.split(";")) {
                String trimmed = stmt.trim();
                if (!trimmed.isEmpty()) {
                    st.execute(trimmed);
                }
            }
        }
    }

    void write(String persistenceId, long seqNr, Instant dbTimestamp) throws SQLException {
        write(persistenceId, seqNr, dbTimestamp, false, null);
    }

    void writeDeleted(String persistenceId, long seqNr, Instant dbTimestamp) throws SQLException {
        write(persistenceId, seqNr, dbTimestamp, true, null);
    }

    void writeWithMetadata(String persistenceId, long seqNr, Instant dbTimestamp, byte[] meta) throws SQLException {
        write(persistenceId, seqNr, dbTimestamp, false, meta);
    }

    private void write(String persistenceId, long seqNr, Instant dbTimestamp, boolean deleted, byte[] meta)
            throws SQLException {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
            ps.setInt(1, PersistenceIds.sliceOf(persistenceId, numberOfSlices));
            ps.setString(2, PersistenceIds.entityTypeOf(persistenceId));
            ps.setString(3, persistenceId);
            ps.setLong(4, seqNr);
            ps.setObject(5, OffsetDateTime.ofInstant(dbTimestamp, ZoneOffset.UTC));
            ps.setInt(6, 1);
            ps.setString(7, "CartItemAdded");
            ps.setBytes(8, (persistenceId + "#" + seqNr).getBytes(StandardCharsets.UTF_8));
            ps.setBoolean(9, deleted);
            ps.setString(10, "writer-1");
            ps.setNull(11, Types.VARCHAR);
            if (meta == null) {
                ps.setNull(12, Types.INTEGER);
                ps.setNull(13, Types.VARCHAR);
                ps.setNull(14, Types.VARBINARY);
            } else {
                ps.setInt(12, 7);
                ps.setString(13, "Meta");
                ps.setBytes(14, meta);
            }
            ps.executeUpdate();
        }
    }

    static String loadResource(String path) throws IOException {
        try (InputStream is = JournalFixture.class.getResourceAsStream(path)) {
            if (is == null) throw new IOException("Resource not found: " + path);
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
