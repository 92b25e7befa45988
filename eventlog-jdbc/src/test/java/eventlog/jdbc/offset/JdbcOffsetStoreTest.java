package eventlog.jdbc.offset;

import eventlog.EventEnvelope;
import eventlog.EventKey;
import eventlog.ResumePoint;
import eventlog.SliceRange;
import eventlog.StoreUnavailableException;
import eventlog.jdbc.DataSourceConnectionProvider;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcOffsetStoreTest {
    private static final SliceRange RANGE = new SliceRange("Cart", 0, 511);
    private static final Instant T = Instant.parse("2026-03-01T12:00:00.123456Z");

    private JdbcDataSource dataSource;
    private JdbcOffsetStore store;

    @BeforeEach
    void setup() throws Exception {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:offsets_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        String schema;
        try (InputStream is = getClass().getResourceAsStream("/schema/h2.sql")) {
            schema = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
        try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
            for (String stmt : schema.split(";")) {
                if (!stmt.isBlank()) {
                    st.execute(stmt.trim());
                }
            }
        }
        store = new JdbcOffsetStore(new DataSourceConnectionProvider(dataSource));
    }

    private static EventEnvelope event(String pid, long seqNr, Instant ts) {
        return EventEnvelope.builder(pid, seqNr).dbTimestamp(ts).payload(new byte[0]).build();
    }

    @Test
    void loadIsEmptyBeforeFirstSave() {
        assertEquals(Optional.empty(), store.load(RANGE));
    }

    @Test
    void saveReplacesPreviousOffset() {
        store.save(RANGE, ResumePoint.BEGINNING.advance(List.of(
                event("Cart|a", 1, T), event("Cart|b", 1, T))));
        ResumePoint later = ResumePoint.BEGINNING.advance(List.of(event("Cart|c", 4, T.plusSeconds(1))));

        store.save(RANGE, later);

        ResumePoint loaded = store.load(RANGE).orElseThrow();
        assertEquals(T.plusSeconds(1), loaded.lastSeenTimestamp());
        assertEquals(Set.of(new EventKey("Cart|c", 4)), loaded.seenInSameInstant());
    }

    @Test
    void rangesAreIndependent() {
        SliceRange other = new SliceRange("Cart", 512, 1023);
        SliceRange otherType = new SliceRange("Order", 0, 511);
        store.save(RANGE, ResumePoint.at(T));

        assertEquals(Optional.empty(), store.load(other));
        assertEquals(Optional.empty(), store.load(otherType));
    }

    @Test
    void saveOnCallerConnectionFollowsItsTransaction() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            store.save(conn, RANGE, ResumePoint.at(T));
            assertEquals(Optional.of(ResumePoint.at(T)), store.load(conn, RANGE));
            conn.rollback();
        }
        assertEquals(Optional.empty(), store.load(RANGE));

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            store.save(conn, RANGE, ResumePoint.at(T));
            conn.commit();
        }
        assertEquals(Optional.of(ResumePoint.at(T)), store.load(RANGE));
    }

    @Test
    void customTableName() throws Exception {
        try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
            st.execute("CREATE TABLE proj_offset (entity_type VARCHAR(255) NOT NULL, min_slice INT NOT NULL, "
                    + "max_slice INT NOT NULL, last_seen_timestamp TIMESTAMP(6) WITH TIME ZONE NOT NULL, "
                    + "PRIMARY KEY (entity_type, min_slice, max_slice))");
            st.execute("CREATE TABLE proj_offset_seen (entity_type VARCHAR(255) NOT NULL, min_slice INT NOT NULL, "
                    + "max_slice INT NOT NULL, persistence_id VARCHAR(255) NOT NULL, seq_nr BIGINT NOT NULL, "
                    + "PRIMARY KEY (entity_type, min_slice, max_slice, persistence_id, seq_nr))");
        }
        JdbcOffsetStore custom = new JdbcOffsetStore(new DataSourceConnectionProvider(dataSource), "proj_offset");

        custom.save(RANGE, ResumePoint.at(T));

        assertEquals(Optional.of(ResumePoint.at(T)), custom.load(RANGE));
        assertEquals(Optional.empty(), store.load(RANGE));
    }

    @Test
    void missingTableSurfacesAsStoreUnavailable() {
        JdbcOffsetStore missing = new JdbcOffsetStore(new DataSourceConnectionProvider(dataSource), "nope");
        assertThrows(StoreUnavailableException.class, () -> missing.load(RANGE));
    }
}
