package eventlog.jdbc.offset;

import eventlog.EventKey;
import eventlog.ResumePoint;
import eventlog.SliceRange;
import eventlog.StoreUnavailableException;
import eventlog.jdbc.EventRowDecoder;
import eventlog.jdbc.JdbcTemplate;
import eventlog.jdbc.TableNames;
import eventlog.spi.ConnectionProvider;
import eventlog.spi.OffsetStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link OffsetStore} persisting resume points in two tables: {@code <table>} holds the last seen
 * timestamp per slice range, {@code <table>_seen} the keys already delivered at that instant.
 *
 * <p>{@link #save(SliceRange, ResumePoint)} replaces both in one local transaction. An
 * exactly-once handler calls {@link #save(Connection, SliceRange, ResumePoint)} instead, on the
 * connection of its own transaction, so side effects and offset commit or roll back together:
 * <pre>{@code
 * TransactionalEventHandler handler = (events, next) -> {
 *     try (Connection conn = dataSource.getConnection()) {
 *         conn.setAutoCommit(false);
 *         for (EventEnvelope e : events) {
 *             project(conn, e);
 *         }
 *         offsetStore.save(conn, range, next);
 *         conn.commit();
 *     }
 * };
 * }</pre>
 */
public final class JdbcOffsetStore implements OffsetStore {
    private static final Logger logger = Logger.getLogger(JdbcOffsetStore.class.getName());

    private final ConnectionProvider connectionProvider;
    private final String selectOffsetSql;
    private final String selectSeenSql;
    private final String deleteOffsetSql;
    private final String deleteSeenSql;
    private final String insertOffsetSql;
    private final String insertSeenSql;

    public JdbcOffsetStore(ConnectionProvider connectionProvider) {
        this(connectionProvider, TableNames.DEFAULT_OFFSET_TABLE);
    }

    /**
     * @param connectionProvider connections for {@link #load(SliceRange)} and {@link #save(SliceRange, ResumePoint)}
     * @param tableName          offset table; the seen-key table is {@code tableName + "_seen"}
     */
    public JdbcOffsetStore(ConnectionProvider connectionProvider, String tableName) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        String offsets = TableNames.validate(tableName);
        String seen = TableNames.validate(tableName + "_seen");
        String byRange = " WHERE entity_type = ? AND min_slice = ? AND max_slice = ?";

        this.selectOffsetSql = "SELECT last_seen_timestamp FROM " + offsets + byRange;
        this.selectSeenSql = "SELECT persistence_id, seq_nr FROM " + seen + byRange;
        this.deleteOffsetSql = "DELETE FROM " + offsets + byRange;
        this.deleteSeenSql = "DELETE FROM " + seen + byRange;
        this.insertOffsetSql = "INSERT INTO " + offsets
                + " (entity_type, min_slice, max_slice, last_seen_timestamp) VALUES (?,?,?,?)";
        this.insertSeenSql = "INSERT INTO " + seen
                + " (entity_type, min_slice, max_slice, persistence_id, seq_nr) VALUES (?,?,?,?,?)";
    }

    @Override
    public Optional<ResumePoint> load(SliceRange range) {
        Objects.requireNonNull(range, "range");
        try (Connection conn = connectionProvider.getConnection()) {
            return load(conn, range);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to load offset of " + range, e);
        }
    }

    /**
     * Loads the resume point of a range using a connection owned by the caller.
     */
    public Optional<ResumePoint> load(Connection conn, SliceRange range) {
        List<Instant> timestamps = JdbcTemplate.query(conn, selectOffsetSql,
                rs -> EventRowDecoder.instant(rs, 1),
                range.entityType(), range.minSlice(), range.maxSlice());
        if (timestamps.isEmpty()) {
            return Optional.empty();
        }
        Set<EventKey> seen = new HashSet<>(JdbcTemplate.query(conn, selectSeenSql,
                rs -> new EventKey(rs.getString(1), rs.getLong(2)),
                range.entityType(), range.minSlice(), range.maxSlice()));
        return Optional.of(new ResumePoint(timestamps.get(0), seen));
    }

    @Override
    public void save(SliceRange range, ResumePoint resumePoint) {
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(resumePoint, "resumePoint");
        try (Connection conn = connectionProvider.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                save(conn, range, resumePoint);
                conn.commit();
            } catch (RuntimeException | SQLException e) {
                rollbackQuietly(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to save offset of " + range, e);
        }
    }

    /**
     * Replaces the resume point of a range on the caller's connection. Does not commit.
     */
    public void save(Connection conn, SliceRange range, ResumePoint resumePoint) {
        Objects.requireNonNull(conn, "conn");
        String type = range.entityType();
        JdbcTemplate.update(conn, deleteSeenSql, type, range.minSlice(), range.maxSlice());
        JdbcTemplate.update(conn, deleteOffsetSql, type, range.minSlice(), range.maxSlice());
        JdbcTemplate.update(conn, insertOffsetSql, type, range.minSlice(), range.maxSlice(),
                resumePoint.lastSeenTimestamp());
        for (EventKey key : resumePoint.seenInSameInstant()) {
            JdbcTemplate.update(conn, insertSeenSql, type, range.minSlice(), range.maxSlice(),
                    key.persistenceId(), key.seqNr());
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Saved offset of " + range + " at [" + resumePoint.lastSeenTimestamp() + "]");
        }
    }

    private static void rollbackQuietly(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}
