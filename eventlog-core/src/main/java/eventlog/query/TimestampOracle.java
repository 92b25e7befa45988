package eventlog.query;

import eventlog.StoreUnavailableException;
import eventlog.spi.ConnectionProvider;
import eventlog.spi.EventQueryStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Objects;

/**
 * Reads the database clock. Never cached: every lag-bounded poll asks again.
 */
public final class TimestampOracle {
    private final ConnectionProvider connectionProvider;
    private final EventQueryStore store;

    public TimestampOracle(ConnectionProvider connectionProvider, EventQueryStore store) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Returns the database's transaction start time in its own round trip.
     *
     * @throws StoreUnavailableException if the connection or the probe fails
     */
    public Instant now() {
        try (Connection conn = connectionProvider.getConnection()) {
            return now(conn);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to read current database timestamp", e);
        }
    }

    /**
     * Returns the database time using a connection the caller already holds.
     */
    public Instant now(Connection conn) {
        return store.currentDbTimestamp(conn);
    }
}
