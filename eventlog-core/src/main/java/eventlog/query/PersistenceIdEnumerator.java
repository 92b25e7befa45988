package eventlog.query;

import eventlog.InvalidConfigurationException;
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
 * Pages through the distinct persistence ids of the whole journal in lexical order.
 *
 * <p>Keyset pagination: each page starts strictly after the last id of the previous one,
 * so concurrent inserts never shift a page.
 */
public final class PersistenceIdEnumerator {
    private static final Logger logger = Logger.getLogger(PersistenceIdEnumerator.class.getName());

    private final ConnectionProvider connectionProvider;
    private final EventQueryStore store;
    private final QueryMetrics metrics;

    public PersistenceIdEnumerator(ConnectionProvider connectionProvider, EventQueryStore store, QueryMetrics metrics) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(store, "store");
        this.metrics = metrics != null ? metrics : QueryMetrics.NOOP;
    }

    /**
     * Returns the first {@code limit} ids.
     */
    public List<String> listIdentities(long limit) {
        return fetch(null, limit);
    }

    /**
     * Returns up to {@code limit} ids strictly greater than {@code afterId}.
     *
     * @param afterId last id of the previous page
     * @param limit   maximum number of ids, must be &gt; 0
     * @return ids in ascending order; empty once the journal is exhausted
     * @throws StoreUnavailableException if the database cannot be reached
     */
    public List<String> listIdentities(String afterId, long limit) {
        Objects.requireNonNull(afterId, "afterId");
        return fetch(afterId, limit);
    }

    /**
     * Visits every persistence id once, in order, fetching {@code pageSize} ids per round trip.
     *
     * @return the number of ids visited
     */
    public long forEach(int pageSize, Consumer<String> consumer) {
        Objects.requireNonNull(consumer, "consumer");
        long count = 0;
        String after = null;
        while (true) {
            List<String> page = fetch(after, pageSize);
            if (page.isEmpty()) {
                return count;
            }
            page.forEach(consumer);
            count += page.size();
            after = page.get(page.size() - 1);
        }
    }

    private List<String> fetch(String afterId, long limit) {
        if (limit <= 0) {
            throw new InvalidConfigurationException("limit must be > 0, got: " + limit);
        }
        long startNanos = System.nanoTime();
        List<String> ids;
        try (Connection conn = connectionProvider.getConnection()) {
            ids = store.persistenceIds(conn, afterId, limit);
        } catch (SQLException e) {
            metrics.incrementStoreFailure();
            throw new StoreUnavailableException("Failed to read persistence ids", e);
        } catch (StoreUnavailableException e) {
            metrics.incrementStoreFailure();
            throw e;
        }
        metrics.recordPersistenceIds(ids.size(), (System.nanoTime() - startNanos) / 1_000_000L);
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Read [" + ids.size() + "] persistence ids");
        }
        return ids;
    }
}
