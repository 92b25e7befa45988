package eventlog.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for journal queries.
 *
 * <p>Callers acquire one connection per round trip and close it before decoding finishes
 * or immediately after; connections are never held across a poller sleep.
 *
 * @see eventlog.jdbc.DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
