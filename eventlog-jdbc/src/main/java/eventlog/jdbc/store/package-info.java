/**
 * JDBC-based {@link eventlog.spi.EventQueryStore} implementations.
 *
 * <p>{@link eventlog.jdbc.store.AbstractJdbcEventQueryStore} provides the shared SQL and row
 * decoding; subclasses supply the database clock functions and the persistence id collation:
 * H2 ({@code CURRENT_TIMESTAMP}) and PostgreSQL ({@code transaction_timestamp()},
 * {@code COLLATE "C"}).
 *
 * @see eventlog.jdbc.store.AbstractJdbcEventQueryStore
 * @see eventlog.jdbc.store.H2EventQueryStore
 * @see eventlog.jdbc.store.PostgresEventQueryStore
 * @see eventlog.jdbc.store.JdbcEventQueryStores
 */
package eventlog.jdbc.store;
