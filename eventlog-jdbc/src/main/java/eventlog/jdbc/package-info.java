/**
 * JDBC row source for the event log query engine.
 *
 * <ul>
 *   <li>{@code eventlog.jdbc.store}: {@link eventlog.spi.EventQueryStore} implementations per database</li>
 *   <li>{@code eventlog.jdbc.offset}: relational {@link eventlog.spi.OffsetStore}</li>
 * </ul>
 *
 * <p>{@link eventlog.jdbc.JdbcTemplate} and {@link eventlog.jdbc.EventRowDecoder} are shared by both.
 */
package eventlog.jdbc;
