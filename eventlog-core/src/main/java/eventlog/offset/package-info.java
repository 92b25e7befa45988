/**
 * {@link eventlog.spi.OffsetStore} implementations that need no database.
 *
 * @see eventlog.jdbc.offset.JdbcOffsetStore
 */
package eventlog.offset;
