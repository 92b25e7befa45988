/**
 * Relational {@link eventlog.spi.OffsetStore}. Table DDL ships in {@code schema/h2.sql} and
 * {@code schema/postgresql.sql}.
 */
package eventlog.jdbc.offset;
