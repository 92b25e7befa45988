/**
 * Service Provider Interfaces for plugging the query engine into a database and a monitoring system.
 *
 * @see eventlog.spi.ConnectionProvider
 * @see eventlog.spi.EventQueryStore
 * @see eventlog.spi.OffsetStore
 * @see eventlog.spi.QueryMetrics
 */
package eventlog.spi;
