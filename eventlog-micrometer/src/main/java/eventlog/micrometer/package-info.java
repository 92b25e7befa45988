/**
 * Micrometer bridge for journal query metrics.
 *
 * <p>{@link eventlog.micrometer.MicrometerQueryMetrics} implements the
 * {@link eventlog.spi.QueryMetrics} SPI with Micrometer timers, summaries, counters and a gauge.
 */
package eventlog.micrometer;
