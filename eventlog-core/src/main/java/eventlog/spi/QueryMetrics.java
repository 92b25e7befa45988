package eventlog.spi;

import eventlog.SliceRange;

/**
 * Observer for journal queries, called once per completed round trip.
 *
 * <p>The {@link #NOOP} instance discards everything. Implement this interface to bridge into
 * Micrometer or another monitoring system.
 */
public interface QueryMetrics {

    /**
     * No-op instance that discards all metrics.
     */
    QueryMetrics NOOP = new Noop();

    /**
     * Records one slice cursor poll.
     *
     * @param range     the polled slice range
     * @param batchSize events returned after de-duplication
     * @param elapsedMs wall time of the poll in milliseconds
     */
    void recordPoll(SliceRange range, int batchSize, long elapsedMs);

    /**
     * Records one page of a per-identity replay.
     *
     * @param rows      events returned
     * @param elapsedMs wall time in milliseconds
     */
    void recordReplay(int rows, long elapsedMs);

    /**
     * Records one page of persistence id enumeration.
     *
     * @param rows      ids returned
     * @param elapsedMs wall time in milliseconds
     */
    void recordPersistenceIds(int rows, long elapsedMs);

    /**
     * Increments the count of failed store round trips.
     */
    void incrementStoreFailure();

    /**
     * Records how far the newest delivered event lags behind the database clock.
     *
     * @param lagMs lag in milliseconds (always non-negative)
     */
    default void recordPollLagMs(long lagMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements QueryMetrics {
        @Override
        public void recordPoll(SliceRange range, int batchSize, long elapsedMs) {
        }

        @Override
        public void recordReplay(int rows, long elapsedMs) {
        }

        @Override
        public void recordPersistenceIds(int rows, long elapsedMs) {
        }

        @Override
        public void incrementStoreFailure() {
        }
    }
}
