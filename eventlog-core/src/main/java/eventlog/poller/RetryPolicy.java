package eventlog.poller;

/**
 * Strategy for the delay before re-polling after the store was unavailable.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * Computes the delay before the next attempt.
     *
     * @param consecutiveFailures failed polls in a row so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int consecutiveFailures);

    /**
     * Policy that always waits {@code delayMs}.
     */
    static RetryPolicy fixed(long delayMs) {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be >= 0, got: " + delayMs);
        }
        return failures -> delayMs;
    }
}
