package eventlog.poller;

/**
 * When a {@link SliceRangePoller} commits its resume point.
 */
public enum DeliveryMode {
    /**
     * Events are handled first and the resume point saved afterwards; a crash in between redelivers.
     */
    AT_LEAST_ONCE,
    /**
     * The handler commits the resume point together with its own results.
     */
    EXACTLY_ONCE
}
