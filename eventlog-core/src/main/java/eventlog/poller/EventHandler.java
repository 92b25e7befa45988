package eventlog.poller;

import eventlog.EventEnvelope;

/**
 * At-least-once consumer of polled events.
 *
 * <p>The poller calls {@link #handle} for each event in cursor order and saves the resume point
 * only after the whole batch was handled, so an event may be seen again after a crash.
 * Implementations should be idempotent by {@link EventEnvelope#key()}.
 *
 * @see TransactionalEventHandler
 */
@FunctionalInterface
public interface EventHandler {

    /**
     * Handles one event. Throwing stops the poller without saving the resume point.
     *
     * @param event the polled event
     * @throws Exception on failure
     */
    void handle(EventEnvelope event) throws Exception;
}
