package eventlog.poller;

import eventlog.EventEnvelope;
import eventlog.ResumePoint;

import java.util.List;

/**
 * Exactly-once consumer: handles a whole batch and stores its resume point in the same
 * transaction as its own side effects (for example with
 * {@code JdbcOffsetStore.save(Connection, SliceRange, ResumePoint)}).
 *
 * <p>The poller never saves the resume point itself in this mode; it only loads it on start.
 *
 * @see EventHandler
 */
@FunctionalInterface
public interface TransactionalEventHandler {

    /**
     * Handles a non-empty batch and commits {@code next} atomically with the results.
     * Throwing stops the poller; nothing of the batch may have been committed.
     *
     * @param events batch in cursor order
     * @param next   resume point after the batch
     * @throws Exception on failure
     */
    void handleBatch(List<EventEnvelope> events, ResumePoint next) throws Exception;
}
