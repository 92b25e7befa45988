/**
 * Background delivery of slice range events to handlers.
 *
 * <p>A {@link eventlog.poller.SliceRangePoller} owns exactly one
 * {@link eventlog.query.SliceRangeCursor}. Run one poller per disjoint slice range to spread a
 * projection across workers or processes; two pollers on overlapping ranges deliver the
 * overlapping events twice.
 *
 * <p>Delivery modes:
 * <ul>
 *   <li>{@link eventlog.poller.DeliveryMode#AT_LEAST_ONCE}: the resume point is saved after the
 *       handler finished a batch. A crash in between redelivers the batch.</li>
 *   <li>{@link eventlog.poller.DeliveryMode#EXACTLY_ONCE}: the handler writes its results and the
 *       resume point in one transaction of its own.</li>
 * </ul>
 */
package eventlog.poller;
