/**
 * Read-side queries over the sliced journal: the lag-compensating
 * {@link eventlog.query.SliceRangeCursor}, per-identity replay, identity enumeration and the
 * database clock.
 */
package eventlog.query;
