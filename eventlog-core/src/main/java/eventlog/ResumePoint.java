package eventlog;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Cursor state between polls: the newest delivered {@code db_timestamp} and the keys already
 * delivered at exactly that instant.
 *
 * <p>The next poll reads {@code db_timestamp >= lastSeenTimestamp}; the seen keys filter out
 * rows at the boundary instant that were delivered before. A resume point never moves backward.
 *
 * @param lastSeenTimestamp newest delivered timestamp, inclusive lower bound of the next poll
 * @param seenInSameInstant keys delivered with {@code dbTimestamp == lastSeenTimestamp}
 */
public record ResumePoint(Instant lastSeenTimestamp, Set<EventKey> seenInSameInstant) {

    /**
     * Resume point before any event.
     */
    public static final ResumePoint BEGINNING = new ResumePoint(Instant.EPOCH, Set.of());

    public ResumePoint {
        Objects.requireNonNull(lastSeenTimestamp, "lastSeenTimestamp");
        seenInSameInstant = Set.copyOf(Objects.requireNonNull(seenInSameInstant, "seenInSameInstant"));
    }

    /**
     * Resume point at {@code timestamp} with no seen keys; every row at that instant is delivered again.
     */
    public static ResumePoint at(Instant timestamp) {
        return new ResumePoint(timestamp, Set.of());
    }

    /**
     * Returns {@code true} if the key was already delivered at the boundary instant.
     */
    public boolean isSeen(EventKey key) {
        return seenInSameInstant.contains(key);
    }

    /**
     * Advances past a batch ordered by {@code (dbTimestamp, seqNr)}.
     *
     * <p>An empty batch returns this resume point. When the batch ends at the current boundary
     * instant the seen keys accumulate; otherwise they are replaced by the batch's keys at its last instant.
     *
     * @param batch delivered events, in cursor order
     * @return the resume point after the batch
     */
    public ResumePoint advance(List<EventEnvelope> batch) {
        if (batch.isEmpty()) {
            return this;
        }
        Instant last = batch.get(batch.size() - 1).dbTimestamp();
        if (last.isBefore(lastSeenTimestamp)) {
            throw new IllegalStateException(
                    "Batch ends at " + last + " before resume point " + lastSeenTimestamp);
        }
        Set<EventKey> seen = new HashSet<>();
        if (last.equals(lastSeenTimestamp)) {
            seen.addAll(seenInSameInstant);
        }
        for (int i = batch.size() - 1; i >= 0; i--) {
            EventEnvelope event = batch.get(i);
            if (!event.dbTimestamp().equals(last)) {
                break;
            }
            seen.add(event.key());
        }
        return new ResumePoint(last, seen);
    }
}
