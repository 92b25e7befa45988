package eventlog.query;

import eventlog.EventEnvelope;
import eventlog.ResumePoint;

import java.util.List;
import java.util.Objects;

/**
 * One step of a {@link SliceRangeCursor}: the new events and the resume point after them.
 *
 * @param events events in {@code (dbTimestamp, seqNr)} order, none seen before
 * @param next   resume point for the following poll
 */
public record CursorPage(List<EventEnvelope> events, ResumePoint next) {
    public CursorPage {
        events = List.copyOf(Objects.requireNonNull(events, "events"));
        Objects.requireNonNull(next, "next");
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public int size() {
        return events.size();
    }
}
