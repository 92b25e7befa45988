package eventlog.offset;

import eventlog.ResumePoint;
import eventlog.SliceRange;
import eventlog.spi.OffsetStore;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local {@link OffsetStore}. Resume points are lost on restart, so a restarted poller
 * replays from its initial resume point.
 */
public final class InMemoryOffsetStore implements OffsetStore {
    private final ConcurrentMap<SliceRange, ResumePoint> offsets = new ConcurrentHashMap<>();

    @Override
    public Optional<ResumePoint> load(SliceRange range) {
        Objects.requireNonNull(range, "range");
        return Optional.ofNullable(offsets.get(range));
    }

    @Override
    public void save(SliceRange range, ResumePoint resumePoint) {
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(resumePoint, "resumePoint");
        offsets.put(range, resumePoint);
    }

    /**
     * Drops the saved resume point of a range.
     */
    public void reset(SliceRange range) {
        offsets.remove(range);
    }
}
