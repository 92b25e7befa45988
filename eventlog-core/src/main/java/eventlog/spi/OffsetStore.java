package eventlog.spi;

import eventlog.ResumePoint;
import eventlog.SliceRange;

import java.util.Optional;

/**
 * Checkpoint storage for {@link ResumePoint}s, one per slice range.
 *
 * @see eventlog.offset.InMemoryOffsetStore
 * @see eventlog.jdbc.offset.JdbcOffsetStore
 */
public interface OffsetStore {

    /**
     * Loads the last saved resume point of a slice range.
     *
     * @param range the slice range
     * @return the saved resume point, or empty if none was saved
     */
    Optional<ResumePoint> load(SliceRange range);

    /**
     * Replaces the saved resume point of a slice range.
     *
     * @param range       the slice range
     * @param resumePoint the new resume point
     */
    void save(SliceRange range, ResumePoint resumePoint);
}
