package eventlog;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Inclusive range of slices of one entity type, scanned by a single cursor.
 *
 * <p>Ranges used by concurrent cursors are expected to be disjoint and to cover all slices;
 * {@link #ranges(String, int, int)} produces such a partition.
 *
 * @param entityType the entity type to read
 * @param minSlice   lowest slice, inclusive
 * @param maxSlice   highest slice, inclusive
 */
public record SliceRange(String entityType, int minSlice, int maxSlice) {
    public SliceRange {
        if (entityType == null || entityType.isEmpty()) {
            throw new InvalidConfigurationException("entityType must not be null or empty");
        }
        if (minSlice < 0) {
            throw new InvalidConfigurationException("minSlice must be >= 0, got: " + minSlice);
        }
        if (minSlice > maxSlice) {
            throw new InvalidConfigurationException(
                    "Empty slice range: minSlice " + minSlice + " > maxSlice " + maxSlice);
        }
    }

    /**
     * Returns {@code true} if {@code slice} falls in this range.
     */
    public boolean contains(int slice) {
        return slice >= minSlice && slice <= maxSlice;
    }

    /**
     * Number of slices in the range.
     */
    public int size() {
        return maxSlice - minSlice + 1;
    }

    /**
     * Splits {@code [0, numberOfSlices)} into {@code numberOfRanges} equal, disjoint, covering ranges.
     *
     * @param entityType     entity type of every range
     * @param numberOfSlices total slice count
     * @param numberOfRanges number of ranges; must divide {@code numberOfSlices}
     * @return the ranges in ascending order
     * @throws InvalidConfigurationException if the counts are not positive or do not divide evenly
     */
    public static List<SliceRange> ranges(String entityType, int numberOfSlices, int numberOfRanges) {
        Objects.requireNonNull(entityType, "entityType");
        if (numberOfSlices <= 0 || numberOfRanges <= 0) {
            throw new InvalidConfigurationException("numberOfSlices and numberOfRanges must be > 0");
        }
        if (numberOfRanges > numberOfSlices || numberOfSlices % numberOfRanges != 0) {
            throw new InvalidConfigurationException(
                    "numberOfRanges [" + numberOfRanges + "] must be a whole number divisor of numberOfSlices ["
                            + numberOfSlices + "]");
        }
        int width = numberOfSlices / numberOfRanges;
        List<SliceRange> result = new ArrayList<>(numberOfRanges);
        for (int min = 0; min < numberOfSlices; min += width) {
            result.add(new SliceRange(entityType, min, min + width - 1));
        }
        return List.copyOf(result);
    }

    @Override
    public String toString() {
        return entityType + "[" + minSlice + "-" + maxSlice + "]";
    }
}
