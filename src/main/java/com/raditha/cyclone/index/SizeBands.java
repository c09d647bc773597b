package com.raditha.cyclone.index;

/**
 * Geometric size bands for a similarity threshold.
 * <p>
 * A band covers sizes whose logarithm falls in an interval of width
 * {@code ln(1 / threshold)}. Two patterns can only reach the threshold when
 * {@code min / max >= threshold}, and any such sizes lie in the same or in
 * adjacent bands. A pair whose ratio is exactly the threshold can land one
 * band further once the logarithm is rounded (sizes 1000 and 10000 at 0.1),
 * so lookups search {@link #SEARCH_RADIUS} bands on each side and leave the
 * rest to {@link #shouldCompare}.
 */
public final class SizeBands {

    /**
     * Bands searched on each side of a pattern's own band.
     */
    public static final int SEARCH_RADIUS = 2;

    private final double width;
    private final double threshold;

    public SizeBands(double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Threshold must be between 0.0 and 1.0");
        }
        this.threshold = threshold;
        this.width = threshold > 0.0 && threshold < 1.0 ? Math.log(1.0 / threshold) : 0.0;
    }

    /**
     * Band of a pattern size.
     */
    public int bandOf(int size) {
        if (threshold >= 1.0) {
            // only equal sizes can match
            return size;
        }
        if (threshold <= 0.0) {
            return 0;
        }
        return (int) Math.floor(Math.log(Math.max(size, 1)) / width);
    }

    /**
     * Check if two pattern sizes can still reach the threshold.
     * Same test as a size filter with a maximum difference ratio of
     * {@code 1 - threshold}.
     */
    public boolean shouldCompare(int size1, int size2) {
        if (size1 == size2) {
            return true;
        }
        int maxSize = Math.max(size1, size2);
        int minSize = Math.min(size1, size2);
        return (double) minSize / maxSize >= threshold;
    }
}
