package com.raditha.cyclone.similarity;

import java.util.Locale;

/**
 * A single comparison would need more memory than the configured guard allows.
 * The pattern concerned is reported as unmatched and matching continues.
 */
public class ResourceExhaustionException extends RuntimeException {

    private final long requiredCells;
    private final long maxCells;

    public ResourceExhaustionException(long requiredCells, long maxCells) {
        super(String.format(Locale.ROOT, "Comparison needs %d table cells, limit is %d", requiredCells, maxCells));
        this.requiredCells = requiredCells;
        this.maxCells = maxCells;
    }

    public long getRequiredCells() {
        return requiredCells;
    }

    public long getMaxCells() {
        return maxCells;
    }
}
