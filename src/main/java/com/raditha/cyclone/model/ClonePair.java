package com.raditha.cyclone.model;

import java.util.List;

/**
 * A pattern of A matched to a pattern of B.
 *
 * @param patternA   Pattern from repository A
 * @param patternB   Pattern from repository B
 * @param similarity Similarity score (0.0-1.0)
 * @param type       Clone classification
 * @param edits      Edit script from A to B, empty for Type 1 and Type 2 pairs
 */
public record ClonePair(
        Pattern patternA,
        Pattern patternB,
        double similarity,
        CloneType type,
        List<EditOperation> edits) {

    public ClonePair {
        edits = edits == null ? List.of() : List.copyOf(edits);
    }

    /**
     * Combined node count of both patterns.
     */
    public int combinedSize() {
        return patternA.size() + patternB.size();
    }

    /**
     * Check if similarity exceeds threshold.
     */
    public boolean exceedsThreshold(double threshold) {
        return similarity >= threshold;
    }
}
