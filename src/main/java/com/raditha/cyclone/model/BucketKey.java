package com.raditha.cyclone.model;

import com.raditha.cyclone.parser.NodeKind;

/**
 * Coarse key grouping patterns that may be similar.
 *
 * @param sizeBand   geometric size band of the pattern
 * @param rootKind   kind of the anchor node
 * @param childCount number of children of the anchor node
 */
public record BucketKey(int sizeBand, NodeKind rootKind, int childCount) {

    /**
     * Same root kind and child count in another size band.
     */
    public BucketKey inBand(int band) {
        return new BucketKey(band, rootKind, childCount);
    }
}
