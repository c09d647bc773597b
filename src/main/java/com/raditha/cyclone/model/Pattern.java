package com.raditha.cyclone.model;

import com.raditha.cyclone.normalization.NormalizedTree;
import com.raditha.cyclone.parser.NodeKind;

/**
 * A normalized subtree extracted at an anchor node, the unit of comparison.
 *
 * @param repositoryId       Repository the pattern comes from
 * @param span               Source span of the anchor node
 * @param tree               Normalized form of the anchor's subtree
 * @param fingerprint        Structural hash over the normalized tree
 * @param literalFingerprint Same hash over the original identifier and literal values
 * @param size               Node count of the normalized tree
 * @param bucketKey          Key used for approximate candidate lookup
 */
public record Pattern(
        String repositoryId,
        SourceSpan span,
        NormalizedTree tree,
        long fingerprint,
        long literalFingerprint,
        int size,
        BucketKey bucketKey) {

    public String fileId() {
        return span.fileId();
    }

    public NodeKind rootKind() {
        return tree.kind(0);
    }

    /**
     * True if nodes below the depth cap were replaced by a sentinel.
     */
    public boolean truncated() {
        return tree.isTruncated();
    }

    @Override
    public String toString() {
        return repositoryId + "/" + span + " " + rootKind().typeName() + " (" + size + " nodes)";
    }
}
