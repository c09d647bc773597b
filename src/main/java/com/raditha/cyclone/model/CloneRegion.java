package com.raditha.cyclone.model;

import java.util.List;
import java.util.Locale;

/**
 * Merged clone finding: a region of A that corresponds to a region of B.
 *
 * @param spanA      Union of the members' spans in A
 * @param spanB      Union of the members' spans in B
 * @param type       Weakest type among the members
 * @param confidence Similarity of the dominant member
 * @param members    Pairs merged into this region
 */
public record CloneRegion(
        SourceSpan spanA,
        SourceSpan spanB,
        CloneType type,
        double confidence,
        List<ClonePair> members) {

    public CloneRegion {
        members = List.copyOf(members);
    }

    public String fileA() {
        return spanA.fileId();
    }

    public int startLineA() {
        return spanA.startLine();
    }

    public int endLineA() {
        return spanA.endLine();
    }

    public String fileB() {
        return spanB.fileId();
    }

    public int startLineB() {
        return spanB.startLine();
    }

    public int endLineB() {
        return spanB.endLine();
    }

    /**
     * Format as "Type 2 95% a/Foo.java:L10-20 <-> b/Bar.java:L5-15".
     */
    public String toDisplayString() {
        return String.format(Locale.ROOT, "%s %.0f%% %s <-> %s",
                type.displayName(), confidence * 100, spanA, spanB);
    }
}
