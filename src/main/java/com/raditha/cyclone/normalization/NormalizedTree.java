package com.raditha.cyclone.normalization;

import com.raditha.cyclone.model.RoleToken;
import com.raditha.cyclone.parser.NodeKind;
import com.raditha.cyclone.parser.SyntaxTree;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.Objects;

/**
 * Canonical form of one pattern's subtree.
 * <p>
 * Same arena layout as {@link SyntaxTree}: node 0 is the anchor, children are
 * contiguous and in source order. Identifier and literal leaves carry a
 * {@link RoleToken}; other nodes carry their structural label. Every node
 * except the truncation sentinel remembers the canonical syntax node it was
 * built from, so original values and lines remain available.
 */
public final class NormalizedTree {

    private final SyntaxTree source;
    private final NodeKind[] kinds;
    private final @Nullable String[] labels;
    private final @Nullable RoleToken[] roleTokens;
    private final int[] sourceNodes;
    private final int[] firstChild;
    private final int[] childCount;
    private final boolean truncated;

    NormalizedTree(SyntaxTree source, NodeKind[] kinds, @Nullable String[] labels,
                   @Nullable RoleToken[] roleTokens, int[] sourceNodes,
                   int[] firstChild, int[] childCount, boolean truncated) {
        this.source = source;
        this.kinds = kinds;
        this.labels = labels;
        this.roleTokens = roleTokens;
        this.sourceNodes = sourceNodes;
        this.firstChild = firstChild;
        this.childCount = childCount;
        this.truncated = truncated;
    }

    /**
     * The canonical syntax tree this pattern was cut from.
     */
    public SyntaxTree source() {
        return source;
    }

    public int size() {
        return kinds.length;
    }

    public NodeKind kind(int node) {
        return kinds[node];
    }

    /**
     * Structural label (operator, keyword) of a non-leaf node, or null.
     */
    public @Nullable String label(int node) {
        return labels[node];
    }

    /**
     * Role token of an identifier or literal leaf, null for every other node.
     */
    public @Nullable RoleToken roleToken(int node) {
        return roleTokens[node];
    }

    /**
     * Original identifier or literal text of a role leaf, null for other nodes.
     */
    public @Nullable String originalValue(int node) {
        return roleTokens[node] == null ? null : source.value(sourceNodes[node]);
    }

    /**
     * Index of the canonical syntax node, or -1 for the truncation sentinel.
     */
    public int sourceNode(int node) {
        return sourceNodes[node];
    }

    /**
     * Source line of the node, or 0 for the truncation sentinel.
     */
    public int line(int node) {
        return sourceNodes[node] < 0 ? 0 : source.startLine(sourceNodes[node]);
    }

    public int childCount(int node) {
        return childCount[node];
    }

    public int child(int node, int k) {
        if (k < 0 || k >= childCount[node]) {
            throw new IndexOutOfBoundsException("Node " + node + " has no child " + k);
        }
        return firstChild[node] + k;
    }

    /**
     * True if some nodes were elided below the depth cap.
     */
    public boolean isTruncated() {
        return truncated;
    }

    /**
     * Human readable label: kind plus label or role token.
     */
    public String displayLabel(int node) {
        String name = kinds[node].typeName();
        if (roleTokens[node] != null) {
            return name + "[" + roleTokens[node] + "]";
        }
        if (labels[node] != null) {
            return name + "(" + labels[node] + ")";
        }
        return name;
    }

    /**
     * Full structural comparison, role tokens included. Two trees are equal
     * exactly when their fingerprints are computed from identical input.
     */
    public boolean structurallyEquals(NormalizedTree other) {
        if (other == this) {
            return true;
        }
        return other != null
                && Arrays.equals(kinds, other.kinds)
                && Arrays.equals(childCount, other.childCount)
                && Arrays.equals(labels, other.labels)
                && Arrays.equals(roleTokens, other.roleTokens);
    }

    /**
     * Render as an indented outline.
     */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        dump(0, 0, sb);
        return sb.toString();
    }

    private void dump(int node, int depth, StringBuilder sb) {
        sb.append("  ".repeat(depth)).append(displayLabel(node)).append('\n');
        for (int c = 0; c < childCount[node]; c++) {
            dump(firstChild[node] + c, depth + 1, sb);
        }
    }

    @Override
    public String toString() {
        return "NormalizedTree[" + Objects.requireNonNullElse(source.fileId(), "?") + ", " + size() + " nodes]";
    }
}
