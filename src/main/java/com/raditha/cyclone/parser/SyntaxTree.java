package com.raditha.cyclone.parser;

import com.raditha.cyclone.model.SourceSpan;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;

/**
 * Syntax tree of one source file stored as an arena of nodes.
 * <p>
 * Nodes are addressed by index; the root is node 0. The children of a node
 * occupy the contiguous index range {@code [firstChild, firstChild + childCount)}
 * in source order. Instances are immutable and created through {@link Builder}.
 */
public final class SyntaxTree {

    public static final int ROOT = 0;

    private final String fileId;
    private final NodeKind[] kinds;
    private final @Nullable String[] values;
    private final int[] firstChild;
    private final int[] childCount;
    private final int[] startOffset;
    private final int[] endOffset;
    private final int[] startLine;
    private final int[] endLine;
    private final int[] subtreeSize;

    private SyntaxTree(Builder b) {
        int n = b.size;
        this.fileId = b.fileId;
        this.kinds = Arrays.copyOf(b.kinds, n);
        this.values = Arrays.copyOf(b.values, n);
        this.firstChild = Arrays.copyOf(b.firstChild, n);
        this.childCount = Arrays.copyOf(b.childCount, n);
        this.startOffset = Arrays.copyOf(b.startOffset, n);
        this.endOffset = Arrays.copyOf(b.endOffset, n);
        this.startLine = Arrays.copyOf(b.startLine, n);
        this.endLine = Arrays.copyOf(b.endLine, n);
        this.subtreeSize = new int[n];
        // children always have larger indices than their parent
        for (int i = n - 1; i >= 0; i--) {
            int total = 1;
            for (int c = 0; c < childCount[i]; c++) {
                total += subtreeSize[firstChild[i] + c];
            }
            subtreeSize[i] = total;
        }
    }

    public String fileId() {
        return fileId;
    }

    /**
     * Number of nodes in the tree.
     */
    public int size() {
        return kinds.length;
    }

    public NodeKind kind(int node) {
        return kinds[node];
    }

    /**
     * Identifier or literal text for role leaves, operator or keyword label for
     * structural nodes that carry one, otherwise null.
     */
    public @Nullable String value(int node) {
        return values[node];
    }

    public int childCount(int node) {
        return childCount[node];
    }

    /**
     * Index of the {@code k}-th child of {@code node}.
     */
    public int child(int node, int k) {
        if (k < 0 || k >= childCount[node]) {
            throw new IndexOutOfBoundsException("Node " + node + " has no child " + k);
        }
        return firstChild[node] + k;
    }

    /**
     * Number of nodes in the subtree rooted at {@code node}, the node included.
     */
    public int subtreeSize(int node) {
        return subtreeSize[node];
    }

    public SourceSpan span(int node) {
        return new SourceSpan(fileId, startOffset[node], endOffset[node], startLine[node], endLine[node]);
    }

    public int startOffset(int node) {
        return startOffset[node];
    }

    public int endOffset(int node) {
        return endOffset[node];
    }

    public int startLine(int node) {
        return startLine[node];
    }

    public int endLine(int node) {
        return endLine[node];
    }

    /**
     * Render the subtree as an indented outline, mainly for debugging and tests.
     */
    public String dump(int node) {
        StringBuilder sb = new StringBuilder();
        dump(node, 0, sb);
        return sb.toString();
    }

    private void dump(int node, int depth, StringBuilder sb) {
        sb.append("  ".repeat(depth)).append(kinds[node].typeName());
        if (values[node] != null) {
            sb.append('(').append(values[node]).append(')');
        }
        sb.append('\n');
        for (int c = 0; c < childCount[node]; c++) {
            dump(firstChild[node] + c, depth + 1, sb);
        }
    }

    /**
     * Accumulates nodes in breadth-first order.
     * <p>
     * Usage: add the root, then for every node in index order add all of its
     * children in one go and record them with {@link #setChildren}. Processing
     * nodes in index order is what keeps every child range contiguous.
     */
    public static final class Builder {
        private final String fileId;
        private int size;
        private NodeKind[] kinds = new NodeKind[64];
        private String[] values = new String[64];
        private int[] firstChild = new int[64];
        private int[] childCount = new int[64];
        private int[] startOffset = new int[64];
        private int[] endOffset = new int[64];
        private int[] startLine = new int[64];
        private int[] endLine = new int[64];

        public Builder(String fileId) {
            this.fileId = fileId;
        }

        /**
         * Append a node and return its index.
         */
        public int add(NodeKind kind, @Nullable String value,
                       int fromOffset, int toOffset, int fromLine, int toLine) {
            ensureCapacity(size + 1);
            kinds[size] = kind;
            values[size] = value;
            firstChild[size] = 0;
            childCount[size] = 0;
            startOffset[size] = fromOffset;
            endOffset[size] = toOffset;
            startLine[size] = fromLine;
            endLine[size] = toLine;
            return size++;
        }

        /**
         * Record that {@code node}'s children are the {@code count} nodes starting at {@code first}.
         */
        public void setChildren(int node, int first, int count) {
            if (count > 0 && first + count > size) {
                throw new IllegalStateException("Child range exceeds the nodes added so far");
            }
            firstChild[node] = first;
            childCount[node] = count;
        }

        public int size() {
            return size;
        }

        public SyntaxTree build() {
            if (size == 0) {
                throw new IllegalStateException("A syntax tree needs at least a root node");
            }
            return new SyntaxTree(this);
        }

        private void ensureCapacity(int capacity) {
            if (capacity <= kinds.length) {
                return;
            }
            int newLength = Math.max(capacity, kinds.length * 2);
            kinds = Arrays.copyOf(kinds, newLength);
            values = Arrays.copyOf(values, newLength);
            firstChild = Arrays.copyOf(firstChild, newLength);
            childCount = Arrays.copyOf(childCount, newLength);
            startOffset = Arrays.copyOf(startOffset, newLength);
            endOffset = Arrays.copyOf(endOffset, newLength);
            startLine = Arrays.copyOf(startLine, newLength);
            endLine = Arrays.copyOf(endLine, newLength);
        }
    }
}
