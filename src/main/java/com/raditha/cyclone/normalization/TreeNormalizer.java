package com.raditha.cyclone.normalization;

import com.raditha.cyclone.model.RoleToken;
import com.raditha.cyclone.parser.NodeKind;
import com.raditha.cyclone.parser.SyntaxTree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes syntax trees for clone comparison.
 * <p>
 * Normalization happens in two steps:
 * <ol>
 * <li>{@link #canonicalize} prunes the whole file once: redundant grouping
 * (parentheses, name wrappers) is replaced by its children and nodes without
 * structural meaning (empty statements) are dropped.</li>
 * <li>{@link #normalize} runs once per pattern: it copies the anchor's subtree
 * up to the depth cap and replaces identifier and literal values by role
 * tokens numbered within that pattern only.</li>
 * </ol>
 * Example: {@code total = total + (price * 2);} and
 * {@code sum = sum + cost * 3;} normalize identically:
 * {@code ID#0 = ID#0 + ID#1 * LIT#0}.
 * <p>
 * Both operations are pure functions of their input.
 */
public class TreeNormalizer {

    /**
     * Remove transparent and cosmetic nodes from a parsed tree.
     *
     * @param tree tree as produced by the parser
     * @return a new tree of the same file in canonical form
     */
    public SyntaxTree canonicalize(SyntaxTree tree) {
        SyntaxTree.Builder builder = new SyntaxTree.Builder(tree.fileId());
        // pending.get(i) is the original node behind new node i
        List<Integer> pending = new ArrayList<>();
        pending.add(SyntaxTree.ROOT);
        copyNode(builder, tree, SyntaxTree.ROOT);

        List<Integer> children = new ArrayList<>();
        for (int next = 0; next < pending.size(); next++) {
            int original = pending.get(next);
            children.clear();
            collectEffectiveChildren(tree, original, children);

            int first = builder.size();
            for (int child : children) {
                copyNode(builder, tree, child);
                pending.add(child);
            }
            builder.setChildren(next, first, children.size());
        }
        return builder.build();
    }

    private void collectEffectiveChildren(SyntaxTree tree, int node, List<Integer> out) {
        for (int k = 0; k < tree.childCount(node); k++) {
            int child = tree.child(node, k);
            switch (tree.kind(child).category()) {
                case TRANSPARENT -> collectEffectiveChildren(tree, child, out);
                case COSMETIC -> {
                    // dropped
                }
                default -> out.add(child);
            }
        }
    }

    private void copyNode(SyntaxTree.Builder builder, SyntaxTree tree, int node) {
        builder.add(tree.kind(node), tree.value(node),
                tree.startOffset(node), tree.endOffset(node),
                tree.startLine(node), tree.endLine(node));
    }

    /**
     * Build the normalized form of the subtree rooted at {@code anchor}.
     *
     * @param canonical tree returned by {@link #canonicalize}
     * @param anchor    root node of the pattern
     * @param maxDepth  deepest relative depth kept; the children of nodes at this
     *                  depth are replaced by a single truncation sentinel
     * @return the pattern's normalized tree
     */
    public NormalizedTree normalize(SyntaxTree canonical, int anchor, int maxDepth) {
        int capacity = canonical.subtreeSize(anchor);
        NodeKind[] kinds = new NodeKind[capacity];
        String[] labels = new String[capacity];
        int[] sourceNodes = new int[capacity];
        int[] depths = new int[capacity];
        int[] firstChild = new int[capacity];
        int[] childCount = new int[capacity];
        boolean truncated = false;

        int size = 0;
        kinds[size] = canonical.kind(anchor);
        labels[size] = labelOf(canonical, anchor);
        sourceNodes[size] = anchor;
        depths[size] = 0;
        size++;

        for (int next = 0; next < size; next++) {
            int original = sourceNodes[next];
            if (original < 0 || canonical.childCount(original) == 0) {
                continue;
            }
            int first = size;
            if (depths[next] >= maxDepth) {
                kinds[size] = NodeKind.TRUNCATED;
                sourceNodes[size] = -1;
                depths[size] = depths[next] + 1;
                size++;
                truncated = true;
            } else {
                for (int k = 0; k < canonical.childCount(original); k++) {
                    int child = canonical.child(original, k);
                    kinds[size] = canonical.kind(child);
                    labels[size] = labelOf(canonical, child);
                    sourceNodes[size] = child;
                    depths[size] = depths[next] + 1;
                    size++;
                }
            }
            firstChild[next] = first;
            childCount[next] = size - first;
        }

        kinds = Arrays.copyOf(kinds, size);
        labels = Arrays.copyOf(labels, size);
        sourceNodes = Arrays.copyOf(sourceNodes, size);
        firstChild = Arrays.copyOf(firstChild, size);
        childCount = Arrays.copyOf(childCount, size);

        RoleToken[] roleTokens = assignRoleTokens(canonical, kinds, sourceNodes, firstChild, childCount);
        return new NormalizedTree(canonical, kinds, labels, roleTokens, sourceNodes,
                firstChild, childCount, truncated);
    }

    private static String labelOf(SyntaxTree tree, int node) {
        return tree.kind(node).isRoleLeaf() ? null : tree.value(node);
    }

    /**
     * Number identifier and literal values by first occurrence in depth-first
     * pre-order, separately for each role class.
     */
    private RoleToken[] assignRoleTokens(SyntaxTree canonical, NodeKind[] kinds, int[] sourceNodes,
                                         int[] firstChild, int[] childCount) {
        RoleToken[] tokens = new RoleToken[kinds.length];
        Map<String, Integer> identifiers = new HashMap<>();
        Map<String, Integer> literals = new HashMap<>();

        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(0);
        while (!stack.isEmpty()) {
            int node = stack.pop();
            NodeKind kind = kinds[node];
            if (kind.isRoleLeaf()) {
                String value = String.valueOf(canonical.value(sourceNodes[node]));
                if (kind.category() == NodeKind.Category.IDENTIFIER) {
                    int ordinal = identifiers.computeIfAbsent(value, v -> identifiers.size());
                    tokens[node] = new RoleToken(RoleToken.RoleClass.IDENTIFIER, ordinal);
                } else {
                    int ordinal = literals.computeIfAbsent(value, v -> literals.size());
                    tokens[node] = new RoleToken(RoleToken.RoleClass.LITERAL, ordinal);
                }
            }
            for (int k = childCount[node] - 1; k >= 0; k--) {
                stack.push(firstChild[node] + k);
            }
        }
        return tokens;
    }
}
