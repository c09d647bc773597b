package com.raditha.cyclone.similarity;

import com.raditha.cyclone.model.EditOperation;
import com.raditha.cyclone.model.RoleToken;
import com.raditha.cyclone.normalization.NormalizedTree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Ordered tree edit distance between normalized trees (Zhang-Shasha).
 * <p>
 * Insertions and deletions cost 1. Relabelling costs 0 when kind and label
 * are equal, 0 for two identifier or literal leaves of the same kind whatever
 * their ordinals (a rename costs nothing), and 1 otherwise.
 * <p>
 * The distance table needs {@code |A| * |B|} cells. Comparisons above the
 * configured limit are refused with a {@link ResourceExhaustionException}
 * before anything is allocated.
 */
public class TreeEditDistance {

    private final long maxCells;

    /**
     * @param maxCells largest {@code |A| * |B|} a comparison may use
     */
    public TreeEditDistance(long maxCells) {
        if (maxCells < 1) {
            throw new IllegalArgumentException("maxCells must be >= 1");
        }
        this.maxCells = maxCells;
    }

    /**
     * Distance and, on request, the edit script.
     *
     * @param script empty unless requested
     */
    public record Result(int distance, List<EditOperation> script) {
    }

    /**
     * Compute the edit distance.
     *
     * @throws ResourceExhaustionException if the comparison exceeds the cell limit
     */
    public int distance(NormalizedTree a, NormalizedTree b) {
        return compute(a, b, false).distance();
    }

    /**
     * Compute the edit distance and optionally an edit script that realizes it.
     *
     * @throws ResourceExhaustionException if the comparison exceeds the cell limit
     */
    public Result compute(NormalizedTree a, NormalizedTree b, boolean withScript) {
        long cells = (long) a.size() * b.size();
        if (cells > maxCells) {
            throw new ResourceExhaustionException(cells, maxCells);
        }
        Comparison comparison = new Comparison(new Postorder(a), new Postorder(b));
        int distance = comparison.run();
        if (!withScript) {
            return new Result(distance, List.of());
        }
        List<EditOperation> script = new ArrayList<>();
        comparison.backtrace(a.size(), b.size(), script);
        Collections.reverse(script);
        return new Result(distance, List.copyOf(script));
    }

    /**
     * Convert a distance to a similarity score between 0.0 and 1.0.
     */
    public static double similarity(int distance, int sizeA, int sizeB) {
        int maxSize = Math.max(sizeA, sizeB);
        if (maxSize == 0) {
            return 1.0;
        }
        return 1.0 - ((double) distance / maxSize);
    }

    /**
     * Post-order view of a tree, 1-indexed as in the original algorithm.
     */
    private static final class Postorder {
        final NormalizedTree tree;
        final int[] nodes;
        final int[] leftmost;
        final int[] keyroots;

        Postorder(NormalizedTree tree) {
            this.tree = tree;
            int n = tree.size();
            this.nodes = new int[n + 1];
            this.leftmost = new int[n + 1];
            int[] postIndex = new int[n];

            // iterative post-order: (node, next child) frames
            Deque<int[]> stack = new ArrayDeque<>();
            stack.push(new int[]{0, 0});
            int counter = 0;
            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                int node = frame[0];
                if (frame[1] < tree.childCount(node)) {
                    stack.push(new int[]{tree.child(node, frame[1]++), 0});
                } else {
                    stack.pop();
                    counter++;
                    nodes[counter] = node;
                    postIndex[node] = counter;
                    leftmost[counter] = tree.childCount(node) == 0
                            ? counter
                            : leftmost[postIndex[tree.child(node, 0)]];
                }
            }

            // a keyroot is the highest node with a given leftmost leaf
            boolean[] seen = new boolean[n + 1];
            int[] roots = new int[n];
            int count = 0;
            for (int i = n; i >= 1; i--) {
                if (!seen[leftmost[i]]) {
                    seen[leftmost[i]] = true;
                    roots[count++] = i;
                }
            }
            this.keyroots = new int[count];
            for (int k = 0; k < count; k++) {
                keyroots[k] = roots[count - 1 - k];
            }
        }

        int size() {
            return nodes.length - 1;
        }
    }

    private static final class Comparison {
        private final Postorder a;
        private final Postorder b;
        private final int[][] treeDistance;
        private final int[][] forestDistance;

        Comparison(Postorder a, Postorder b) {
            this.a = a;
            this.b = b;
            this.treeDistance = new int[a.size() + 1][b.size() + 1];
            this.forestDistance = new int[a.size() + 1][b.size() + 1];
        }

        int run() {
            for (int i : a.keyroots) {
                for (int j : b.keyroots) {
                    fillForest(i, j);
                }
            }
            return treeDistance[a.size()][b.size()];
        }

        private void fillForest(int i, int j) {
            int[][] fd = forestDistance;
            int l1 = a.leftmost[i];
            int l2 = b.leftmost[j];
            // row and column l-1 stand for the empty forest
            fd[l1 - 1][l2 - 1] = 0;
            for (int x = l1; x <= i; x++) {
                fd[x][l2 - 1] = fd[x - 1][l2 - 1] + 1;
            }
            for (int y = l2; y <= j; y++) {
                fd[l1 - 1][y] = fd[l1 - 1][y - 1] + 1;
            }
            for (int x = l1; x <= i; x++) {
                for (int y = l2; y <= j; y++) {
                    int delete = fd[x - 1][y] + 1;
                    int insert = fd[x][y - 1] + 1;
                    if (a.leftmost[x] == l1 && b.leftmost[y] == l2) {
                        int relabel = fd[x - 1][y - 1] + relabelCost(x, y);
                        fd[x][y] = Math.min(Math.min(delete, insert), relabel);
                        treeDistance[x][y] = fd[x][y];
                    } else {
                        int subtrees = fd[a.leftmost[x] - 1][b.leftmost[y] - 1] + treeDistance[x][y];
                        fd[x][y] = Math.min(Math.min(delete, insert), subtrees);
                    }
                }
            }
        }

        private int relabelCost(int x, int y) {
            NormalizedTree ta = a.tree;
            NormalizedTree tb = b.tree;
            int na = a.nodes[x];
            int nb = b.nodes[y];
            if (ta.kind(na) != tb.kind(nb)) {
                return 1;
            }
            RoleToken tokenA = ta.roleToken(na);
            RoleToken tokenB = tb.roleToken(nb);
            if (tokenA != null || tokenB != null) {
                return tokenA != null && tokenB != null && tokenA.roleClass() == tokenB.roleClass() ? 0 : 1;
            }
            return Objects.equals(ta.label(na), tb.label(nb)) ? 0 : 1;
        }

        /**
         * Emit the edit operations of the subtree pair (i, j) in reverse order.
         * The forest table is rebuilt locally, reusing the final tree distances.
         */
        void backtrace(int i, int j, List<EditOperation> out) {
            int l1 = a.leftmost[i];
            int l2 = b.leftmost[j];
            int rows = i - l1 + 2;
            int cols = j - l2 + 2;
            int[][] fd = new int[rows][cols];
            for (int x = 1; x < rows; x++) {
                fd[x][0] = x;
            }
            for (int y = 1; y < cols; y++) {
                fd[0][y] = y;
            }
            for (int x = l1; x <= i; x++) {
                for (int y = l2; y <= j; y++) {
                    int fx = x - l1 + 1;
                    int fy = y - l2 + 1;
                    int best = Math.min(fd[fx - 1][fy], fd[fx][fy - 1]) + 1;
                    if (a.leftmost[x] == l1 && b.leftmost[y] == l2) {
                        best = Math.min(best, fd[fx - 1][fy - 1] + relabelCost(x, y));
                    } else {
                        best = Math.min(best, fd[a.leftmost[x] - l1][b.leftmost[y] - l2] + treeDistance[x][y]);
                    }
                    fd[fx][fy] = best;
                }
            }

            int x = i;
            int y = j;
            while (x >= l1 || y >= l2) {
                int fx = x - l1 + 1;
                int fy = y - l2 + 1;
                if (x >= l1 && y >= l2) {
                    if (a.leftmost[x] == l1 && b.leftmost[y] == l2) {
                        int cost = relabelCost(x, y);
                        if (fd[fx][fy] == fd[fx - 1][fy - 1] + cost) {
                            if (cost > 0) {
                                out.add(EditOperation.relabel(describe(a, x), describe(b, y), line(a, x), line(b, y)));
                            }
                            x--;
                            y--;
                            continue;
                        }
                    } else if (fd[fx][fy] == fd[a.leftmost[x] - l1][b.leftmost[y] - l2] + treeDistance[x][y]) {
                        backtrace(x, y, out);
                        x = a.leftmost[x] - 1;
                        y = b.leftmost[y] - 1;
                        continue;
                    }
                }
                if (x >= l1 && fd[fx][fy] == fd[fx - 1][fy] + 1) {
                    out.add(EditOperation.delete(describe(a, x), line(a, x)));
                    x--;
                } else {
                    out.add(EditOperation.insert(describe(b, y), line(b, y)));
                    y--;
                }
            }
        }

        private static String describe(Postorder side, int postIndex) {
            NormalizedTree tree = side.tree;
            int node = side.nodes[postIndex];
            String value = tree.originalValue(node);
            if (value != null) {
                return tree.kind(node).typeName() + " '" + value + "'";
            }
            return tree.displayLabel(node);
        }

        private static int line(Postorder side, int postIndex) {
            return side.tree.line(side.nodes[postIndex]);
        }
    }
}
