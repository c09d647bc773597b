package com.raditha.cyclone.normalization;

import com.raditha.cyclone.model.RoleToken;
import com.raditha.cyclone.parser.NodeKind;
import com.raditha.cyclone.parser.SyntaxTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.raditha.cyclone.TreeFixtures.all;
import static com.raditha.cyclone.TreeFixtures.canonical;
import static com.raditha.cyclone.TreeFixtures.first;
import static com.raditha.cyclone.TreeFixtures.method;
import static com.raditha.cyclone.TreeFixtures.parse;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TreeNormalizer.
 */
class TreeNormalizerTest {

    private TreeNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new TreeNormalizer();
    }

    @Test
    void testCanonicalizeRemovesNameExpressions() {
        SyntaxTree parsed = parse("""
                class A {
                    int add(int a, int b) {
                        return a + b;
                    }
                }
                """);
        SyntaxTree tree = normalizer.canonicalize(parsed);

        assertFalse(all(parsed, NodeKind.NAME_EXPR).isEmpty());
        assertTrue(all(tree, NodeKind.NAME_EXPR).isEmpty());
        assertEquals(14, tree.subtreeSize(first(tree, NodeKind.METHOD_DECLARATION)));

        int binary = first(tree, NodeKind.BINARY_EXPR);
        assertEquals(NodeKind.IDENTIFIER, tree.kind(tree.child(binary, 0)));
        assertEquals("a", tree.value(tree.child(binary, 0)));
        assertEquals("b", tree.value(tree.child(binary, 1)));
    }

    @Test
    void testCanonicalizeRemovesParentheses() {
        NormalizedTree plain = method("int g(int x) { return x * 2; }");
        NormalizedTree wrapped = method("int g(int x) { return ((x) * (2)); }");

        assertTrue(plain.structurallyEquals(wrapped));
        assertTrue(all(canonical("class T { int g(int x) { return ((x)); } }"), NodeKind.ENCLOSED_EXPR).isEmpty());
    }

    @Test
    void testCanonicalizeDropsEmptyStatements() {
        NormalizedTree plain = method("void f() { a(); }");
        NormalizedTree padded = method("void f() { ; a(); ;; }");

        assertTrue(plain.structurallyEquals(padded));
        assertEquals(7, plain.size());
    }

    @Test
    void testCanonicalizeKeepsSpans() {
        String code = "class A {\n    int f() { return (1); }\n}\n";
        SyntaxTree tree = canonical(code);
        int method = first(tree, NodeKind.METHOD_DECLARATION);

        assertEquals("int f() { return (1); }", code.substring(tree.startOffset(method), tree.endOffset(method)));
        assertEquals(2, tree.startLine(method));
    }

    @Test
    void testConsistentRenameGivesEqualTrees() {
        NormalizedTree original = method("void f() { total = total + price * 2; }");
        NormalizedTree renamed = method("void g() { sum = sum + cost * 2; }");

        assertTrue(original.structurallyEquals(renamed));
        assertEquals(original.dump(), renamed.dump());
    }

    @Test
    void testRoleTokensNumberedByFirstOccurrence() {
        NormalizedTree tree = method("void f() { total = total + price * 2; }");

        List<RoleToken> tokens = new ArrayList<>();
        List<String> values = new ArrayList<>();
        collectPreorder(tree, 0, tokens, values);

        assertEquals(List.of("f", "total", "total", "price", "2"), values);
        assertEquals(new RoleToken(RoleToken.RoleClass.IDENTIFIER, 0), tokens.get(0));
        assertEquals(new RoleToken(RoleToken.RoleClass.IDENTIFIER, 1), tokens.get(1));
        assertEquals(new RoleToken(RoleToken.RoleClass.IDENTIFIER, 1), tokens.get(2));
        assertEquals(new RoleToken(RoleToken.RoleClass.IDENTIFIER, 2), tokens.get(3));
        assertEquals(new RoleToken(RoleToken.RoleClass.LITERAL, 0), tokens.get(4));
    }

    private static void collectPreorder(NormalizedTree tree, int node, List<RoleToken> tokens, List<String> values) {
        if (tree.roleToken(node) != null) {
            tokens.add(tree.roleToken(node));
            values.add(tree.originalValue(node));
        }
        for (int k = 0; k < tree.childCount(node); k++) {
            collectPreorder(tree, tree.child(node, k), tokens, values);
        }
    }

    @Test
    void testInconsistentRenameDiffers() {
        NormalizedTree original = method("void f() { a = b + a; }");
        NormalizedTree swapped = method("void f() { a = b + b; }");

        assertFalse(original.structurallyEquals(swapped));
    }

    @Test
    void testIdentifiersAndLiteralsNumberedSeparately() {
        NormalizedTree tree = method("int f() { return 7; }");
        int literal = -1;
        for (int i = 0; i < tree.size(); i++) {
            if (tree.kind(i) == NodeKind.INTEGER_LITERAL) {
                literal = i;
            }
        }

        assertEquals("IntegerLiteralExpr[LIT#0]", tree.displayLabel(literal));
        assertEquals("7", tree.originalValue(literal));
        assertNull(tree.label(literal));
    }

    @Test
    void testRoleTokensScopedToPattern() {
        SyntaxTree tree = canonical("""
                class A {
                    void outer() {
                        for (int i = 0; i < 3; i++) {
                            work(i);
                        }
                    }
                }
                """);
        NormalizedTree loop = normalizer.normalize(tree, first(tree, NodeKind.FOR_STMT), 20);
        NormalizedTree outer = normalizer.normalize(tree, first(tree, NodeKind.METHOD_DECLARATION), 20);

        // 'i' is the first identifier of the loop but not of the method
        int loopVariable = firstIdentifier(loop, "i");
        int methodVariable = firstIdentifier(outer, "i");
        assertEquals(0, loop.roleToken(loopVariable).ordinal());
        assertEquals(1, outer.roleToken(methodVariable).ordinal());
    }

    private static int firstIdentifier(NormalizedTree tree, String value) {
        for (int i = 0; i < tree.size(); i++) {
            if (value.equals(tree.originalValue(i))) {
                return i;
            }
        }
        throw new AssertionError(value + " not found in\n" + tree.dump());
    }

    @Test
    void testLabelsKeepOperatorsAndTypes() {
        NormalizedTree plus = method("int f(int a) { return a + 1; }");
        NormalizedTree minus = method("int f(int a) { return a - 1; }");
        NormalizedTree longType = method("long f(long a) { return a + 1; }");

        assertFalse(plus.structurallyEquals(minus));
        assertFalse(plus.structurallyEquals(longType));
        assertTrue(plus.dump().contains("BinaryExpr(PLUS)"));
    }

    @Test
    void testDepthTruncation() {
        SyntaxTree tree = canonical("class T { void f() { a(); } }");
        int method = first(tree, NodeKind.METHOD_DECLARATION);

        NormalizedTree full = normalizer.normalize(tree, method, 10);
        NormalizedTree capped = normalizer.normalize(tree, method, 1);

        assertFalse(full.isTruncated());
        assertEquals(7, full.size());
        assertTrue(capped.isTruncated());
        // method, void, f, block, sentinel
        assertEquals(5, capped.size());
        int block = capped.child(0, 2);
        assertEquals(NodeKind.BLOCK_STMT, capped.kind(block));
        assertEquals(1, capped.childCount(block));
        int sentinel = capped.child(block, 0);
        assertEquals(NodeKind.TRUNCATED, capped.kind(sentinel));
        assertEquals(-1, capped.sourceNode(sentinel));
        assertEquals(0, capped.line(sentinel));
    }

    @Test
    void testLeavesAtDepthCapAreNotTruncated() {
        SyntaxTree tree = canonical("class T { void f() { } }");
        NormalizedTree capped = normalizer.normalize(tree, first(tree, NodeKind.METHOD_DECLARATION), 1);

        assertFalse(capped.isTruncated());
        assertEquals(4, capped.size());
    }

    @Test
    void testNormalizeIsDeterministic() {
        SyntaxTree tree = canonical("""
                class T {
                    int sum(int[] values) {
                        int s = 0;
                        for (int v : values) { s += v; }
                        return s;
                    }
                }
                """);
        int anchor = first(tree, NodeKind.METHOD_DECLARATION);

        NormalizedTree first = normalizer.normalize(tree, anchor, 12);
        NormalizedTree second = normalizer.normalize(tree, anchor, 12);

        assertTrue(first.structurallyEquals(second));
        assertEquals(first.dump(), second.dump());
    }

    @Test
    void testNodesMapBackToSource() {
        String code = "class T {\n  int f() {\n    return 1;\n  }\n}\n";
        SyntaxTree tree = canonical(code);
        NormalizedTree normalized = normalizer.normalize(tree, first(tree, NodeKind.METHOD_DECLARATION), 10);

        assertEquals(2, normalized.line(0));
        assertSame(tree, normalized.source());
        int returnStmt = normalized.child(normalized.child(0, 2), 0);
        assertEquals(NodeKind.RETURN_STMT, normalized.kind(returnStmt));
        assertEquals(3, normalized.line(returnStmt));
    }
}
