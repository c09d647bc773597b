package com.raditha.cyclone.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SourceSpan and SourceRepository.
 */
class SourceSpanTest {

    private final SourceSpan outer = new SourceSpan("A.java", 10, 100, 2, 9);
    private final SourceSpan inner = new SourceSpan("A.java", 20, 40, 3, 4);

    @Test
    void testContainmentAndOverlap() {
        assertTrue(outer.contains(inner));
        assertFalse(inner.contains(outer));
        assertTrue(outer.overlaps(inner));
        assertTrue(inner.overlaps(outer));
    }

    @Test
    void testAdjacentSpansDoNotOverlap() {
        SourceSpan next = new SourceSpan("A.java", 100, 120, 9, 10);

        assertFalse(outer.overlaps(next));
        assertFalse(new SourceSpan("B.java", 20, 40, 3, 4).overlaps(outer));
    }

    @Test
    void testUnion() {
        SourceSpan other = new SourceSpan("A.java", 90, 150, 8, 12);

        SourceSpan union = outer.union(other);

        assertEquals(new SourceSpan("A.java", 10, 150, 2, 12), union);
        assertEquals(140, union.length());
        assertEquals(11, union.getLineCount());
        assertThrows(IllegalArgumentException.class,
                () -> outer.union(new SourceSpan("B.java", 0, 5, 1, 1)));
    }

    @Test
    void testDisplay() {
        assertEquals("A.java:L2-9", outer.toString());
        assertEquals("L3", new SourceSpan("A.java", 0, 5, 3, 3).toDisplayString());
    }

    @Test
    void testRepositoryIsSortedAndCopied() {
        Map<String, String> files = new HashMap<>();
        files.put("b/Z.java", "class Z {}");
        files.put("a/Y.java", "class Y {}");

        SourceRepository repo = new SourceRepository("r", files);
        files.put("c/X.java", "class X {}");

        assertEquals(List.of("a/Y.java", "b/Z.java"), List.copyOf(repo.files().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> repo.files().put("d.java", ""));
        assertThrows(IllegalArgumentException.class, () -> new SourceRepository(" ", Map.of()));
        assertEquals(0, new SourceRepository("r", null).fileCount());
    }
}
