package com.raditha.cyclone.extraction;

import com.raditha.cyclone.config.CloneDetectionConfig;
import com.raditha.cyclone.index.SizeBands;
import com.raditha.cyclone.model.Pattern;
import com.raditha.cyclone.model.UnmatchedPattern;
import com.raditha.cyclone.parser.NodeKind;
import com.raditha.cyclone.parser.SyntaxTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.raditha.cyclone.TreeFixtures.canonical;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PatternExtractor.
 */
class PatternExtractorTest {

    private static final String CODE = """
            class Totals {
                int sum(int[] values, int n) {
                    int sum = 0;
                    for (int i = 0; i < n; i++) {
                        sum += values[i];
                    }
                    return sum;
                }

                void tiny() { }
            }
            """;

    private CloneDetectionConfig config;
    private SyntaxTree tree;

    @BeforeEach
    void setUp() {
        config = CloneDetectionConfig.moderate();
        tree = canonical(CODE);
    }

    @Test
    void testNestedAnchorsInPreorder() {
        ExtractionResult result = new PatternExtractor(config).extract("repo", tree);

        List<NodeKind> kinds = result.patterns().stream().map(Pattern::rootKind).toList();
        assertEquals(List.of(
                NodeKind.CLASS_OR_INTERFACE_DECLARATION,
                NodeKind.METHOD_DECLARATION,
                NodeKind.FOR_STMT), kinds);
        assertTrue(result.unmatched().isEmpty());
    }

    @Test
    void testPatternsBelowMinimumAreSkipped() {
        // 'tiny' has four nodes, well under the default minimum
        ExtractionResult result = new PatternExtractor(config).extract("repo", tree);

        assertTrue(result.patterns().stream().noneMatch(p -> p.span().startLine() == 10));
        for (Pattern pattern : result.patterns()) {
            assertTrue(pattern.size() >= config.minPatternNodes());
        }
    }

    @Test
    void testMinimumOfOneKeepsEveryAnchor() {
        ExtractionResult result = new PatternExtractor(config.withPatternBounds(1, 12)).extract("repo", tree);

        assertEquals(4, result.patterns().size());
        Pattern tiny = result.patterns().get(3);
        assertEquals(NodeKind.METHOD_DECLARATION, tiny.rootKind());
        assertEquals(4, tiny.size());
        assertEquals(10, tiny.span().startLine());
    }

    @Test
    void testPatternFields() {
        ExtractionResult result = new PatternExtractor(config).extract("repo", tree);
        Pattern method = result.patterns().get(1);

        assertEquals("repo", method.repositoryId());
        assertEquals("Test.java", method.fileId());
        assertEquals(2, method.span().startLine());
        assertEquals(8, method.span().endLine());
        assertEquals(method.tree().size(), method.size());
        assertFalse(method.truncated());
        assertEquals(NodeKind.METHOD_DECLARATION, method.bucketKey().rootKind());
        assertEquals(5, method.bucketKey().childCount());
        assertEquals(new SizeBands(config.similarityThreshold()).bandOf(method.size()),
                method.bucketKey().sizeBand());
    }

    @Test
    void testLoopPatternSize() {
        PatternExtractor extractor = new PatternExtractor(config.withAnchorKinds(Set.of(NodeKind.FOR_STMT)));
        ExtractionResult result = extractor.extract("repo", tree);

        assertEquals(1, result.patterns().size());
        // for, init (5), compare (3), update (2), body (7)
        assertEquals(18, result.patterns().get(0).size());
    }

    @Test
    void testOversizedPatternsAreReported() {
        CloneDetectionConfig small = config
                .withAnchorKinds(Set.of(NodeKind.METHOD_DECLARATION, NodeKind.FOR_STMT))
                .withResourceLimits(10, config.maxComparisonCells());
        ExtractionResult result = new PatternExtractor(small).extract("repo", tree);

        assertTrue(result.patterns().isEmpty());
        assertEquals(2, result.unmatched().size());
        UnmatchedPattern method = result.unmatched().get(0);
        assertEquals("repo", method.repositoryId());
        assertEquals(2, method.span().startLine());
        assertTrue(method.size() > 10);
        assertEquals("pattern exceeds 10 nodes", method.reason());
    }

    @Test
    void testDepthCapTruncatesPatterns() {
        PatternExtractor extractor = new PatternExtractor(config
                .withAnchorKinds(Set.of(NodeKind.METHOD_DECLARATION))
                .withPatternBounds(4, 2));
        ExtractionResult result = extractor.extract("repo", tree);

        Pattern method = result.patterns().get(0);
        assertTrue(method.truncated());
        assertTrue(method.size() < tree.subtreeSize(method.tree().sourceNode(0)));
    }

    @Test
    void testNoAnchorsInFile() {
        SyntaxTree imports = canonical("import java.util.List;\n");
        ExtractionResult result = new PatternExtractor(config).extract("repo", imports);

        assertTrue(result.patterns().isEmpty());
        assertTrue(result.unmatched().isEmpty());
    }
}
