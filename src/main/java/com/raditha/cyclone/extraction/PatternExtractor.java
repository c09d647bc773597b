package com.raditha.cyclone.extraction;

import com.raditha.cyclone.config.CloneDetectionConfig;
import com.raditha.cyclone.index.SizeBands;
import com.raditha.cyclone.index.StructuralHasher;
import com.raditha.cyclone.model.BucketKey;
import com.raditha.cyclone.model.Pattern;
import com.raditha.cyclone.model.UnmatchedPattern;
import com.raditha.cyclone.normalization.NormalizedTree;
import com.raditha.cyclone.normalization.TreeNormalizer;
import com.raditha.cyclone.parser.NodeKind;
import com.raditha.cyclone.parser.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Extracts tree patterns from canonical syntax trees.
 * <p>
 * Every node whose kind is in the configured anchor set yields a candidate
 * pattern. Anchors may nest: a loop inside a method produces a pattern of its
 * own besides being part of the method's pattern, since a clone may exist at
 * either granularity. Each pattern is normalized separately, so role tokens
 * are numbered within the pattern.
 */
public class PatternExtractor {

    private static final Logger logger = LoggerFactory.getLogger(PatternExtractor.class);

    private final Set<NodeKind> anchorKinds;
    private final int minPatternNodes;
    private final int maxPatternNodes;
    private final int maxPatternDepth;
    private final SizeBands sizeBands;
    private final TreeNormalizer normalizer;

    public PatternExtractor(CloneDetectionConfig config) {
        this(config, new TreeNormalizer());
    }

    public PatternExtractor(CloneDetectionConfig config, TreeNormalizer normalizer) {
        this.anchorKinds = config.anchorKinds();
        this.minPatternNodes = config.minPatternNodes();
        this.maxPatternNodes = config.maxPatternNodes();
        this.maxPatternDepth = config.maxPatternDepth();
        this.sizeBands = new SizeBands(config.similarityThreshold());
        this.normalizer = normalizer;
    }

    /**
     * Extract all patterns of a file.
     *
     * @param repositoryId repository recorded in each pattern
     * @param canonical    tree returned by {@link TreeNormalizer#canonicalize}
     * @return patterns in anchor pre-order, and the patterns rejected as too large
     */
    public ExtractionResult extract(String repositoryId, SyntaxTree canonical) {
        List<Pattern> patterns = new ArrayList<>();
        List<UnmatchedPattern> unmatched = new ArrayList<>();

        for (int anchor : findAnchors(canonical)) {
            // truncation never grows a subtree, so small anchors can be skipped early
            if (canonical.subtreeSize(anchor) < minPatternNodes) {
                continue;
            }
            NormalizedTree tree = normalizer.normalize(canonical, anchor, maxPatternDepth);
            if (tree.size() < minPatternNodes) {
                continue;
            }
            if (tree.size() > maxPatternNodes) {
                logger.warn("Pattern at {} has {} nodes after truncation (limit {}), not indexed",
                        canonical.span(anchor), tree.size(), maxPatternNodes);
                unmatched.add(new UnmatchedPattern(repositoryId, canonical.span(anchor), tree.size(),
                        "pattern exceeds " + maxPatternNodes + " nodes"));
                continue;
            }
            patterns.add(toPattern(repositoryId, canonical, anchor, tree));
        }

        logger.debug("Extracted {} patterns from {}/{}", patterns.size(), repositoryId, canonical.fileId());
        return new ExtractionResult(patterns, unmatched);
    }

    private Pattern toPattern(String repositoryId, SyntaxTree canonical, int anchor, NormalizedTree tree) {
        BucketKey key = new BucketKey(sizeBands.bandOf(tree.size()), tree.kind(0), tree.childCount(0));
        return new Pattern(
                repositoryId,
                canonical.span(anchor),
                tree,
                StructuralHasher.fingerprint(tree),
                StructuralHasher.literalFingerprint(tree),
                tree.size(),
                key);
    }

    /**
     * Anchor nodes in depth-first pre-order.
     */
    private List<Integer> findAnchors(SyntaxTree tree) {
        List<Integer> anchors = new ArrayList<>();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(SyntaxTree.ROOT);
        while (!stack.isEmpty()) {
            int node = stack.pop();
            if (anchorKinds.contains(tree.kind(node))) {
                anchors.add(node);
            }
            for (int k = tree.childCount(node) - 1; k >= 0; k--) {
                stack.push(tree.child(node, k));
            }
        }
        return anchors;
    }
}
