package com.raditha.cyclone.config;

import com.raditha.cyclone.parser.NodeKind;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration for clone detection.
 * Defines pattern bounds, the approximate matching tolerance and resource guards.
 *
 * @param language            Grammar used to parse both repositories
 * @param minPatternNodes     Minimum normalized node count of a pattern
 * @param maxPatternDepth     Deepest relative depth kept below an anchor
 * @param maxPatternNodes     Patterns larger than this after truncation are not indexed
 * @param similarityThreshold Minimum Type 3 similarity to report (0.0-1.0)
 * @param topK                Maximum Type 3 pairs kept per pattern
 * @param anchorKinds         Node kinds at which patterns are extracted
 * @param exhaustive          Run the approximate pass even after an exact hit
 * @param verifyExactMatches  Confirm fingerprint hits with a structural equality walk
 * @param maxComparisonCells  Largest edit distance table a single comparison may allocate
 * @param parallelism         Worker threads used by a detection run
 * @param excludePatterns     File patterns to exclude when collecting sources (glob format)
 */
public record CloneDetectionConfig(
        Language language,
        int minPatternNodes,
        int maxPatternDepth,
        int maxPatternNodes,
        double similarityThreshold,
        int topK,
        Set<NodeKind> anchorKinds,
        boolean exhaustive,
        boolean verifyExactMatches,
        long maxComparisonCells,
        int parallelism,
        List<String> excludePatterns) {

    /**
     * Validate configuration.
     */
    public CloneDetectionConfig {
        if (language == null) {
            throw new ConfigurationException("language cannot be null");
        }
        if (minPatternNodes < 1) {
            throw new ConfigurationException("minPatternNodes must be >= 1");
        }
        if (maxPatternDepth < 1) {
            throw new ConfigurationException("maxPatternDepth must be >= 1");
        }
        if (maxPatternNodes < minPatternNodes) {
            throw new ConfigurationException("maxPatternNodes must be >= minPatternNodes");
        }
        if (Double.isNaN(similarityThreshold) || similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new ConfigurationException("similarityThreshold must be between 0.0 and 1.0");
        }
        if (topK < 1) {
            throw new ConfigurationException("topK must be >= 1");
        }
        if (anchorKinds == null || anchorKinds.isEmpty()) {
            throw new ConfigurationException("anchorKinds cannot be empty");
        }
        if (anchorKinds.contains(NodeKind.TRUNCATED) || anchorKinds.stream().anyMatch(NodeKind::isRoleLeaf)) {
            throw new ConfigurationException("anchorKinds may only contain structural kinds");
        }
        if (maxComparisonCells < 1) {
            throw new ConfigurationException("maxComparisonCells must be >= 1");
        }
        if (parallelism < 1) {
            throw new ConfigurationException("parallelism must be >= 1");
        }
        anchorKinds = Collections.unmodifiableSet(EnumSet.copyOf(anchorKinds));
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
    }

    /**
     * Moderate preset: balanced detection (70% threshold, 8 node patterns).
     * Good default for most comparisons.
     */
    public static CloneDetectionConfig moderate() {
        return new CloneDetectionConfig(
                Language.JAVA,
                8, // minPatternNodes
                12, // maxPatternDepth
                1500, // maxPatternNodes
                0.70, // similarityThreshold
                5, // topK
                defaultAnchorKinds(),
                false, // exhaustive
                false, // verifyExactMatches
                4_000_000L, // maxComparisonCells
                defaultParallelism(),
                defaultExcludePatterns());
    }

    /**
     * Strict preset: larger patterns and a high threshold.
     * Reports only close copies of substantial code.
     */
    public static CloneDetectionConfig strict() {
        return new CloneDetectionConfig(
                Language.JAVA,
                20, // minPatternNodes
                12, // maxPatternDepth
                1500, // maxPatternNodes
                0.85, // similarityThreshold
                3, // topK
                defaultAnchorKinds(),
                false, // exhaustive
                true, // verifyExactMatches
                4_000_000L, // maxComparisonCells
                defaultParallelism(),
                defaultExcludePatterns());
    }

    /**
     * Lenient preset: small patterns and a low threshold.
     * Finds more near-miss copies at the cost of more noise.
     */
    public static CloneDetectionConfig lenient() {
        return new CloneDetectionConfig(
                Language.JAVA,
                6, // minPatternNodes
                16, // maxPatternDepth
                2500, // maxPatternNodes
                0.60, // similarityThreshold
                10, // topK
                defaultAnchorKinds(),
                true, // exhaustive
                false, // verifyExactMatches
                9_000_000L, // maxComparisonCells
                defaultParallelism(),
                defaultExcludePatterns());
    }

    /**
     * Look up a preset by name.
     *
     * @throws ConfigurationException for unknown names
     */
    public static CloneDetectionConfig preset(String name) {
        return switch (name.trim().toLowerCase()) {
            case "strict" -> strict();
            case "lenient" -> lenient();
            case "moderate" -> moderate();
            default -> throw new ConfigurationException("Unknown preset: " + name);
        };
    }

    /**
     * Method, constructor and initializer bodies, lambdas, loops, conditionals,
     * switch, try and synchronized statements, and type declarations.
     */
    public static Set<NodeKind> defaultAnchorKinds() {
        return EnumSet.of(
                NodeKind.METHOD_DECLARATION,
                NodeKind.CONSTRUCTOR_DECLARATION,
                NodeKind.COMPACT_CONSTRUCTOR_DECLARATION,
                NodeKind.INITIALIZER_DECLARATION,
                NodeKind.LAMBDA_EXPR,
                NodeKind.FOR_STMT,
                NodeKind.FOR_EACH_STMT,
                NodeKind.WHILE_STMT,
                NodeKind.DO_STMT,
                NodeKind.IF_STMT,
                NodeKind.SWITCH_STMT,
                NodeKind.TRY_STMT,
                NodeKind.SYNCHRONIZED_STMT,
                NodeKind.CLASS_OR_INTERFACE_DECLARATION,
                NodeKind.ENUM_DECLARATION,
                NodeKind.RECORD_DECLARATION,
                NodeKind.ANNOTATION_DECLARATION);
    }

    /**
     * Default file exclusion patterns.
     */
    static List<String> defaultExcludePatterns() {
        return List.of(
                "**/target/**",
                "**/build/**",
                "**/generated/**",
                "**/.git/**");
    }

    private static int defaultParallelism() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public CloneDetectionConfig withSimilarityThreshold(double threshold) {
        return new CloneDetectionConfig(language, minPatternNodes, maxPatternDepth, maxPatternNodes,
                threshold, topK, anchorKinds, exhaustive, verifyExactMatches, maxComparisonCells,
                parallelism, excludePatterns);
    }

    public CloneDetectionConfig withPatternBounds(int minNodes, int maxDepth) {
        return new CloneDetectionConfig(language, minNodes, maxDepth, Math.max(maxPatternNodes, minNodes),
                similarityThreshold, topK, anchorKinds, exhaustive, verifyExactMatches, maxComparisonCells,
                parallelism, excludePatterns);
    }

    public CloneDetectionConfig withAnchorKinds(Set<NodeKind> kinds) {
        return new CloneDetectionConfig(language, minPatternNodes, maxPatternDepth, maxPatternNodes,
                similarityThreshold, topK, kinds, exhaustive, verifyExactMatches, maxComparisonCells,
                parallelism, excludePatterns);
    }

    public CloneDetectionConfig withTopK(int k) {
        return new CloneDetectionConfig(language, minPatternNodes, maxPatternDepth, maxPatternNodes,
                similarityThreshold, k, anchorKinds, exhaustive, verifyExactMatches, maxComparisonCells,
                parallelism, excludePatterns);
    }

    public CloneDetectionConfig withExhaustive(boolean exhaustiveMode) {
        return new CloneDetectionConfig(language, minPatternNodes, maxPatternDepth, maxPatternNodes,
                similarityThreshold, topK, anchorKinds, exhaustiveMode, verifyExactMatches, maxComparisonCells,
                parallelism, excludePatterns);
    }

    public CloneDetectionConfig withResourceLimits(int maxNodes, long maxCells) {
        return new CloneDetectionConfig(language, minPatternNodes, maxPatternDepth, maxNodes,
                similarityThreshold, topK, anchorKinds, exhaustive, verifyExactMatches, maxCells,
                parallelism, excludePatterns);
    }

    public CloneDetectionConfig withParallelism(int threads) {
        return new CloneDetectionConfig(language, minPatternNodes, maxPatternDepth, maxPatternNodes,
                similarityThreshold, topK, anchorKinds, exhaustive, verifyExactMatches, maxComparisonCells,
                threads, excludePatterns);
    }

    /**
     * Check if a file path matches any exclusion pattern.
     */
    public boolean shouldExclude(String filePath) {
        for (String pattern : excludePatterns) {
            if (matchesGlobPattern(filePath, pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Glob matching with {@code **} (any characters) and {@code *} (any
     * characters except '/'). A leading {@code ** /} also matches at the root.
     */
    private static boolean matchesGlobPattern(String path, String pattern) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        if (pattern.startsWith("**/")) {
            regex.append("(?:.*/)?");
            i = 3;
        }
        for (; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '*') {
                if (i + 1 < pattern.length() && pattern.charAt(i + 1) == '*') {
                    regex.append(".*");
                    i++;
                } else {
                    regex.append("[^/]*");
                }
            } else if (c == '?') {
                regex.append("[^/]");
            } else if ("\\.[]{}()+-^$|".indexOf(c) >= 0) {
                regex.append('\\').append(c);
            } else {
                regex.append(c);
            }
        }
        return path.matches(regex.toString());
    }
}
