package com.raditha.cyclone.analyzer;

import com.raditha.cyclone.config.CloneDetectionConfig;
import com.raditha.cyclone.model.ClonePair;
import com.raditha.cyclone.model.CloneRegion;
import com.raditha.cyclone.model.CloneType;
import com.raditha.cyclone.model.EditOperation;
import com.raditha.cyclone.model.ParseError;
import com.raditha.cyclone.model.UnmatchedPattern;

import java.util.List;
import java.util.Locale;

/**
 * Result of comparing two repositories.
 *
 * @param repositoryA       Identifier of the first repository
 * @param repositoryB       Identifier of the second repository
 * @param regions           Clone regions ordered by confidence and position
 * @param parseErrors       Files excluded from analysis, in file order
 * @param unmatchedPatterns Patterns dropped by a resource guard
 * @param patternsA         Patterns extracted from A
 * @param patternsB         Patterns extracted from B
 * @param pairCount         Clone pairs before aggregation
 * @param config            Configuration used for the run
 */
public record CloneReport(
        String repositoryA,
        String repositoryB,
        List<CloneRegion> regions,
        List<ParseError> parseErrors,
        List<UnmatchedPattern> unmatchedPatterns,
        int patternsA,
        int patternsB,
        int pairCount,
        CloneDetectionConfig config) {

    public CloneReport {
        regions = List.copyOf(regions);
        parseErrors = List.copyOf(parseErrors);
        unmatchedPatterns = List.copyOf(unmatchedPatterns);
    }

    /**
     * Get count of clone regions found.
     */
    public int getRegionCount() {
        return regions.size();
    }

    /**
     * Check if any clones were found.
     */
    public boolean hasClones() {
        return !regions.isEmpty();
    }

    /**
     * Get regions with confidence at or above a specific threshold.
     */
    public List<CloneRegion> getRegionsAbove(double threshold) {
        return regions.stream()
                .filter(region -> region.confidence() >= threshold)
                .toList();
    }

    public long countByType(CloneType type) {
        return regions.stream().filter(region -> region.type() == type).count();
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        return String.format(Locale.ROOT,
                "Found %d clone regions (%d Type 1, %d Type 2, %d Type 3) from %d pairs; "
                        + "%d patterns in %s, %d patterns in %s, %d files skipped (threshold: %.0f%%)",
                regions.size(),
                countByType(CloneType.TYPE1),
                countByType(CloneType.TYPE2),
                countByType(CloneType.TYPE3),
                pairCount,
                patternsA,
                repositoryA,
                patternsB,
                repositoryB,
                parseErrors.size(),
                config.similarityThreshold() * 100);
    }

    /**
     * Get detailed report string.
     */
    public String getDetailedReport() {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(80)).append("\n");
        sb.append("CLONE DETECTION REPORT\n");
        sb.append("=".repeat(80)).append("\n\n");

        sb.append("Repository A: ").append(repositoryA).append("\n");
        sb.append("Repository B: ").append(repositoryB).append("\n");
        sb.append("Min Pattern Nodes: ").append(config.minPatternNodes()).append("\n");
        sb.append("Max Pattern Depth: ").append(config.maxPatternDepth()).append("\n");
        sb.append("Threshold: ")
                .append(String.format(Locale.ROOT, "%.0f%%", config.similarityThreshold() * 100))
                .append("\n");
        sb.append("\n");

        sb.append(getSummary()).append("\n\n");

        if (regions.isEmpty()) {
            sb.append("No clones found.\n");
        } else {
            sb.append("Clone regions (sorted by confidence):\n");
            sb.append("-".repeat(80)).append("\n\n");

            for (int i = 0; i < regions.size(); i++) {
                CloneRegion region = regions.get(i);
                sb.append(String.format(Locale.ROOT, "Region #%d - %s, %.1f%% confidence\n",
                        i + 1, region.type().displayName(), region.confidence() * 100));
                sb.append(String.format(Locale.ROOT, "  A: %s lines %d-%d\n",
                        region.fileA(), region.startLineA(), region.endLineA()));
                sb.append(String.format(Locale.ROOT, "  B: %s lines %d-%d\n",
                        region.fileB(), region.startLineB(), region.endLineB()));
                sb.append(String.format(Locale.ROOT, "  Pairs: %d\n", region.members().size()));
                appendEdits(sb, region);
                sb.append("\n");
            }
        }

        if (!parseErrors.isEmpty()) {
            sb.append("Skipped files:\n");
            for (ParseError error : parseErrors) {
                sb.append("  ").append(error.toDisplayString()).append("\n");
            }
            sb.append("\n");
        }
        if (!unmatchedPatterns.isEmpty()) {
            sb.append("Unmatched patterns:\n");
            for (UnmatchedPattern pattern : unmatchedPatterns) {
                sb.append(String.format(Locale.ROOT, "  %s/%s (%d nodes): %s\n",
                        pattern.repositoryId(), pattern.span(), pattern.size(), pattern.reason()));
            }
        }
        return sb.toString();
    }

    private static void appendEdits(StringBuilder sb, CloneRegion region) {
        for (ClonePair pair : region.members()) {
            if (pair.edits().isEmpty()) {
                continue;
            }
            sb.append(String.format(Locale.ROOT, "  Edits %s -> %s:\n",
                    pair.patternA().span(), pair.patternB().span()));
            for (EditOperation edit : pair.edits()) {
                sb.append("    ").append(edit.toDisplayString()).append("\n");
            }
        }
    }
}
