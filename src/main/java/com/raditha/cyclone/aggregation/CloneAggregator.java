package com.raditha.cyclone.aggregation;

import com.raditha.cyclone.model.ClonePair;
import com.raditha.cyclone.model.CloneRegion;
import com.raditha.cyclone.model.CloneType;
import com.raditha.cyclone.model.Pattern;
import com.raditha.cyclone.model.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges clone pairs that describe the same copied code into regions.
 * <p>
 * Nested anchors produce one pair per granularity (a method and the loop
 * inside it, say). Two pairs are linked when their A spans overlap in the
 * same file and their B spans overlap in the same file; connected pairs form
 * one region covering the union of their spans.
 * <p>
 * Overlap alone also links cross matches: with two similar methods inside
 * one copied class, the first method of A may be paired with the second
 * method of B. Within a linked group a pair is dropped when its A pattern or
 * its B pattern has a partner of a stronger type in the same group. The
 * survivors are linked again, so a dropped pair can no longer join groups.
 */
public class CloneAggregator {

    private static final Logger logger = LoggerFactory.getLogger(CloneAggregator.class);

    /**
     * Confidence descending, then position in A, then position in B.
     */
    static final Comparator<CloneRegion> REGION_ORDER = Comparator
            .comparingDouble(CloneRegion::confidence).reversed()
            .thenComparing(CloneRegion::fileA)
            .thenComparingInt(r -> r.spanA().startOffset())
            .thenComparing(CloneRegion::fileB)
            .thenComparingInt(r -> r.spanB().startOffset())
            .thenComparingInt(r -> r.spanA().endOffset())
            .thenComparingInt(r -> r.spanB().endOffset());

    /**
     * Merge pairs into ordered regions.
     *
     * @param pairs pairs in deterministic order
     * @return regions ordered by confidence and position
     */
    public List<CloneRegion> aggregate(List<ClonePair> pairs) {
        List<CloneRegion> regions = new ArrayList<>();
        int dropped = collectRegions(pairs, regions);
        regions.sort(REGION_ORDER);

        logger.debug("Aggregated {} pairs into {} regions, {} cross matches dropped",
                pairs.size(), regions.size(), dropped);
        return regions;
    }

    /**
     * Add one region per linked group of {@code pairs}.
     *
     * @return number of cross matches dropped
     */
    private int collectRegions(List<ClonePair> pairs, List<CloneRegion> regions) {
        int dropped = 0;
        for (List<ClonePair> group : linkedGroups(pairs)) {
            List<ClonePair> kept = withoutCrossMatches(group);
            if (kept.size() == group.size()) {
                regions.add(toRegion(group));
            } else {
                // the strongest pairs always survive, so this terminates
                dropped += group.size() - kept.size() + collectRegions(kept, regions);
            }
        }
        return dropped;
    }

    private static Collection<List<ClonePair>> linkedGroups(List<ClonePair> pairs) {
        int[] parent = new int[pairs.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }

        // only pairs of the same two files can overlap
        Map<String, List<Integer>> byFiles = new LinkedHashMap<>();
        for (int i = 0; i < pairs.size(); i++) {
            ClonePair pair = pairs.get(i);
            String key = pair.patternA().fileId() + '\u0000' + pair.patternB().fileId();
            byFiles.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
        }
        for (List<Integer> group : byFiles.values()) {
            for (int x = 0; x < group.size(); x++) {
                for (int y = x + 1; y < group.size(); y++) {
                    int i = group.get(x);
                    int j = group.get(y);
                    if (linked(pairs.get(i), pairs.get(j))) {
                        union(parent, i, j);
                    }
                }
            }
        }

        Map<Integer, List<ClonePair>> components = new LinkedHashMap<>();
        for (int i = 0; i < pairs.size(); i++) {
            components.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(pairs.get(i));
        }
        return components.values();
    }

    /**
     * Pairs whose type equals the strongest type found for both of their
     * patterns within the group. Input order is kept.
     */
    static List<ClonePair> withoutCrossMatches(List<ClonePair> group) {
        Map<Pattern, CloneType> strongestA = new HashMap<>();
        Map<Pattern, CloneType> strongestB = new HashMap<>();
        for (ClonePair pair : group) {
            strongestA.merge(pair.patternA(), pair.type(), CloneType::strongest);
            strongestB.merge(pair.patternB(), pair.type(), CloneType::strongest);
        }
        List<ClonePair> kept = new ArrayList<>(group.size());
        for (ClonePair pair : group) {
            if (strongestA.get(pair.patternA()) == pair.type() && strongestB.get(pair.patternB()) == pair.type()) {
                kept.add(pair);
            }
        }
        return kept;
    }

    private static boolean linked(ClonePair p, ClonePair q) {
        return p.patternA().span().overlaps(q.patternA().span())
                && p.patternB().span().overlaps(q.patternB().span());
    }

    private static CloneRegion toRegion(List<ClonePair> members) {
        ClonePair first = members.get(0);
        SourceSpan spanA = first.patternA().span();
        SourceSpan spanB = first.patternB().span();
        CloneType type = first.type();
        ClonePair dominant = first;
        for (ClonePair member : members.subList(1, members.size())) {
            spanA = spanA.union(member.patternA().span());
            spanB = spanB.union(member.patternB().span());
            type = CloneType.weakest(type, member.type());
            if (dominates(member, dominant)) {
                dominant = member;
            }
        }
        return new CloneRegion(spanA, spanB, type, dominant.similarity(), members);
    }

    /**
     * Larger combined size wins, ties go to the higher similarity.
     */
    private static boolean dominates(ClonePair candidate, ClonePair current) {
        if (candidate.combinedSize() != current.combinedSize()) {
            return candidate.combinedSize() > current.combinedSize();
        }
        return candidate.similarity() > current.similarity();
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int i, int j) {
        int ri = find(parent, i);
        int rj = find(parent, j);
        if (ri != rj) {
            // keep the smaller index as root so component order follows input order
            parent[Math.max(ri, rj)] = Math.min(ri, rj);
        }
    }
}
