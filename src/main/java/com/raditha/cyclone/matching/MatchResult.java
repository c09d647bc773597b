package com.raditha.cyclone.matching;

import com.raditha.cyclone.model.ClonePair;
import com.raditha.cyclone.model.UnmatchedPattern;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of the matcher.
 *
 * @param pairs       clone pairs in pattern order of A
 * @param unmatched   patterns of A whose approximate pass hit the resource guard
 * @param comparisons number of edit distance computations performed
 */
public record MatchResult(List<ClonePair> pairs, List<UnmatchedPattern> unmatched, long comparisons) {

    public MatchResult {
        pairs = List.copyOf(pairs);
        unmatched = List.copyOf(unmatched);
    }

    public static MatchResult empty() {
        return new MatchResult(List.of(), List.of(), 0);
    }

    /**
     * Concatenate results in the given order.
     */
    public static MatchResult concat(List<MatchResult> parts) {
        List<ClonePair> pairs = new ArrayList<>();
        List<UnmatchedPattern> unmatched = new ArrayList<>();
        long comparisons = 0;
        for (MatchResult part : parts) {
            pairs.addAll(part.pairs());
            unmatched.addAll(part.unmatched());
            comparisons += part.comparisons();
        }
        return new MatchResult(pairs, unmatched, comparisons);
    }
}
