package com.raditha.cyclone.index;

import com.raditha.cyclone.model.BucketKey;
import com.raditha.cyclone.model.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable lookup structure over the patterns of one repository.
 * <p>
 * Two maps are kept: fingerprint to patterns for exact matches, and bucket
 * key to patterns for approximate candidates. Lists keep the order in which
 * patterns were given, so lookups are deterministic. Once built the index is
 * read without locking from any number of threads.
 */
public final class PatternIndex {

    private static final Logger logger = LoggerFactory.getLogger(PatternIndex.class);

    private final String repositoryId;
    private final List<Pattern> patterns;
    private final Map<Long, List<Pattern>> exact;
    private final Map<BucketKey, List<Pattern>> buckets;

    private PatternIndex(String repositoryId, List<Pattern> patterns,
                         Map<Long, List<Pattern>> exact, Map<BucketKey, List<Pattern>> buckets) {
        this.repositoryId = repositoryId;
        this.patterns = patterns;
        this.exact = exact;
        this.buckets = buckets;
    }

    /**
     * Index a list of patterns.
     *
     * @param repositoryId repository the patterns belong to
     * @param patterns     patterns in deterministic order
     */
    public static PatternIndex build(String repositoryId, List<Pattern> patterns) {
        Map<Long, List<Pattern>> exact = new HashMap<>();
        Map<BucketKey, List<Pattern>> buckets = new HashMap<>();
        for (Pattern pattern : patterns) {
            exact.computeIfAbsent(pattern.fingerprint(), k -> new ArrayList<>()).add(pattern);
            buckets.computeIfAbsent(pattern.bucketKey(), k -> new ArrayList<>()).add(pattern);
        }
        freeze(exact);
        freeze(buckets);
        logger.debug("Indexed {} patterns of {} into {} fingerprints and {} buckets",
                patterns.size(), repositoryId, exact.size(), buckets.size());
        return new PatternIndex(repositoryId, List.copyOf(patterns),
                Collections.unmodifiableMap(exact), Collections.unmodifiableMap(buckets));
    }

    private static <K> void freeze(Map<K, List<Pattern>> map) {
        map.replaceAll((k, list) -> List.copyOf(list));
    }

    /**
     * Patterns whose fingerprint equals the given one.
     */
    public List<Pattern> exactMatches(long fingerprint) {
        return exact.getOrDefault(fingerprint, List.of());
    }

    /**
     * Approximate candidates: patterns within {@link SizeBands#SEARCH_RADIUS}
     * bands of the key's size band that share the key's root kind and child
     * count.
     */
    public List<Pattern> candidates(BucketKey key) {
        List<Pattern> result = new ArrayList<>();
        for (int band = key.sizeBand() - SizeBands.SEARCH_RADIUS; band <= key.sizeBand() + SizeBands.SEARCH_RADIUS;
                band++) {
            result.addAll(buckets.getOrDefault(key.inBand(band), List.of()));
        }
        return result;
    }

    public String repositoryId() {
        return repositoryId;
    }

    public List<Pattern> patterns() {
        return patterns;
    }

    public int size() {
        return patterns.size();
    }

    public int bucketCount() {
        return buckets.size();
    }
}
