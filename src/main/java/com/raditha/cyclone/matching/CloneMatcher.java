package com.raditha.cyclone.matching;

import com.raditha.cyclone.config.CloneDetectionConfig;
import com.raditha.cyclone.index.PatternIndex;
import com.raditha.cyclone.index.SizeBands;
import com.raditha.cyclone.model.ClonePair;
import com.raditha.cyclone.model.CloneType;
import com.raditha.cyclone.model.Pattern;
import com.raditha.cyclone.model.UnmatchedPattern;
import com.raditha.cyclone.similarity.ResourceExhaustionException;
import com.raditha.cyclone.similarity.TreeEditDistance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Matches the patterns of repository A against the index of repository B.
 * <p>
 * For every pattern of A:
 * <ol>
 * <li>Exact pass: each pattern of B with the same fingerprint becomes a pair
 * with similarity 1.0, Type 1 if the literal fingerprints agree and Type 2
 * otherwise.</li>
 * <li>Approximate pass, when the exact pass found nothing or exhaustive mode
 * is on: bucket candidates that can still reach the threshold are compared
 * by tree edit distance. The best {@code topK} at or above the threshold
 * become Type 3 pairs.</li>
 * </ol>
 * The matcher is stateless between calls and may be shared between threads.
 */
public class CloneMatcher {

    private static final Logger logger = LoggerFactory.getLogger(CloneMatcher.class);

    /**
     * Similarity descending, then smaller size difference, then position in B.
     */
    static final Comparator<Candidate> CANDIDATE_ORDER = Comparator
            .comparingDouble(Candidate::similarity).reversed()
            .thenComparingInt(Candidate::sizeDifference)
            .thenComparing(c -> c.pattern().fileId())
            .thenComparingInt(c -> c.pattern().span().startOffset());

    private final CloneDetectionConfig config;
    private final TreeEditDistance editDistance;
    private final SizeBands sizeBands;

    public CloneMatcher(CloneDetectionConfig config) {
        this.config = config;
        this.editDistance = new TreeEditDistance(config.maxComparisonCells());
        this.sizeBands = new SizeBands(config.similarityThreshold());
    }

    /**
     * Scored approximate candidate.
     */
    record Candidate(Pattern pattern, int distance, double similarity, int sizeDifference) {
    }

    /**
     * Match all patterns on the calling thread.
     */
    public MatchResult match(List<Pattern> patternsA, PatternIndex indexB) {
        return matchRange(patternsA, 0, patternsA.size(), indexB);
    }

    /**
     * Match all patterns on a worker pool. The patterns are split into
     * contiguous chunks, each chunk fills a private result, and the results
     * are concatenated in chunk order, so the output equals that of
     * {@link #match(List, PatternIndex)}.
     *
     * @throws InterruptedException if interrupted while waiting for the workers
     */
    public MatchResult match(List<Pattern> patternsA, PatternIndex indexB, ExecutorService pool, int workers)
            throws InterruptedException {
        if (patternsA.isEmpty()) {
            return MatchResult.empty();
        }
        int chunks = Math.min(patternsA.size(), Math.max(1, workers) * 4);
        int chunkSize = (patternsA.size() + chunks - 1) / chunks;

        List<Future<MatchResult>> futures = new ArrayList<>();
        for (int from = 0; from < patternsA.size(); from += chunkSize) {
            int start = from;
            int end = Math.min(patternsA.size(), from + chunkSize);
            Callable<MatchResult> task = () -> matchRange(patternsA, start, end, indexB);
            futures.add(pool.submit(task));
        }

        List<MatchResult> parts = new ArrayList<>();
        for (Future<MatchResult> future : futures) {
            parts.add(await(future));
        }
        return MatchResult.concat(parts);
    }

    private static MatchResult await(Future<MatchResult> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Matching failed", cause);
        }
    }

    private MatchResult matchRange(List<Pattern> patternsA, int from, int to, PatternIndex indexB) {
        List<ClonePair> pairs = new ArrayList<>();
        List<UnmatchedPattern> unmatched = new ArrayList<>();
        long comparisons = 0;
        for (int i = from; i < to; i++) {
            comparisons += matchPattern(patternsA.get(i), indexB, pairs, unmatched);
        }
        return new MatchResult(pairs, unmatched, comparisons);
    }

    /**
     * Match a single pattern, appending to the given buffers.
     *
     * @return number of edit distance computations performed
     */
    long matchPattern(Pattern p, PatternIndex indexB, List<ClonePair> pairs, List<UnmatchedPattern> unmatched) {
        List<Pattern> exactHits = exactPass(p, indexB);
        for (Pattern q : exactHits) {
            CloneType type = p.literalFingerprint() == q.literalFingerprint() ? CloneType.TYPE1 : CloneType.TYPE2;
            pairs.add(new ClonePair(p, q, 1.0, type, List.of()));
        }
        if (!exactHits.isEmpty() && !config.exhaustive()) {
            return 0;
        }

        Set<Pattern> excluded = Collections.newSetFromMap(new IdentityHashMap<>());
        excluded.addAll(exactHits);

        List<Candidate> scored = new ArrayList<>();
        long comparisons = 0;
        try {
            for (Pattern q : indexB.candidates(p.bucketKey())) {
                if (excluded.contains(q) || !sizeBands.shouldCompare(p.size(), q.size())) {
                    continue;
                }
                int distance = editDistance.distance(p.tree(), q.tree());
                comparisons++;
                double similarity = TreeEditDistance.similarity(distance, p.size(), q.size());
                if (similarity >= config.similarityThreshold()) {
                    scored.add(new Candidate(q, distance, similarity, Math.abs(p.size() - q.size())));
                }
            }
        } catch (ResourceExhaustionException e) {
            logger.warn("Pattern {} left unmatched: {}", p, e.getMessage());
            unmatched.add(new UnmatchedPattern(p.repositoryId(), p.span(), p.size(), e.getMessage()));
            return comparisons;
        }

        scored.sort(CANDIDATE_ORDER);
        for (Candidate candidate : scored.subList(0, Math.min(config.topK(), scored.size()))) {
            TreeEditDistance.Result result = editDistance.compute(p.tree(), candidate.pattern().tree(), true);
            pairs.add(new ClonePair(p, candidate.pattern(), candidate.similarity(), CloneType.TYPE3,
                    result.script()));
        }
        if (!scored.isEmpty()) {
            logger.debug("{}: {} approximate candidates above threshold, kept {}",
                    p, scored.size(), Math.min(config.topK(), scored.size()));
        }
        return comparisons;
    }

    private List<Pattern> exactPass(Pattern p, PatternIndex indexB) {
        List<Pattern> hits = indexB.exactMatches(p.fingerprint());
        if (!config.verifyExactMatches() || hits.isEmpty()) {
            return hits;
        }
        List<Pattern> confirmed = new ArrayList<>(hits.size());
        for (Pattern q : hits) {
            if (p.tree().structurallyEquals(q.tree())) {
                confirmed.add(q);
            } else {
                logger.debug("Fingerprint collision between {} and {}", p, q);
            }
        }
        return confirmed;
    }
}
