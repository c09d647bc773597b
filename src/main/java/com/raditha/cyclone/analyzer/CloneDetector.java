package com.raditha.cyclone.analyzer;

import com.raditha.cyclone.aggregation.CloneAggregator;
import com.raditha.cyclone.config.CloneDetectionConfig;
import com.raditha.cyclone.config.Language;
import com.raditha.cyclone.extraction.ExtractionResult;
import com.raditha.cyclone.extraction.PatternExtractor;
import com.raditha.cyclone.index.PatternIndex;
import com.raditha.cyclone.matching.CloneMatcher;
import com.raditha.cyclone.matching.MatchResult;
import com.raditha.cyclone.model.CloneRegion;
import com.raditha.cyclone.model.ParseError;
import com.raditha.cyclone.model.Pattern;
import com.raditha.cyclone.model.SourceRepository;
import com.raditha.cyclone.model.UnmatchedPattern;
import com.raditha.cyclone.normalization.TreeNormalizer;
import com.raditha.cyclone.parser.JavaStructuralParser;
import com.raditha.cyclone.parser.SourceParseException;
import com.raditha.cyclone.parser.SourceParser;
import com.raditha.cyclone.parser.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main orchestrator for clone detection.
 * Coordinates parsing, normalization, extraction, indexing, matching and
 * aggregation for two repositories.
 * <p>
 * Files are processed independently on a fixed pool of worker threads. The
 * results of each repository are merged in file order by the calling thread
 * once all of its files are done, so the report does not depend on thread
 * scheduling. A file that fails to parse is listed in the report and left
 * out; it never aborts the run.
 */
public class CloneDetector {

    private static final Logger logger = LoggerFactory.getLogger(CloneDetector.class);

    private final CloneDetectionConfig config;
    private final SourceParser parser;
    private final TreeNormalizer normalizer;
    private final PatternExtractor extractor;
    private final CloneMatcher matcher;
    private final CloneAggregator aggregator;

    /**
     * Create detector with default configuration.
     */
    public CloneDetector() {
        this(CloneDetectionConfig.moderate());
    }

    /**
     * Create detector with custom configuration.
     */
    public CloneDetector(CloneDetectionConfig config) {
        this(config, parserFor(config.language()));
    }

    /**
     * Create detector with a custom parser.
     */
    public CloneDetector(CloneDetectionConfig config, SourceParser parser) {
        this.config = config;
        this.parser = parser;
        this.normalizer = new TreeNormalizer();
        this.extractor = new PatternExtractor(config, normalizer);
        this.matcher = new CloneMatcher(config);
        this.aggregator = new CloneAggregator();
    }

    static SourceParser parserFor(Language language) {
        return switch (language) {
            case JAVA -> new JavaStructuralParser();
        };
    }

    /**
     * Find the clones of repository A in repository B.
     *
     * @param a first repository, whose patterns are looked up
     * @param b second repository, which is indexed
     * @return regions, skipped files and unmatched patterns
     * @throws InterruptedException if the calling thread is interrupted
     */
    public CloneReport detect(SourceRepository a, SourceRepository b) throws InterruptedException {
        long start = System.currentTimeMillis();
        ExecutorService pool = Executors.newFixedThreadPool(config.parallelism(), workerThreads());
        try {
            // queue both repositories up front so no worker idles between them
            List<Future<FileResult>> tasksA = submitFiles(pool, a);
            List<Future<FileResult>> tasksB = submitFiles(pool, b);
            RepositoryPatterns side = collect(a, tasksA);
            RepositoryPatterns other = collect(b, tasksB);

            PatternIndex indexB = PatternIndex.build(b.id(), other.patterns());
            MatchResult match = matcher.match(side.patterns(), indexB, pool, config.parallelism());
            logger.info("Matched {} patterns of {} against {} patterns of {}: {} pairs, {} comparisons",
                    side.patterns().size(), a.id(), indexB.size(), b.id(),
                    match.pairs().size(), match.comparisons());

            List<CloneRegion> regions = aggregator.aggregate(match.pairs());

            List<ParseError> parseErrors = new ArrayList<>(side.errors());
            parseErrors.addAll(other.errors());
            List<UnmatchedPattern> unmatched = new ArrayList<>(side.unmatched());
            unmatched.addAll(other.unmatched());
            unmatched.addAll(match.unmatched());

            CloneReport report = new CloneReport(a.id(), b.id(), regions, parseErrors, unmatched,
                    side.patterns().size(), other.patterns().size(), match.pairs().size(), config);
            logger.info("{} in {} ms", report.getSummary(), System.currentTimeMillis() - start);
            return report;
        } finally {
            pool.shutdownNow();
        }
    }

    private List<Future<FileResult>> submitFiles(ExecutorService pool, SourceRepository repository) {
        List<Future<FileResult>> futures = new ArrayList<>(repository.fileCount());
        for (Map.Entry<String, String> file : repository.files().entrySet()) {
            futures.add(pool.submit(() -> processFile(repository.id(), file.getKey(), file.getValue())));
        }
        return futures;
    }

    /**
     * Parse, canonicalize and extract one file.
     */
    FileResult processFile(String repositoryId, String fileId, String text) {
        try {
            SyntaxTree tree = parser.parse(fileId, text);
            SyntaxTree canonical = normalizer.canonicalize(tree);
            ExtractionResult extracted = extractor.extract(repositoryId, canonical);
            return new FileResult(extracted.patterns(), extracted.unmatched(), null);
        } catch (SourceParseException e) {
            logger.warn("Skipping {}/{}: parse error at offset {} (line {}): {}",
                    repositoryId, fileId, e.getOffset(), e.getLine(), e.getMessage());
            ParseError error = new ParseError(repositoryId, fileId, e.getOffset(), e.getLine(), e.getMessage());
            return new FileResult(List.of(), List.of(), error);
        }
    }

    private RepositoryPatterns collect(SourceRepository repository, List<Future<FileResult>> futures)
            throws InterruptedException {
        List<Pattern> patterns = new ArrayList<>();
        List<UnmatchedPattern> unmatched = new ArrayList<>();
        List<ParseError> errors = new ArrayList<>();
        for (Future<FileResult> future : futures) {
            FileResult result = await(future);
            patterns.addAll(result.patterns());
            unmatched.addAll(result.unmatched());
            if (result.error() != null) {
                errors.add(result.error());
            }
        }
        logger.info("Repository {}: {} files, {} skipped, {} patterns",
                repository.id(), repository.fileCount(), errors.size(), patterns.size());
        return new RepositoryPatterns(patterns, unmatched, errors);
    }

    private static FileResult await(Future<FileResult> future) throws InterruptedException {
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
            throw new IllegalStateException("File processing failed", cause);
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "cyclone-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Get the configuration used by this detector.
     */
    public CloneDetectionConfig getConfig() {
        return config;
    }

    record FileResult(List<Pattern> patterns, List<UnmatchedPattern> unmatched, ParseError error) {
    }

    private record RepositoryPatterns(List<Pattern> patterns, List<UnmatchedPattern> unmatched,
                                      List<ParseError> errors) {
    }
}
