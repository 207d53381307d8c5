package in.co.pricematch.services;

import in.co.pricematch.pojos.BatchMatchResult;
import in.co.pricematch.pojos.MatchScore;
import in.co.pricematch.pojos.MatchType;
import in.co.pricematch.pojos.PairFailure;
import in.co.pricematch.pojos.ProductMatch;
import in.co.pricematch.pojos.ProductRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static in.co.pricematch.services.MatchingConfig.*;

/**
 * Finds the best competitor matches for primary products.
 *
 * <p>A pair that throws while being scored is logged, recorded as a {@link PairFailure} and
 * skipped; the remaining candidates are still evaluated.</p>
 */
public class ProductMatcher {

    private static final Comparator<ProductMatch> BY_CONFIDENCE_DESC =
            Comparator.comparingDouble(ProductMatch::getConfidence).reversed();

    private final ConfidenceCalculator calculator;
    private final SizeExtractor sizeExtractor;
    private final HybridSimilarityScorer similarityScorer;

    public ProductMatcher(ConfidenceCalculator calculator, SizeExtractor sizeExtractor,
                          HybridSimilarityScorer similarityScorer) {
        this.calculator = calculator;
        this.sizeExtractor = sizeExtractor;
        this.similarityScorer = similarityScorer;
    }

    public List<ProductMatch> findMatches(ProductRecord primary, List<ProductRecord> candidates) {
        return findMatches(primary, candidates, DEFAULT_MIN_CONFIDENCE, DEFAULT_MAX_MATCHES);
    }

    /**
     * Score every candidate except the primary itself, keep those at or above
     * {@code minConfidence} that were not rejected as forbidden or dissimilar, and return at most {@code maxMatches} sorted by non-increasing
     * confidence. Ties keep candidate input order.
     */
    public List<ProductMatch> findMatches(ProductRecord primary, List<ProductRecord> candidates,
                                          double minConfidence, int maxMatches) {
        return findMatches(primary, candidates, minConfidence, maxMatches, new ArrayList<>());
    }

    private List<ProductMatch> findMatches(ProductRecord primary, List<ProductRecord> candidates,
                                           double minConfidence, int maxMatches, List<PairFailure> failures) {
        Objects.requireNonNull(primary, "primary");
        if (maxMatches <= 0) {
            return List.of();
        }

        List<ProductMatch> matches = new ArrayList<>();
        for (ProductRecord candidate : candidates) {
            if (candidate == null) {
                LoggingService.warn("candidate_skipped", LoggingService.data("primaryId", primary.getId(), "reason", "null candidate"));
                continue;
            }
            if (candidate.getId() == primary.getId()) {
                continue;
            }

            LoggingService.setPair(primary.getId(), candidate.getId());
            try {
                MatchScore score = calculator.calculate(primary, candidate);
                if (score.isRejected()) {
                    LoggingService.debug("candidate_rejected", LoggingService.data(
                            "outcome", score.getOutcome(), "reason", score.getWarnings()));
                } else if (score.getScore() >= minConfidence) {
                    double sizeSimilarity = sizeExtractor.similarity(primary.getName(), candidate.getName());
                    matches.add(new ProductMatch(primary.getId(), candidate.getId(), score.getScore(),
                            MatchType.fromConfidence(score.getScore()), sizeSimilarity, score.getWarnings()));
                }
            } catch (RuntimeException e) {
                LoggingService.error("pair_scoring_failed", e, LoggingService.data(
                        "primaryName", primary.getName(), "candidateName", candidate.getName()));
                failures.add(new PairFailure(primary.getId(), candidate.getId(),
                        e.getClass().getSimpleName() + ": " + e.getMessage()));
            } finally {
                LoggingService.clearPair();
            }
        }

        matches.sort(BY_CONFIDENCE_DESC);
        return matches.size() > maxMatches ? new ArrayList<>(matches.subList(0, maxMatches)) : matches;
    }

    public BatchMatchResult batchMatch(List<ProductRecord> primaries, List<ProductRecord> candidates) {
        return batchMatch(primaries, candidates, DEFAULT_MIN_CONFIDENCE);
    }

    /**
     * Match every primary independently against the full candidate set and concatenate the
     * results. The same candidate may appear for several primaries.
     */
    public BatchMatchResult batchMatch(List<ProductRecord> primaries, List<ProductRecord> candidates,
                                       double minConfidence) {
        return batchMatchSequential(primaries, candidates, minConfidence, DEFAULT_MAX_MATCHES);
    }

    private BatchMatchResult batchMatchSequential(List<ProductRecord> primaries, List<ProductRecord> candidates,
                                                  double minConfidence, int maxMatches) {
        long start = LoggingService.logOperationStart("batch_match", LoggingService.data(
                "primaries", primaries.size(), "candidates", candidates.size(), "parallelism", 1));
        warmUp(primaries, candidates);

        List<ProductMatch> all = new ArrayList<>();
        List<PairFailure> failures = new ArrayList<>();
        for (int i = 0; i < primaries.size(); i++) {
            logProgress(i, primaries.size());
            all.addAll(matchPrimary(primaries.get(i), candidates, minConfidence, maxMatches, failures));
        }

        LoggingService.logOperationEnd("batch_match", start, LoggingService.data(
                "matches", all.size(), "failures", failures.size()));
        return new BatchMatchResult(all, failures, primaries.size());
    }

    /**
     * Parallel variant of {@link #batchMatch(List, List, double)}: primaries are spread over a
     * fixed pool of {@code parallelism} threads, each keeping at most {@code maxMatches}.
     * Results are still concatenated in primary order.
     */
    public BatchMatchResult batchMatch(List<ProductRecord> primaries, List<ProductRecord> candidates,
                                       double minConfidence, int maxMatches, int parallelism) throws InterruptedException {
        if (parallelism <= 1 || primaries.size() <= 1) {
            return batchMatchSequential(primaries, candidates, minConfidence, maxMatches);
        }

        long start = LoggingService.logOperationStart("batch_match", LoggingService.data(
                "primaries", primaries.size(), "candidates", candidates.size(), "parallelism", parallelism));
        warmUp(primaries, candidates);

        String runId = LoggingService.currentRunId();
        AtomicInteger processed = new AtomicInteger();
        List<Callable<PrimaryResult>> tasks = new ArrayList<>(primaries.size());
        for (ProductRecord primary : primaries) {
            tasks.add(() -> {
                LoggingService.initRun(runId);
                try {
                    List<PairFailure> failures = new ArrayList<>();
                    List<ProductMatch> matches = matchPrimary(primary, candidates, minConfidence, maxMatches, failures);
                    logProgress(processed.getAndIncrement(), primaries.size());
                    return new PrimaryResult(matches, failures);
                } finally {
                    LoggingService.clearContext();
                }
            });
        }

        ExecutorService executor = Executors.newFixedThreadPool(parallelism);
        try {
            List<ProductMatch> all = new ArrayList<>();
            List<PairFailure> failures = new ArrayList<>();
            for (Future<PrimaryResult> future : executor.invokeAll(tasks)) {
                PrimaryResult result = future.get();
                all.addAll(result.matches);
                failures.addAll(result.failures);
            }
            LoggingService.logOperationEnd("batch_match", start, LoggingService.data(
                    "matches", all.size(), "failures", failures.size()));
            return new BatchMatchResult(all, failures, primaries.size());
        } catch (ExecutionException e) {
            LoggingService.logOperationFailed("batch_match", start, e.getCause());
            throw new IllegalStateException("Batch matching worker failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private List<ProductMatch> matchPrimary(ProductRecord primary, List<ProductRecord> candidates,
                                            double minConfidence, int maxMatches, List<PairFailure> failures) {
        if (primary == null) {
            LoggingService.warn("primary_skipped", LoggingService.data("reason", "null primary"));
            return List.of();
        }
        return findMatches(primary, candidates, minConfidence, maxMatches, failures);
    }

    private void warmUp(List<ProductRecord> primaries, List<ProductRecord> candidates) {
        List<ProductRecord> all = new ArrayList<>(primaries.size() + candidates.size());
        for (ProductRecord product : primaries) {
            if (product != null) {
                all.add(product);
            }
        }
        for (ProductRecord product : candidates) {
            if (product != null) {
                all.add(product);
            }
        }
        try {
            int embedded = similarityScorer.warmUp(all);
            LoggingService.info("embedding_warmup_completed", LoggingService.data("embedded", embedded));
        } catch (RuntimeException e) {
            // Pairs embed lazily and fail individually if the backend stays down.
            LoggingService.error("embedding_warmup_failed", e);
        }
    }

    private static void logProgress(int index, int total) {
        if (index % PROGRESS_LOG_INTERVAL == 0) {
            LoggingService.info("batch_match_progress", LoggingService.data("processing", index + 1, "total", total));
        }
    }

    private static final class PrimaryResult {
        final List<ProductMatch> matches;
        final List<PairFailure> failures;

        PrimaryResult(List<ProductMatch> matches, List<PairFailure> failures) {
            this.matches = matches;
            this.failures = failures;
        }
    }
}
