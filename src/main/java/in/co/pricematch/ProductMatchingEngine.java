package in.co.pricematch;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import in.co.pricematch.pojos.BatchMatchResult;
import in.co.pricematch.pojos.Classification;
import in.co.pricematch.pojos.ForbiddenCheck;
import in.co.pricematch.pojos.MatchScore;
import in.co.pricematch.pojos.MatchStatistics;
import in.co.pricematch.pojos.ProductMatch;
import in.co.pricematch.pojos.ProductRecord;
import in.co.pricematch.pojos.SizeInfo;
import in.co.pricematch.pojos.ValidationResult;
import in.co.pricematch.services.CategoryClassifier;
import in.co.pricematch.services.ConfidenceCalculator;
import in.co.pricematch.services.EmbeddingCache;
import in.co.pricematch.services.ForbiddenMatchRules;
import in.co.pricematch.services.HybridSimilarityScorer;
import in.co.pricematch.services.LoggingService;
import in.co.pricematch.services.MatchValidationService;
import in.co.pricematch.services.MatchingConfig;
import in.co.pricematch.services.PriceNormalizer;
import in.co.pricematch.services.ProductMatcher;
import in.co.pricematch.services.RuleStore;
import in.co.pricematch.services.RuleStoreLoader;
import in.co.pricematch.services.SizeExtractor;

import java.util.List;

/**
 * Entry point of the matching library. Wires the services around one immutable
 * {@link RuleStore} and one embedding model.
 *
 * <pre>
 * ProductMatchingEngine engine = ProductMatchingEngine.builder()
 *         .rules(RuleStoreLoader.fromDirectory(Path.of("rules")))
 *         .minConfidence(0.7)
 *         .build();
 * BatchMatchResult result = engine.batchMatch(ourProducts, competitorProducts);
 * </pre>
 *
 * Instances are safe to share between threads.
 */
public class ProductMatchingEngine {

    private final RuleStore rules;
    private final CategoryClassifier classifier;
    private final SizeExtractor sizeExtractor;
    private final ForbiddenMatchRules forbiddenRules;
    private final HybridSimilarityScorer similarityScorer;
    private final ConfidenceCalculator calculator;
    private final ProductMatcher matcher;
    private final MatchValidationService validationService;

    private final double minConfidence;
    private final int maxMatches;
    private final int parallelism;

    private ProductMatchingEngine(Builder builder) {
        this.rules = builder.rules != null ? builder.rules : RuleStoreLoader.loadDefaults();
        EmbeddingModel model = builder.embeddingModel != null ? builder.embeddingModel : new AllMiniLmL6V2EmbeddingModel();

        this.classifier = new CategoryClassifier(rules);
        this.sizeExtractor = new SizeExtractor();
        this.forbiddenRules = new ForbiddenMatchRules(rules);
        this.similarityScorer = new HybridSimilarityScorer(rules, sizeExtractor, new EmbeddingCache(model, builder.cacheSize));
        this.calculator = new ConfidenceCalculator(rules, classifier, sizeExtractor, forbiddenRules, similarityScorer);
        this.matcher = new ProductMatcher(calculator, sizeExtractor, similarityScorer);
        this.validationService = new MatchValidationService(new PriceNormalizer());

        this.minConfidence = builder.minConfidence;
        this.maxMatches = builder.maxMatches;
        this.parallelism = builder.parallelism;

        LoggingService.info("engine_initialized", LoggingService.data(
                "minConfidence", minConfidence, "maxMatches", maxMatches,
                "parallelism", parallelism, "cacheSize", builder.cacheSize));
    }

    public static Builder builder() {
        return new Builder();
    }

    public RuleStore getRules() {
        return rules;
    }

    // =========================================================================
    // Single-product operations
    // =========================================================================

    public Classification classify(String name) {
        return classifier.classify(name);
    }

    public SizeInfo extractSize(String name) {
        return sizeExtractor.extract(name);
    }

    public double sizeSimilarity(String nameA, String nameB) {
        return sizeExtractor.similarity(nameA, nameB);
    }

    public ForbiddenCheck isForbidden(String nameA, String nameB) {
        return forbiddenRules.check(nameA, nameB, classifier.classify(nameA), classifier.classify(nameB));
    }

    public double similarity(String nameA, String nameB) {
        return similarityScorer.similarity(nameA, nameB);
    }

    public MatchScore confidence(ProductRecord primary, ProductRecord candidate) {
        return calculator.calculate(primary, candidate);
    }

    // =========================================================================
    // Matching
    // =========================================================================

    public List<ProductMatch> findMatches(ProductRecord primary, List<ProductRecord> candidates) {
        return matcher.findMatches(primary, candidates, minConfidence, maxMatches);
    }

    /**
     * Match every primary against all candidates using the engine's configured parallelism.
     * A run id is attached to the logging context for the duration of the run.
     */
    public BatchMatchResult batchMatch(List<ProductRecord> primaries, List<ProductRecord> candidates)
            throws InterruptedException {
        String runId = LoggingService.initRun();
        LoggingService.setFunction("batch_match");
        try {
            BatchMatchResult result = matcher.batchMatch(primaries, candidates, minConfidence, maxMatches, parallelism);
            if (result.hasFailures()) {
                LoggingService.warn("batch_match_pair_failures", LoggingService.data(
                        "runId", runId, "failures", result.getFailures().size()));
            }
            return result;
        } finally {
            LoggingService.clearContext();
        }
    }

    public ValidationResult validate(List<ProductMatch> matches, List<ProductRecord> primaries,
                                     List<ProductRecord> candidates) {
        return validationService.validate(matches, primaries, candidates);
    }

    /**
     * Cheaper alternative to {@link #validate}: keeps matches whose names share a word or whose
     * confidence is at least 0.8.
     */
    public List<ProductMatch> validateBasic(List<ProductMatch> matches, List<ProductRecord> primaries,
                                            List<ProductRecord> candidates) {
        return validationService.validateBasic(matches, primaries, candidates);
    }

    public MatchStatistics statistics(List<ProductMatch> matches) {
        return MatchStatistics.from(matches);
    }

    public static class Builder {
        private RuleStore rules;
        private EmbeddingModel embeddingModel;
        private double minConfidence = MatchingConfig.DEFAULT_MIN_CONFIDENCE;
        private int maxMatches = MatchingConfig.DEFAULT_MAX_MATCHES;
        private int cacheSize = MatchingConfig.DEFAULT_EMBEDDING_CACHE_SIZE;
        private int parallelism = 1;

        public Builder rules(RuleStore rules) { this.rules = rules; return this; }
        public Builder embeddingModel(EmbeddingModel embeddingModel) { this.embeddingModel = embeddingModel; return this; }

        public Builder minConfidence(double minConfidence) {
            if (minConfidence < 0.0 || minConfidence > 1.0) {
                throw new IllegalArgumentException("minConfidence must be in [0, 1]: " + minConfidence);
            }
            this.minConfidence = minConfidence;
            return this;
        }

        public Builder maxMatches(int maxMatches) {
            if (maxMatches < 1) {
                throw new IllegalArgumentException("maxMatches must be positive: " + maxMatches);
            }
            this.maxMatches = maxMatches;
            return this;
        }

        public Builder cacheSize(int cacheSize) {
            if (cacheSize < 1) {
                throw new IllegalArgumentException("cacheSize must be positive: " + cacheSize);
            }
            this.cacheSize = cacheSize;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        public ProductMatchingEngine build() {
            return new ProductMatchingEngine(this);
        }
    }
}
