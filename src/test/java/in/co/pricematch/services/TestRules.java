package in.co.pricematch.services;

import dev.langchain4j.model.embedding.EmbeddingModel;

/**
 * Shared wiring for service tests, built on the rule fixtures under {@code test-rules/}.
 */
public final class TestRules {

    public static final String FIXTURE_PREFIX = "test-rules/";

    private static RuleStore store;

    private TestRules() {}

    public static synchronized RuleStore store() {
        if (store == null) {
            store = RuleStoreLoader.fromClasspath(FIXTURE_PREFIX);
        }
        return store;
    }

    public static HybridSimilarityScorer scorer(EmbeddingModel model) {
        return new HybridSimilarityScorer(store(), new SizeExtractor(), new EmbeddingCache(model, 1_000));
    }

    public static ConfidenceCalculator calculator(EmbeddingModel model) {
        RuleStore rules = store();
        return new ConfidenceCalculator(rules, new CategoryClassifier(rules), new SizeExtractor(),
                new ForbiddenMatchRules(rules), scorer(model));
    }

    public static ProductMatcher matcher(EmbeddingModel model) {
        HybridSimilarityScorer scorer = scorer(model);
        RuleStore rules = store();
        ConfidenceCalculator calculator = new ConfidenceCalculator(rules, new CategoryClassifier(rules),
                new SizeExtractor(), new ForbiddenMatchRules(rules), scorer);
        return new ProductMatcher(calculator, new SizeExtractor(), scorer);
    }
}
