package in.co.pricematch.services;

import java.util.List;
import java.util.Set;

/**
 * Constants of the matching algorithm.
 * Rule data (taxonomy, forbidden pairs, synonyms, brands) is not here; it is loaded by
 * {@link RuleStoreLoader}.
 */
public final class MatchingConfig {

    private MatchingConfig() {}

    // Match finder defaults
    public static final double DEFAULT_MIN_CONFIDENCE = 0.65;
    public static final int DEFAULT_MAX_MATCHES = 3;
    public static final int PROGRESS_LOG_INTERVAL = 50;

    // Hybrid similarity
    public static final double SEMANTIC_WEIGHT = 0.4;
    public static final double LEXICAL_WEIGHT = 0.6;
    public static final double NO_COMMON_WORDS_SIMILARITY = 0.1;
    public static final double SAME_BRAND_BONUS = 0.1;
    public static final double DIFFERENT_BRAND_FACTOR = 0.85;
    public static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "or", "of", "in", "with", "for", "pure", "organic", "fresh", "premium");

    // Confidence calculator
    public static final double MIN_BASE_SIMILARITY = 0.3;
    public static final double DEFAULT_TYPE_MISMATCH_FACTOR = 0.5;
    public static final double STRICT_SUBTYPE_MISMATCH_FACTOR = 0.3;
    public static final double SUBTYPE_MISMATCH_FACTOR = 0.7;
    public static final double SAME_CATEGORY_BONUS = 0.15;

    public static final double SIZE_MAJOR_MISMATCH_BELOW = 0.5;
    public static final double SIZE_MAJOR_MISMATCH_FACTOR = 0.5;
    public static final double SIZE_MINOR_MISMATCH_BELOW = 0.75;
    public static final double SIZE_MINOR_MISMATCH_FACTOR = 0.8;
    public static final double SIZE_MATCH_ABOVE = 0.95;
    public static final double SIZE_MATCH_BONUS = 0.05;

    public static final double PRICE_RATIO_LARGE = 10.0;
    public static final double PRICE_RATIO_LARGE_FACTOR = 0.6;
    public static final double PRICE_RATIO_MEDIUM = 5.0;
    public static final double PRICE_RATIO_MEDIUM_FACTOR = 0.8;

    public static final double BORDERLINE_LOW = 0.6;
    public static final double BORDERLINE_HIGH = 0.75;
    public static final int BORDERLINE_MAX_WARNINGS = 2;
    public static final double BORDERLINE_WARNINGS_FACTOR = 0.8;
    public static final int BORDERLINE_MIN_COMMON_WORDS = 2;
    public static final double BORDERLINE_FEW_WORDS_FACTOR = 0.7;
    public static final Set<String> UNIT_WORDS = Set.of("g", "kg", "ml", "l", "oz", "lb");

    // Size similarity
    public static final double SIZE_UNKNOWN_TYPE_SIMILARITY = 0.3;
    public static final double SIZE_DIFFERENT_TYPE_SIMILARITY = 0.1;
    public static final double SIZE_NO_MAGNITUDE_SIMILARITY = 0.5;
    public static final double SIZE_EXACT_TOLERANCE = 0.02;

    // Unit conversion factors to grams / milliliters
    public static final double GRAMS_PER_KG = 1000.0;
    public static final double GRAMS_PER_LB = 453.6;
    public static final double GRAMS_PER_OZ = 28.35;
    public static final double ML_PER_LITER = 1000.0;

    // Hard-coded cross-domain exclusions
    public static final List<String> BAKING_AGENTS = List.of("baking powder", "baking soda");
    public static final List<String> BAKING_CONFLICT_SPICES = List.of("cumin", "coriander", "turmeric", "chili", "masala");
    public static final List<String> NAMED_SPICES = List.of("amchur", "anardana", "cumin", "coriander", "turmeric", "chili");
    public static final String COCONUT = "coconut";
    public static final String CURRY = "curry";

    // Embeddings
    public static final int DEFAULT_EMBEDDING_CACHE_SIZE = 50_000;

    // Match validation (per-unit price analysis)
    public static final double VALIDATION_LOW_CONFIDENCE = 0.7;
    public static final double VALIDATION_NO_COMMON_WORDS_CONFIDENCE = 0.8;
    public static final double VALIDATION_MIN_NAME_SIMILARITY = 0.3;
    public static final double VALIDATION_MAX_SAVINGS_PCT = 500.0;
    public static final double VALIDATION_MAX_ABSOLUTE_PRICE_RATIO = 10.0;
    public static final double VALIDATION_SIZE_MISMATCH_BELOW = 0.5;
    public static final double VALIDATION_SIZE_MISMATCH_CONFIDENCE = 0.75;
}
