package in.co.pricematch.services;

import in.co.pricematch.pojos.CategoryPair;
import in.co.pricematch.pojos.CategoryRule;
import in.co.pricematch.pojos.SynonymGroup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable rule tables shared read-only by every evaluation of an engine instance.
 *
 * <p>Forbidden pairs are indexed in both orders for O(1) lookup: a pair of two
 * {@code type:subtype} tokens goes to the qualified index, a pair of two bare types to the
 * type index, and any other combination is kept as an ordered {@link ForbiddenPattern}.</p>
 *
 * Build with {@link #builder()} or load with {@link RuleStoreLoader}.
 */
public final class RuleStore {

    private static final char PAIR_SEPARATOR = '\u0001';
    private static final RuleStore EMPTY = builder().build();

    private final List<CategoryRule> categories;
    private final List<SynonymGroup> synonymGroups;
    private final Set<String> forbiddenQualifiedPairs;
    private final Set<String> forbiddenTypePairs;
    private final List<ForbiddenPattern> forbiddenPatterns;
    private final List<CategoryPair> incompatibleCategories;
    private final Set<String> strictCategories;
    private final Map<String, Double> penaltyMultipliers;
    private final List<String> brands;

    private RuleStore(Builder builder) {
        this.categories = List.copyOf(builder.categories);
        this.synonymGroups = List.copyOf(builder.synonymGroups);
        this.forbiddenQualifiedPairs = Collections.unmodifiableSet(new HashSet<>(builder.forbiddenQualifiedPairs));
        this.forbiddenTypePairs = Collections.unmodifiableSet(new HashSet<>(builder.forbiddenTypePairs));
        this.forbiddenPatterns = List.copyOf(builder.forbiddenPatterns);
        this.incompatibleCategories = List.copyOf(builder.incompatibleCategories);
        this.strictCategories = Collections.unmodifiableSet(new HashSet<>(builder.strictCategories));
        this.penaltyMultipliers = Collections.unmodifiableMap(new HashMap<>(builder.penaltyMultipliers));
        this.brands = List.copyOf(new LinkedHashSet<>(builder.brands));
    }

    public static RuleStore empty() {
        return EMPTY;
    }

    public List<CategoryRule> getCategories() { return categories; }
    public List<SynonymGroup> getSynonymGroups() { return synonymGroups; }
    public List<ForbiddenPattern> getForbiddenPatterns() { return forbiddenPatterns; }
    public List<CategoryPair> getIncompatibleCategories() { return incompatibleCategories; }
    public Set<String> getStrictCategories() { return strictCategories; }
    public Map<String, Double> getPenaltyMultipliers() { return penaltyMultipliers; }
    public List<String> getBrands() { return brands; }

    public boolean isForbiddenQualifiedPair(String qualifiedA, String qualifiedB) {
        return forbiddenQualifiedPairs.contains(pairKey(qualifiedA, qualifiedB));
    }

    public boolean isForbiddenTypePair(String typeA, String typeB) {
        return forbiddenTypePairs.contains(pairKey(typeA, typeB));
    }

    public boolean isStrictCategory(String qualifiedName) {
        return strictCategories.contains(qualifiedName);
    }

    /**
     * Penalty for a type mismatch, keyed {@code different_{typeA}_vs_{typeB}}; null if not configured.
     */
    public Double penaltyFor(String typeA, String typeB) {
        return penaltyMultipliers.get("different_" + typeA + "_vs_" + typeB);
    }

    /** Number of distinct forbidden pairs, counting each unordered pair once. */
    public int forbiddenPairCount() {
        Set<String> unordered = new HashSet<>();
        for (String key : forbiddenQualifiedPairs) {
            unordered.add(unorderedKey(key));
        }
        for (String key : forbiddenTypePairs) {
            unordered.add(unorderedKey(key));
        }
        return unordered.size();
    }

    private static String unorderedKey(String key) {
        int sep = key.indexOf(PAIR_SEPARATOR);
        String a = key.substring(0, sep);
        String b = key.substring(sep + 1);
        return a.compareTo(b) <= 0 ? key : pairKey(b, a);
    }

    private static String pairKey(String a, String b) {
        return a + PAIR_SEPARATOR + b;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<CategoryRule> categories = new ArrayList<>();
        private final List<SynonymGroup> synonymGroups = new ArrayList<>();
        private final Set<String> forbiddenQualifiedPairs = new HashSet<>();
        private final Set<String> forbiddenTypePairs = new HashSet<>();
        private final List<ForbiddenPattern> forbiddenPatterns = new ArrayList<>();
        private final List<CategoryPair> incompatibleCategories = new ArrayList<>();
        private final Set<String> strictCategories = new HashSet<>();
        private final Map<String, Double> penaltyMultipliers = new HashMap<>();
        private final List<String> brands = new ArrayList<>();

        public Builder category(String type, String subtype, List<String> keywords) {
            List<String> lowered = new ArrayList<>();
            for (String keyword : keywords) {
                if (keyword != null && !keyword.isBlank()) {
                    lowered.add(keyword.toLowerCase(Locale.ROOT));
                }
            }
            categories.add(new CategoryRule(lower(type), subtype == null ? null : lower(subtype), lowered));
            return this;
        }

        public Builder synonyms(String canonical, List<String> terms) {
            List<String> lowered = new ArrayList<>();
            for (String term : terms) {
                if (term != null && !term.isBlank()) {
                    lowered.add(term.toLowerCase(Locale.ROOT));
                }
            }
            synonymGroups.add(new SynonymGroup(canonical.toLowerCase(Locale.ROOT), lowered));
            return this;
        }

        /**
         * Register a forbidden pair, routing it to the qualified index, the type index or the
         * pattern list depending on its syntax.
         */
        public Builder forbiddenPair(String a, String b) {
            boolean patternA = ForbiddenPattern.isPatternToken(a);
            boolean patternB = ForbiddenPattern.isPatternToken(b);
            if (!patternA && !patternB) {
                forbiddenTypePairs.add(pairKey(lower(a), lower(b)));
                forbiddenTypePairs.add(pairKey(lower(b), lower(a)));
            } else if (isQualifiedCategory(a) && isQualifiedCategory(b)) {
                forbiddenQualifiedPairs.add(pairKey(lower(a), lower(b)));
                forbiddenQualifiedPairs.add(pairKey(lower(b), lower(a)));
            } else {
                ForbiddenPattern pattern = ForbiddenPattern.parse(a, b);
                if (!pattern.isParsable()) {
                    LoggingService.debug("forbidden_pattern_unparsable", LoggingService.data("pattern", pattern.getSource()));
                }
                forbiddenPatterns.add(pattern);
            }
            return this;
        }

        public Builder incompatible(String a, String b) {
            incompatibleCategories.add(new CategoryPair(lower(a), lower(b)));
            return this;
        }

        public Builder strictCategory(String qualifiedName) {
            strictCategories.add(lower(qualifiedName));
            return this;
        }

        public Builder penaltyMultiplier(String key, double multiplier) {
            penaltyMultipliers.put(lower(key), multiplier);
            return this;
        }

        public Builder brand(String brand) {
            if (brand != null && !brand.isBlank()) {
                brands.add(brand);
            }
            return this;
        }

        public Builder brands(List<String> brandNames) {
            brandNames.forEach(this::brand);
            return this;
        }

        public RuleStore build() {
            return new RuleStore(this);
        }

        private static String lower(String value) {
            return value.trim().toLowerCase(Locale.ROOT);
        }

        private static boolean isQualifiedCategory(String token) {
            if (token.indexOf('|') >= 0) {
                return false;
            }
            String[] parts = token.split(":", -1);
            return parts.length == 2 && !parts[0].isBlank() && !parts[1].isBlank();
        }
    }
}
