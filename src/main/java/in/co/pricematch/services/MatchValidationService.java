package in.co.pricematch.services;

import in.co.pricematch.pojos.PriceComparison;
import in.co.pricematch.pojos.ProductMatch;
import in.co.pricematch.pojos.ProductRecord;
import in.co.pricematch.pojos.QualityReport;
import in.co.pricematch.pojos.RejectedMatch;
import in.co.pricematch.pojos.SizeConfidence;
import in.co.pricematch.pojos.ValidationResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static in.co.pricematch.services.MatchingConfig.*;

/**
 * Second-pass check of raw matches using per-unit price analysis. Drops matches whose prices
 * or sizes make the pairing implausible, and summarizes the pass in a {@link QualityReport}.
 */
public class MatchValidationService {

    private final PriceNormalizer priceNormalizer;

    public MatchValidationService(PriceNormalizer priceNormalizer) {
        this.priceNormalizer = priceNormalizer;
    }

    public ValidationResult validate(List<ProductMatch> matches, List<ProductRecord> primaries,
                                     List<ProductRecord> candidates) {
        Map<Long, ProductRecord> primaryById = index(primaries);
        Map<Long, ProductRecord> candidateById = index(candidates);

        List<ProductMatch> validated = new ArrayList<>();
        List<RejectedMatch> rejected = new ArrayList<>();
        List<PriceComparison> comparisons = new ArrayList<>();
        Map<String, Integer> reasons = new LinkedHashMap<>();

        for (ProductMatch match : matches) {
            ProductRecord primary = primaryById.get(match.getPrimaryId());
            ProductRecord candidate = candidateById.get(match.getMatchedId());
            List<String> issues;
            if (primary == null || candidate == null) {
                issues = List.of("Missing product data");
            } else {
                PriceComparison comparison = priceNormalizer.compare(primary, candidate);
                comparisons.add(comparison);
                issues = findIssues(primary, candidate, match, comparison);
            }

            if (issues.isEmpty()) {
                validated.add(match);
            } else {
                RejectedMatch rejection = new RejectedMatch(match, issues);
                rejected.add(rejection);
                reasons.merge(rejection.summary(), 1, Integer::sum);
            }
        }

        long normalized = comparisons.stream().filter(PriceComparison::canCompareNormalized).count();
        double successRate = comparisons.isEmpty() ? 0.0 : (double) normalized / comparisons.size();
        QualityReport report = new QualityReport(matches.size(), validated.size(), rejected.size(), successRate, reasons);

        LoggingService.info("match_validation_completed", LoggingService.data(
                "raw", matches.size(), "validated", validated.size(), "rejected", rejected.size(),
                "normalizationRate", successRate));
        return new ValidationResult(validated, rejected, comparisons, report);
    }

    /**
     * Name-overlap check without price analysis. Matches whose products cannot be found are
     * dropped, as are matches below 0.8 confidence whose names share no word.
     */
    public List<ProductMatch> validateBasic(List<ProductMatch> matches, List<ProductRecord> primaries,
                                            List<ProductRecord> candidates) {
        Map<Long, ProductRecord> primaryById = index(primaries);
        Map<Long, ProductRecord> candidateById = index(candidates);

        List<ProductMatch> validated = new ArrayList<>();
        for (ProductMatch match : matches) {
            ProductRecord primary = primaryById.get(match.getPrimaryId());
            ProductRecord candidate = candidateById.get(match.getMatchedId());
            if (primary == null || candidate == null) {
                continue;
            }
            if (isPlausibleByName(primary, candidate, match)) {
                validated.add(match);
            } else {
                LoggingService.debug("match_rejected_no_common_words", LoggingService.data(
                        "primaryName", primary.getName(), "candidateName", candidate.getName()));
            }
        }

        LoggingService.info("basic_validation_completed", LoggingService.data(
                "raw", matches.size(), "validated", validated.size()));
        return validated;
    }

    static boolean isPlausibleByName(ProductRecord primary, ProductRecord candidate, ProductMatch match) {
        Set<String> common = words(primary.getName());
        common.retainAll(words(candidate.getName()));
        return !common.isEmpty() || match.getConfidence() >= VALIDATION_NO_COMMON_WORDS_CONFIDENCE;
    }

    List<String> findIssues(ProductRecord primary, ProductRecord candidate, ProductMatch match,
                            PriceComparison comparison) {
        List<String> issues = new ArrayList<>();

        if (match.getConfidence() < VALIDATION_LOW_CONFIDENCE) {
            double nameSimilarity = jaccard(primary.getName(), candidate.getName());
            if (nameSimilarity < VALIDATION_MIN_NAME_SIMILARITY) {
                issues.add(String.format(Locale.ROOT,
                        "Low name similarity (%.2f) for low confidence match", nameSimilarity));
            }
        }

        if (comparison.canCompareNormalized()) {
            if (Math.abs(comparison.normalizedSavingsPct) > VALIDATION_MAX_SAVINGS_PCT) {
                issues.add(String.format(Locale.ROOT,
                        "Extreme per-unit price difference: %.1f%%", comparison.normalizedSavingsPct));
            }
            if (comparison.sizeConfidence == SizeConfidence.LOW) {
                issues.add("Low confidence in size extraction");
            }
        } else if (primary.hasPrice() && candidate.hasPrice()) {
            double ratio = Math.max(primary.getPrice(), candidate.getPrice())
                    / Math.min(primary.getPrice(), candidate.getPrice());
            if (ratio > VALIDATION_MAX_ABSOLUTE_PRICE_RATIO) {
                issues.add(String.format(Locale.ROOT,
                        "Cannot normalize sizes and absolute price difference too large: %.1fx", ratio));
            }
        }

        if (match.getSizeSimilarity() < VALIDATION_SIZE_MISMATCH_BELOW
                && match.getConfidence() < VALIDATION_SIZE_MISMATCH_CONFIDENCE) {
            issues.add("Size/quantity mismatch detected");
        }
        return issues;
    }

    /**
     * Word-set Jaccard similarity of two raw names.
     */
    static double jaccard(String nameA, String nameB) {
        Set<String> wordsA = words(nameA);
        Set<String> wordsB = words(nameB);
        if (wordsA.isEmpty() || wordsB.isEmpty()) {
            return 0.0;
        }
        Set<String> union = new HashSet<>(wordsA);
        union.addAll(wordsB);
        wordsA.retainAll(wordsB);
        return (double) wordsA.size() / union.size();
    }

    private static Set<String> words(String name) {
        Set<String> words = new HashSet<>(Arrays.asList(name.toLowerCase(Locale.ROOT).trim().split("\\s+")));
        words.remove("");
        return words;
    }

    private static Map<Long, ProductRecord> index(List<ProductRecord> products) {
        Map<Long, ProductRecord> byId = new HashMap<>();
        for (ProductRecord product : products) {
            byId.put(product.getId(), product);
        }
        return byId;
    }
}
