package in.co.pricematch.services;

import in.co.pricematch.pojos.Classification;
import in.co.pricematch.pojos.ForbiddenCheck;
import in.co.pricematch.pojos.MatchScore;
import in.co.pricematch.pojos.ProductRecord;
import in.co.pricematch.pojos.SizeInfo;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static in.co.pricematch.services.MatchingConfig.*;

/**
 * Scores one (primary, candidate) pair. The steps run in a fixed order, each acting on the
 * running score of the previous one:
 *
 * <ol>
 *   <li>classify both products</li>
 *   <li>forbidden rules - terminal, score 0</li>
 *   <li>hybrid name similarity; below 0.3 is terminal, score 0</li>
 *   <li>category penalty or same-category bonus</li>
 *   <li>size penalty or exact-size bonus</li>
 *   <li>price-ratio penalty when both prices are known</li>
 *   <li>extra scrutiny for scores in the borderline band (0.6, 0.75)</li>
 *   <li>clamp to [0, 1]</li>
 * </ol>
 */
public class ConfidenceCalculator {

    private final RuleStore rules;
    private final CategoryClassifier classifier;
    private final SizeExtractor sizeExtractor;
    private final ForbiddenMatchRules forbiddenRules;
    private final HybridSimilarityScorer similarityScorer;

    public ConfidenceCalculator(RuleStore rules, CategoryClassifier classifier, SizeExtractor sizeExtractor,
                                ForbiddenMatchRules forbiddenRules, HybridSimilarityScorer similarityScorer) {
        this.rules = rules;
        this.classifier = classifier;
        this.sizeExtractor = sizeExtractor;
        this.forbiddenRules = forbiddenRules;
        this.similarityScorer = similarityScorer;
    }

    public MatchScore calculate(ProductRecord primary, ProductRecord candidate) {
        List<String> warnings = new ArrayList<>();

        Classification p = classifier.classify(primary.getName());
        Classification c = classifier.classify(candidate.getName());

        ForbiddenCheck forbidden = forbiddenRules.check(primary.getName(), candidate.getName(), p, c);
        if (forbidden.isForbidden()) {
            return MatchScore.forbidden(forbidden.getReason());
        }

        double score = similarityScorer.similarity(primary, candidate);
        if (score < MIN_BASE_SIMILARITY) {
            return MatchScore.dissimilar(String.format(Locale.ROOT, "Very low name similarity: %.2f", score));
        }

        score = applyCategoryPenalty(score, p, c, warnings);

        SizeInfo primarySize = sizeExtractor.extract(primary.getName());
        SizeInfo candidateSize = sizeExtractor.extract(candidate.getName());
        double sizeSimilarity = sizeExtractor.similarity(primarySize, candidateSize);
        if (sizeSimilarity < SIZE_MAJOR_MISMATCH_BELOW) {
            score *= SIZE_MAJOR_MISMATCH_FACTOR;
            warnings.add("Significant size mismatch: " + primarySize.describe() + " vs " + candidateSize.describe());
        } else if (sizeSimilarity < SIZE_MINOR_MISMATCH_BELOW) {
            score *= SIZE_MINOR_MISMATCH_FACTOR;
            warnings.add("Size difference: " + primarySize.describe() + " vs " + candidateSize.describe());
        } else if (sizeSimilarity > SIZE_MATCH_ABOVE) {
            score = Math.min(score + SIZE_MATCH_BONUS, 1.0);
        }

        if (primary.hasPrice() && candidate.hasPrice()) {
            double high = Math.max(primary.getPrice(), candidate.getPrice());
            double low = Math.min(primary.getPrice(), candidate.getPrice());
            double ratio = high / low;
            if (ratio > PRICE_RATIO_LARGE) {
                score *= PRICE_RATIO_LARGE_FACTOR;
                warnings.add(String.format(Locale.ROOT, "Large price difference: %.1fx", ratio));
            } else if (ratio > PRICE_RATIO_MEDIUM) {
                score *= PRICE_RATIO_MEDIUM_FACTOR;
                warnings.add(String.format(Locale.ROOT, "Price difference: %.1fx", ratio));
            }
        }

        if (score > BORDERLINE_LOW && score < BORDERLINE_HIGH) {
            if (warnings.size() > BORDERLINE_MAX_WARNINGS) {
                score *= BORDERLINE_WARNINGS_FACTOR;
            }
            if (meaningfulCommonWords(primary.getName(), candidate.getName()) < BORDERLINE_MIN_COMMON_WORDS) {
                score *= BORDERLINE_FEW_WORDS_FACTOR;
                warnings.add("Insufficient common meaningful words");
            }
        }

        return MatchScore.scored(score, warnings);
    }

    private double applyCategoryPenalty(double score, Classification p, Classification c, List<String> warnings) {
        if (!p.getType().equals(c.getType())) {
            Double penalty = rules.penaltyFor(p.getType(), c.getType());
            warnings.add("Type mismatch: " + p.getType() + " vs " + c.getType());
            return score * (penalty != null ? penalty : DEFAULT_TYPE_MISMATCH_FACTOR);
        }
        if (!p.getSubtype().equals(c.getSubtype())) {
            if (rules.isStrictCategory(p.qualifiedName()) || rules.isStrictCategory(c.qualifiedName())) {
                warnings.add("Strict subtype mismatch: " + p.getSubtype() + " vs " + c.getSubtype());
                return score * STRICT_SUBTYPE_MISMATCH_FACTOR;
            }
            warnings.add("Subtype mismatch: " + p.getSubtype() + " vs " + c.getSubtype());
            return score * SUBTYPE_MISMATCH_FACTOR;
        }
        return Math.min(score + SAME_CATEGORY_BONUS, 1.0);
    }

    /**
     * Words shared by the two raw names, split on whitespace, ignoring bare unit words.
     */
    static int meaningfulCommonWords(String nameA, String nameB) {
        Set<String> wordsA = new HashSet<>(Arrays.asList(nameA.toLowerCase(Locale.ROOT).trim().split("\\s+")));
        Set<String> wordsB = new HashSet<>(Arrays.asList(nameB.toLowerCase(Locale.ROOT).trim().split("\\s+")));
        wordsA.retainAll(wordsB);
        wordsA.removeAll(UNIT_WORDS);
        wordsA.remove("");
        return wordsA.size();
    }
}
