package in.co.pricematch.services;

import in.co.pricematch.pojos.CategoryPair;
import in.co.pricematch.pojos.Classification;
import in.co.pricematch.pojos.ForbiddenCheck;

import java.util.List;
import java.util.Locale;

import static in.co.pricematch.services.MatchingConfig.*;

/**
 * Decides whether two products must never be matched, regardless of how similar their
 * names are. Rules run in a fixed order and the first hit wins:
 *
 * <ol>
 *   <li>forbidden {@code type:subtype} pair</li>
 *   <li>forbidden bare type pair</li>
 *   <li>forbidden patterns, in declaration order</li>
 *   <li>configured incompatible categories</li>
 *   <li>built-in exclusions on the raw names (baking agents vs spices, two different named
 *       spices, coconut vs curry)</li>
 * </ol>
 *
 * Every rule is symmetric in its two products. Never throws on rule data.
 */
public class ForbiddenMatchRules {

    private final RuleStore rules;

    public ForbiddenMatchRules(RuleStore rules) {
        this.rules = rules;
    }

    public ForbiddenCheck check(String nameA, String nameB, Classification classA, Classification classB) {
        String qualifiedA = classA.qualifiedName();
        String qualifiedB = classB.qualifiedName();

        if (rules.isForbiddenQualifiedPair(qualifiedA, qualifiedB)) {
            return ForbiddenCheck.forbidden("Forbidden type combination: " + qualifiedA + " vs " + qualifiedB);
        }
        if (rules.isForbiddenTypePair(classA.getType(), classB.getType())) {
            return ForbiddenCheck.forbidden("Forbidden type combination: " + classA.getType() + " vs " + classB.getType());
        }

        String lowerA = nameA.toLowerCase(Locale.ROOT);
        String lowerB = nameB.toLowerCase(Locale.ROOT);

        for (ForbiddenPattern pattern : rules.getForbiddenPatterns()) {
            if (pattern.matches(lowerA, classA, lowerB, classB)) {
                return ForbiddenCheck.forbidden("Matches forbidden pattern: " + pattern.getSource());
            }
        }

        for (CategoryPair pair : rules.getIncompatibleCategories()) {
            if (pair.matches(classA, classB)) {
                return ForbiddenCheck.forbidden("Incompatible categories: " + pair);
            }
        }

        return checkBuiltInExclusions(lowerA, lowerB);
    }

    private static ForbiddenCheck checkBuiltInExclusions(String lowerA, String lowerB) {
        if ((containsAny(lowerA, BAKING_AGENTS) && containsAny(lowerB, BAKING_CONFLICT_SPICES))
                || (containsAny(lowerB, BAKING_AGENTS) && containsAny(lowerA, BAKING_CONFLICT_SPICES))) {
            return ForbiddenCheck.forbidden("Baking agents cannot match with spices");
        }

        String spiceA = firstContained(lowerA, NAMED_SPICES);
        String spiceB = firstContained(lowerB, NAMED_SPICES);
        if (spiceA != null && spiceB != null && !spiceA.equals(spiceB)) {
            return ForbiddenCheck.forbidden("Different spices: " + spiceA + " vs " + spiceB);
        }

        if ((lowerA.contains(COCONUT) && lowerB.contains(CURRY))
                || (lowerA.contains(CURRY) && lowerB.contains(COCONUT))) {
            return ForbiddenCheck.forbidden("Coconut products cannot match with curry products");
        }

        return ForbiddenCheck.allowed();
    }

    private static boolean containsAny(String text, List<String> needles) {
        return firstContained(text, needles) != null;
    }

    private static String firstContained(String text, List<String> needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return needle;
            }
        }
        return null;
    }
}
