package in.co.pricematch.services;

import in.co.pricematch.pojos.CategoryRule;
import in.co.pricematch.pojos.Classification;
import in.co.pricematch.pojos.SynonymGroup;

import java.util.Locale;

/**
 * Maps a free-text product name to a {@link Classification} by keyword matching.
 *
 * <p>Synonyms are rewritten to their canonical term on a working copy of the lowercased name.
 * Every taxonomy entry with at least one keyword in the name is a candidate; the candidate
 * with the most configured keywords wins and declaration order breaks ties. No candidate
 * gives {@code other:generic}.</p>
 */
public class CategoryClassifier {

    private final RuleStore rules;

    public CategoryClassifier(RuleStore rules) {
        this.rules = rules;
    }

    public Classification classify(String name) {
        if (name == null || name.isBlank()) {
            return Classification.other();
        }
        String working = applySynonyms(name.toLowerCase(Locale.ROOT));

        CategoryRule best = null;
        for (CategoryRule category : rules.getCategories()) {
            if (containsAnyKeyword(working, category)
                    && (best == null || category.getPriority() > best.getPriority())) {
                best = category;
            }
        }
        return best == null ? Classification.other() : best.toClassification();
    }

    /**
     * Lowercased name with every synonym term replaced by its canonical term.
     */
    String applySynonyms(String lowerName) {
        String working = lowerName;
        for (SynonymGroup group : rules.getSynonymGroups()) {
            for (String term : group.getTerms()) {
                if (working.contains(term)) {
                    working = working.replace(term, group.getCanonical());
                }
            }
        }
        return working;
    }

    private static boolean containsAnyKeyword(String working, CategoryRule category) {
        for (String keyword : category.getKeywords()) {
            if (working.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
