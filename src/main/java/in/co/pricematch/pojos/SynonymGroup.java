package in.co.pricematch.pojos;

import java.util.List;

/**
 * Regional spellings ({@code terms}) that are rewritten to one {@code canonical} term before
 * classification, e.g. haldi -> turmeric.
 */
public final class SynonymGroup {

    private final String canonical;
    private final List<String> terms;

    public SynonymGroup(String canonical, List<String> terms) {
        this.canonical = canonical;
        this.terms = List.copyOf(terms);
    }

    public String getCanonical() { return canonical; }
    public List<String> getTerms() { return terms; }
}
