package in.co.pricematch.pojos;

import java.util.List;

/**
 * One taxonomy entry: a {@code (type, subtype)} and the lowercase keywords that select it.
 * The keyword count is the entry's priority; more keywords means a more specific category.
 */
public final class CategoryRule {

    private final String type;
    private final String subtype;
    private final List<String> keywords;

    public CategoryRule(String type, String subtype, List<String> keywords) {
        this.type = type;
        this.subtype = subtype == null || subtype.isEmpty() ? Classification.GENERIC_SUBTYPE : subtype;
        this.keywords = List.copyOf(keywords);
    }

    public String getType() { return type; }
    public String getSubtype() { return subtype; }
    public List<String> getKeywords() { return keywords; }

    public int getPriority() {
        return keywords.size();
    }

    public Classification toClassification() {
        return new Classification(type, subtype);
    }
}
