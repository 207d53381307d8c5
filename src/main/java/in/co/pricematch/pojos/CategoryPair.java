package in.co.pricematch.pojos;

/**
 * Two incompatible category tokens, each either {@code type:subtype} or a bare {@code type}.
 */
public final class CategoryPair {

    private final String first;
    private final String second;

    public CategoryPair(String first, String second) {
        this.first = first;
        this.second = second;
    }

    public String getFirst() { return first; }
    public String getSecond() { return second; }

    /**
     * True when the two classifications hit this pair in either order, on the full
     * {@code type:subtype} token or on the bare type.
     */
    public boolean matches(Classification a, Classification b) {
        String qa = a.qualifiedName();
        String qb = b.qualifiedName();
        return (qa.equals(first) && qb.equals(second))
                || (qa.equals(second) && qb.equals(first))
                || (a.getType().equals(first) && b.getType().equals(second))
                || (a.getType().equals(second) && b.getType().equals(first));
    }

    @Override
    public String toString() {
        return first + " vs " + second;
    }
}
