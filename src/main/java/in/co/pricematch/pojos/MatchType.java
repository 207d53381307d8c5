package in.co.pricematch.pojos;

/**
 * Tier of an accepted match, derived from its confidence.
 */
public enum MatchType {
    EXACT("exact"),
    SIMILAR("similar"),
    SUBSTITUTE("substitute");

    private static final double EXACT_THRESHOLD = 0.9;
    private static final double SIMILAR_THRESHOLD = 0.75;

    private final String value;

    MatchType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static MatchType fromConfidence(double confidence) {
        if (confidence >= EXACT_THRESHOLD) {
            return EXACT;
        }
        if (confidence >= SIMILAR_THRESHOLD) {
            return SIMILAR;
        }
        return SUBSTITUTE;
    }
}
