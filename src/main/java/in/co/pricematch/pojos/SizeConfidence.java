package in.co.pricematch.pojos;

/**
 * How much a size extracted for price normalization can be trusted, strongest first.
 */
public enum SizeConfidence {
    HIGH,
    MEDIUM,
    LOW,
    UNKNOWN;

    /** The less trustworthy of the two. */
    public static SizeConfidence weakest(SizeConfidence a, SizeConfidence b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    public String getValue() {
        return name().toLowerCase();
    }
}
