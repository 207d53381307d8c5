package in.co.pricematch.pojos;

import java.util.List;

/**
 * A raw match dropped by validation, with every reason that applied.
 */
public final class RejectedMatch {

    private final ProductMatch match;
    private final List<String> reasons;

    public RejectedMatch(ProductMatch match, List<String> reasons) {
        this.match = match;
        this.reasons = List.copyOf(reasons);
    }

    public ProductMatch getMatch() { return match; }
    public List<String> getReasons() { return reasons; }

    /** All reasons joined, the key used in the rejection histogram. */
    public String summary() {
        return String.join("; ", reasons);
    }
}
