package in.co.pricematch.pojos;

import java.util.List;

/**
 * Result of matching many primaries against one candidate set.
 * Matches are grouped by primary in input order; within a primary they are sorted by
 * non-increasing confidence.
 */
public final class BatchMatchResult {

    private final List<ProductMatch> matches;
    private final List<PairFailure> failures;
    private final int primariesProcessed;

    public BatchMatchResult(List<ProductMatch> matches, List<PairFailure> failures, int primariesProcessed) {
        this.matches = List.copyOf(matches);
        this.failures = List.copyOf(failures);
        this.primariesProcessed = primariesProcessed;
    }

    public List<ProductMatch> getMatches() { return matches; }
    public List<PairFailure> getFailures() { return failures; }
    public int getPrimariesProcessed() { return primariesProcessed; }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
