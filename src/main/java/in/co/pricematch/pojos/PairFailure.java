package in.co.pricematch.pojos;

/**
 * A (primary, candidate) pair that could not be scored. The batch skips it and carries on.
 */
public final class PairFailure {

    public final long primaryId;
    public final long candidateId;
    public final String reason;

    public PairFailure(long primaryId, long candidateId, String reason) {
        this.primaryId = primaryId;
        this.candidateId = candidateId;
        this.reason = reason;
    }

    @Override
    public String toString() {
        return "PairFailure{primary=" + primaryId + ", candidate=" + candidateId + ", reason='" + reason + "'}";
    }
}
