package in.co.pricematch.services;

/**
 * A similarity backend failed while scoring one pair. Caught at the pair boundary by
 * {@link ProductMatcher}; never used for business outcomes such as forbidden matches.
 */
public class ScoringException extends RuntimeException {

    public ScoringException(String message, Throwable cause) {
        super(message, cause);
    }

    public ScoringException(String message) {
        super(message);
    }
}
