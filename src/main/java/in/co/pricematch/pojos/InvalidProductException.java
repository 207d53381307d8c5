package in.co.pricematch.pojos;

/**
 * Thrown when a product record is missing a required field.
 * Halts processing of that one record only.
 */
public class InvalidProductException extends IllegalArgumentException {

    public InvalidProductException(String message) {
        super(message);
    }
}
