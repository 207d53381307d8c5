package in.co.pricematch.pojos;

/**
 * Magnitude class of a product size. Values are always stored in the base unit of the class:
 * grams for WEIGHT, milliliters for VOLUME, pieces for COUNT.
 */
public enum UnitType {
    WEIGHT,
    VOLUME,
    COUNT,
    UNKNOWN;

    public String getValue() {
        return name().toLowerCase();
    }
}
