package in.co.pricematch.pojos;

/**
 * A shelf price expressed per standard unit of its size class.
 * Per-unit fields are null when they do not apply or the size could not be read.
 */
public final class NormalizedPrice {

    public final double originalPrice;
    public final String productName;
    public final double sizeValue;
    public final String baseUnit;
    public final UnitType unitType;
    public final SizeConfidence confidence;

    public final Double pricePer100g;
    public final Double pricePerLb;
    public final Double pricePerLiter;
    public final Double pricePerUnit;

    public NormalizedPrice(double originalPrice, String productName, double sizeValue, String baseUnit,
                           UnitType unitType, SizeConfidence confidence, Double pricePer100g,
                           Double pricePerLb, Double pricePerLiter, Double pricePerUnit) {
        this.originalPrice = originalPrice;
        this.productName = productName;
        this.sizeValue = sizeValue;
        this.baseUnit = baseUnit;
        this.unitType = unitType;
        this.confidence = confidence;
        this.pricePer100g = pricePer100g;
        this.pricePerLb = pricePerLb;
        this.pricePerLiter = pricePerLiter;
        this.pricePerUnit = pricePerUnit;
    }

    public boolean isKnown() {
        return confidence != SizeConfidence.UNKNOWN;
    }

    @Override
    public String toString() {
        return "NormalizedPrice{price=" + originalPrice + ", size=" + sizeValue + baseUnit
                + ", confidence=" + confidence.getValue() + ", per100g=" + pricePer100g
                + ", perLiter=" + pricePerLiter + ", perUnit=" + pricePerUnit + "}";
    }
}
