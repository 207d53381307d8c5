package in.co.pricematch.pojos;

/**
 * Price of a primary product against its matched competitor product, per standard unit when
 * both sizes allow it and as absolute shelf prices otherwise.
 */
public final class PriceComparison {

    public enum Basis {
        ABSOLUTE("absolute", null),
        PER_100G("per_100g", "$/100g"),
        PER_LITER("per_liter", "$/L"),
        PER_UNIT("per_unit", "$/unit");

        private final String value;
        private final String unitLabel;

        Basis(String value, String unitLabel) {
            this.value = value;
            this.unitLabel = unitLabel;
        }

        public String getValue() { return value; }
        public String getUnitLabel() { return unitLabel; }
    }

    public final NormalizedPrice primary;
    public final NormalizedPrice competitor;
    public final Basis basis;
    /** Per-unit prices on {@link #basis}; null when the basis is ABSOLUTE. */
    public final Double primaryPerUnit;
    public final Double competitorPerUnit;
    /** {@code competitorPerUnit - primaryPerUnit}; 0 when the basis is ABSOLUTE. */
    public final double normalizedSavings;
    /** Savings relative to the primary per-unit price, in percent. */
    public final double normalizedSavingsPct;
    public final SizeConfidence sizeConfidence;

    public PriceComparison(NormalizedPrice primary, NormalizedPrice competitor, Basis basis,
                           Double primaryPerUnit, Double competitorPerUnit, double normalizedSavings,
                           double normalizedSavingsPct, SizeConfidence sizeConfidence) {
        this.primary = primary;
        this.competitor = competitor;
        this.basis = basis;
        this.primaryPerUnit = primaryPerUnit;
        this.competitorPerUnit = competitorPerUnit;
        this.normalizedSavings = normalizedSavings;
        this.normalizedSavingsPct = normalizedSavingsPct;
        this.sizeConfidence = sizeConfidence;
    }

    public boolean canCompareNormalized() {
        return basis != Basis.ABSOLUTE;
    }

    @Override
    public String toString() {
        return String.format("PriceComparison{basis=%s, primary=%s, competitor=%s, savingsPct=%.1f, confidence=%s}",
                basis.getValue(), primaryPerUnit, competitorPerUnit, normalizedSavingsPct, sizeConfidence.getValue());
    }
}
