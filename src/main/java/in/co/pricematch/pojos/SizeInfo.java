package in.co.pricematch.pojos;

import java.util.Locale;
import java.util.Objects;

/**
 * Quantity parsed from a product name, converted to the base unit of its {@link UnitType}.
 *
 * <p>A name with no recognizable size token yields {@link #absent()}. A token that parses to
 * zero is {@link #isPresent() present} but has no {@link #hasMagnitude() magnitude}.</p>
 */
public final class SizeInfo {

    private static final SizeInfo ABSENT = new SizeInfo(0, "", UnitType.UNKNOWN, "", false);

    private final double value;
    private final String unit;
    private final UnitType unitType;
    private final String original;
    private final boolean present;

    private SizeInfo(double value, String unit, UnitType unitType, String original, boolean present) {
        this.value = value;
        this.unit = unit;
        this.unitType = unitType;
        this.original = original;
        this.present = present;
    }

    public static SizeInfo of(double value, String unit, UnitType unitType, String original) {
        if (value < 0) {
            throw new IllegalArgumentException("Size value must be >= 0: " + value);
        }
        return new SizeInfo(value, unit, unitType, original, true);
    }

    public static SizeInfo absent() {
        return ABSENT;
    }

    public double getValue() { return value; }
    public String getUnit() { return unit; }
    public UnitType getUnitType() { return unitType; }
    public String getOriginal() { return original; }
    public boolean isPresent() { return present; }

    public boolean hasMagnitude() {
        return present && value > 0;
    }

    /**
     * Short human-readable form used in warnings, e.g. {@code 5000g} or {@code 1.5ml}.
     */
    public String describe() {
        if (!present) {
            return "unknown";
        }
        if (value == Math.rint(value)) {
            return String.format(Locale.ROOT, "%d%s", (long) value, unit);
        }
        return String.format(Locale.ROOT, "%.2f%s", value, unit);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SizeInfo that = (SizeInfo) o;
        return Double.compare(that.value, value) == 0 && present == that.present
                && unit.equals(that.unit) && unitType == that.unitType && original.equals(that.original);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, unit, unitType, original, present);
    }

    @Override
    public String toString() {
        return "SizeInfo{" + describe() + ", type=" + unitType.getValue() + ", original='" + original + "'}";
    }
}
