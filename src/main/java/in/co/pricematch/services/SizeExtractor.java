package in.co.pricematch.services;

import in.co.pricematch.pojos.SizeInfo;
import in.co.pricematch.pojos.UnitType;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static in.co.pricematch.services.MatchingConfig.*;

/**
 * Parses the first quantity+unit token of a product name and compares sizes.
 * Stateless and thread-safe.
 */
public class SizeExtractor {

    private static final Pattern SIZE_PATTERN = Pattern.compile(
            "(\\d+(?:\\.\\d+)?)\\s*(kgs|kg|kilograms?|grams?|gms|gm|g|lbs|lb|oz|ml"
                    + "|litres?|liters?|ltrs?|l|pieces|piece|pcs|pc|each)\\b",
            Pattern.CASE_INSENSITIVE);

    public SizeInfo extract(String name) {
        if (name == null) {
            return SizeInfo.absent();
        }
        Matcher matcher = SIZE_PATTERN.matcher(name);
        if (!matcher.find()) {
            return SizeInfo.absent();
        }
        double value = Double.parseDouble(matcher.group(1));
        String unit = matcher.group(2).toLowerCase(Locale.ROOT);
        String original = matcher.group(0);

        switch (unit) {
            case "kg":
            case "kgs":
            case "kilogram":
            case "kilograms":
                return SizeInfo.of(value * GRAMS_PER_KG, "g", UnitType.WEIGHT, original);
            case "lb":
            case "lbs":
                return SizeInfo.of(value * GRAMS_PER_LB, "g", UnitType.WEIGHT, original);
            case "oz":
                return SizeInfo.of(value * GRAMS_PER_OZ, "g", UnitType.WEIGHT, original);
            case "g":
            case "gm":
            case "gms":
            case "gram":
            case "grams":
                return SizeInfo.of(value, "g", UnitType.WEIGHT, original);
            case "l":
            case "ltr":
            case "ltrs":
            case "liter":
            case "liters":
            case "litre":
            case "litres":
                return SizeInfo.of(value * ML_PER_LITER, "ml", UnitType.VOLUME, original);
            case "ml":
                return SizeInfo.of(value, "ml", UnitType.VOLUME, original);
            case "pc":
            case "pcs":
            case "piece":
            case "pieces":
                return SizeInfo.of(value, "pcs", UnitType.COUNT, original);
            case "each":
                return SizeInfo.of(value, "each", UnitType.COUNT, original);
            default:
                return SizeInfo.of(value, unit, UnitType.UNKNOWN, original);
        }
    }

    /**
     * Similarity of two sizes in [0, 1]. Symmetric, and for one unit type non-increasing as the
     * magnitude ratio falls.
     */
    public double similarity(SizeInfo a, SizeInfo b) {
        if (a.getUnitType() != b.getUnitType()) {
            if (a.getUnitType() == UnitType.UNKNOWN || b.getUnitType() == UnitType.UNKNOWN) {
                return SIZE_UNKNOWN_TYPE_SIMILARITY;
            }
            return SIZE_DIFFERENT_TYPE_SIMILARITY;
        }
        if (!a.hasMagnitude() || !b.hasMagnitude()) {
            return SIZE_NO_MAGNITUDE_SIMILARITY;
        }

        double ratio = Math.min(a.getValue(), b.getValue()) / Math.max(a.getValue(), b.getValue());
        if (Math.abs(ratio - 1.0) < SIZE_EXACT_TOLERANCE) {
            return 1.0;
        }
        if (ratio < 0.5) {
            return ratio * 0.3;
        }
        if (ratio < 0.75) {
            return ratio * 0.6;
        }
        return ratio;
    }

    public double similarity(String nameA, String nameB) {
        return similarity(extract(nameA), extract(nameB));
    }
}
