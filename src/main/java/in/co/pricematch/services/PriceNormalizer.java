package in.co.pricematch.services;

import in.co.pricematch.pojos.NormalizedPrice;
import in.co.pricematch.pojos.PriceComparison;
import in.co.pricematch.pojos.ProductRecord;
import in.co.pricematch.pojos.SizeConfidence;
import in.co.pricematch.pojos.UnitType;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts shelf prices to per-unit prices (per 100 g, per liter, per piece) so products of
 * different pack sizes can be compared.
 *
 * <p>Size patterns are broader than {@link SizeExtractor}'s: spelled-out units, fluid ounces
 * and multi-packs ({@code 12 x 200g}) are recognized. Multi-packs are checked first.</p>
 */
public class PriceNormalizer {

    private static final double GRAMS_PER_LB = 453.592;
    private static final double GRAMS_PER_OZ = 28.3495;
    private static final double ML_PER_FL_OZ = 29.5735;

    private static final Pattern MULTI_PACK = Pattern.compile(
            "(\\d+)\\s*x\\s*(\\d+(?:\\.\\d+)?)\\s*(kg|gms|gm|g|ml|l)\\b");
    private static final Pattern ANY_NUMBER = Pattern.compile("(\\d+(?:\\.\\d+)?)");

    private static final List<SizePattern> SIZE_PATTERNS = List.of(
            new SizePattern("(\\d+(?:\\.\\d+)?)\\s*(?:kg|kgs|kilogram|kilograms)\\b", UnitType.WEIGHT, 1000.0, "g"),
            new SizePattern("(\\d+(?:\\.\\d+)?)\\s*(?:g|gm|gms|gram|grams)\\b", UnitType.WEIGHT, 1.0, "g"),
            new SizePattern("(\\d+(?:\\.\\d+)?)\\s*(?:lb|lbs|pound|pounds)\\b", UnitType.WEIGHT, GRAMS_PER_LB, "g"),
            new SizePattern("(\\d+(?:\\.\\d+)?)\\s*(?:fl\\.?\\s*oz|fluid\\s*ounces?)\\b", UnitType.VOLUME, ML_PER_FL_OZ, "ml"),
            new SizePattern("(\\d+(?:\\.\\d+)?)\\s*(?:oz|ounce|ounces)\\b", UnitType.WEIGHT, GRAMS_PER_OZ, "g"),
            new SizePattern("(\\d+(?:\\.\\d+)?)\\s*(?:l|ltr|ltrs|liter|liters|litre|litres)\\b", UnitType.VOLUME, 1000.0, "ml"),
            new SizePattern("(\\d+(?:\\.\\d+)?)\\s*(?:ml|milliliter|milliliters|millilitre|millilitres)\\b", UnitType.VOLUME, 1.0, "ml"),
            new SizePattern("(\\d+)\\s*(?:pcs?|pieces?|each|count)\\b", UnitType.COUNT, 1.0, "pcs")
    );

    public NormalizedPrice normalize(double price, String productName) {
        Measurement size = measure(productName);
        Double per100g = null;
        Double perLb = null;
        Double perLiter = null;
        Double perUnit = null;

        if (size.value > 0 && size.confidence != SizeConfidence.UNKNOWN) {
            if (size.unitType == UnitType.WEIGHT) {
                per100g = price / size.value * 100.0;
                perLb = price / size.value * GRAMS_PER_LB;
            } else if (size.unitType == UnitType.VOLUME) {
                perLiter = price / size.value * 1000.0;
            } else if (size.unitType == UnitType.COUNT) {
                perUnit = price / size.value;
            }
        }
        return new NormalizedPrice(price, productName, size.value, size.baseUnit, size.unitType,
                size.confidence, per100g, perLb, perLiter, perUnit);
    }

    public PriceComparison compare(ProductRecord primary, ProductRecord competitor) {
        return compare(priceOf(primary), primary.getName(), priceOf(competitor), competitor.getName());
    }

    public PriceComparison compare(double primaryPrice, String primaryName, double competitorPrice, String competitorName) {
        NormalizedPrice p = normalize(primaryPrice, primaryName);
        NormalizedPrice c = normalize(competitorPrice, competitorName);
        SizeConfidence confidence = SizeConfidence.weakest(p.confidence, c.confidence);

        PriceComparison.Basis basis = PriceComparison.Basis.ABSOLUTE;
        Double primaryPerUnit = null;
        Double competitorPerUnit = null;
        if (p.isKnown() && c.isKnown()) {
            if (positive(p.pricePer100g) && positive(c.pricePer100g)) {
                basis = PriceComparison.Basis.PER_100G;
                primaryPerUnit = p.pricePer100g;
                competitorPerUnit = c.pricePer100g;
            } else if (positive(p.pricePerLiter) && positive(c.pricePerLiter)) {
                basis = PriceComparison.Basis.PER_LITER;
                primaryPerUnit = p.pricePerLiter;
                competitorPerUnit = c.pricePerLiter;
            } else if (positive(p.pricePerUnit) && positive(c.pricePerUnit)) {
                basis = PriceComparison.Basis.PER_UNIT;
                primaryPerUnit = p.pricePerUnit;
                competitorPerUnit = c.pricePerUnit;
            }
        }

        double savings = 0.0;
        double savingsPct = 0.0;
        if (basis != PriceComparison.Basis.ABSOLUTE) {
            savings = competitorPerUnit - primaryPerUnit;
            savingsPct = primaryPerUnit > 0 ? savings / primaryPerUnit * 100.0 : 0.0;
        }
        return new PriceComparison(p, c, basis, primaryPerUnit, competitorPerUnit, savings, savingsPct, confidence);
    }

    Measurement measure(String productName) {
        if (productName == null) {
            return Measurement.NONE;
        }
        String lower = productName.toLowerCase(Locale.ROOT);

        Matcher multi = MULTI_PACK.matcher(lower);
        if (multi.find()) {
            double count = Double.parseDouble(multi.group(1));
            double each = Double.parseDouble(multi.group(2));
            String unit = multi.group(3);
            switch (unit) {
                case "kg":
                    return new Measurement(count * each * 1000.0, "g", UnitType.WEIGHT, SizeConfidence.HIGH);
                case "l":
                    return new Measurement(count * each * 1000.0, "ml", UnitType.VOLUME, SizeConfidence.HIGH);
                case "ml":
                    return new Measurement(count * each, "ml", UnitType.VOLUME, SizeConfidence.HIGH);
                default:
                    return new Measurement(count * each, "g", UnitType.WEIGHT, SizeConfidence.HIGH);
            }
        }

        for (SizePattern pattern : SIZE_PATTERNS) {
            Matcher m = pattern.regex.matcher(lower);
            if (m.find()) {
                double value = Double.parseDouble(m.group(1)) * pattern.multiplier;
                SizeConfidence confidence = m.group(0).length() > 3 ? SizeConfidence.HIGH : SizeConfidence.MEDIUM;
                return new Measurement(value, pattern.baseUnit, pattern.unitType, confidence);
            }
        }

        Matcher number = ANY_NUMBER.matcher(lower);
        if (number.find()) {
            return new Measurement(Double.parseDouble(number.group(1)), "unknown", UnitType.UNKNOWN, SizeConfidence.LOW);
        }
        return Measurement.NONE;
    }

    private static double priceOf(ProductRecord product) {
        return product.getPrice() == null ? 0.0 : product.getPrice();
    }

    private static boolean positive(Double value) {
        return value != null && value > 0;
    }

    private static final class SizePattern {
        final Pattern regex;
        final UnitType unitType;
        final double multiplier;
        final String baseUnit;

        SizePattern(String regex, UnitType unitType, double multiplier, String baseUnit) {
            this.regex = Pattern.compile(regex);
            this.unitType = unitType;
            this.multiplier = multiplier;
            this.baseUnit = baseUnit;
        }
    }

    static final class Measurement {
        static final Measurement NONE = new Measurement(0.0, "unknown", UnitType.UNKNOWN, SizeConfidence.UNKNOWN);

        final double value;
        final String baseUnit;
        final UnitType unitType;
        final SizeConfidence confidence;

        Measurement(double value, String baseUnit, UnitType unitType, SizeConfidence confidence) {
            this.value = value;
            this.baseUnit = baseUnit;
            this.unitType = unitType;
            this.confidence = confidence;
        }
    }
}
