package in.co.pricematch.services;

import in.co.pricematch.pojos.SizeInfo;
import in.co.pricematch.pojos.UnitType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SizeExtractorTest {

    private SizeExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new SizeExtractor();
    }

    // =========================================================================
    // extract
    // =========================================================================

    @Test
    void testExtract_KilogramsConvertedToGrams() {
        SizeInfo size = extractor.extract("Basmati Rice 5kg");

        assertTrue(size.isPresent());
        assertEquals(5000.0, size.getValue(), 1e-9);
        assertEquals("g", size.getUnit());
        assertEquals(UnitType.WEIGHT, size.getUnitType());
        assertEquals("5kg", size.getOriginal());
    }

    @Test
    void testExtract_PoundsAndOunces() {
        assertEquals(2 * 453.6, extractor.extract("Atta 2 lb bag").getValue(), 1e-9);
        assertEquals(2 * 453.6, extractor.extract("Atta 2 LBS").getValue(), 1e-9);
        assertEquals(7 * 28.35, extractor.extract("Masala 7oz").getValue(), 1e-9);
    }

    @Test
    void testExtract_DecimalLitersToMilliliters() {
        SizeInfo size = extractor.extract("Mustard Oil 1.5 L");

        assertEquals(1500.0, size.getValue(), 1e-9);
        assertEquals("ml", size.getUnit());
        assertEquals(UnitType.VOLUME, size.getUnitType());
    }

    @Test
    void testExtract_CountUnits() {
        SizeInfo pieces = extractor.extract("Samosa 12 pc");
        SizeInfo each = extractor.extract("Mango 1 each");

        assertEquals(UnitType.COUNT, pieces.getUnitType());
        assertEquals("pcs", pieces.getUnit());
        assertEquals(12.0, pieces.getValue(), 1e-9);
        assertEquals("each", each.getUnit());
    }

    @Test
    void testExtract_SpelledOutAndPluralUnits() {
        SizeInfo ltr = extractor.extract("Mustard Oil 1 Ltr");
        assertEquals(1000.0, ltr.getValue(), 1e-9);
        assertEquals(UnitType.VOLUME, ltr.getUnitType());
        assertEquals("1 Ltr", ltr.getOriginal());

        assertEquals(5000.0, extractor.extract("Basmati Rice 5kgs").getValue(), 1e-9);
        assertEquals(500.0, extractor.extract("Atta 500 grams").getValue(), 1e-9);
        assertEquals(1000.0, extractor.extract("Ghee 1 litre").getValue(), 1e-9);
        assertEquals(2000.0, extractor.extract("Refined Oil 2 liters").getValue(), 1e-9);
        assertEquals(UnitType.COUNT, extractor.extract("Samosa 6 pieces").getUnitType());
    }

    @Test
    void testExtract_FirstTokenWins() {
        SizeInfo size = extractor.extract("Toor Dal 500g pack of 2kg");

        assertEquals(500.0, size.getValue(), 1e-9);
        assertEquals("500g", size.getOriginal());
    }

    @Test
    void testExtract_UnitMustEndAtWordBoundary() {
        assertFalse(extractor.extract("Ghee 5 glasses").isPresent());
        assertFalse(extractor.extract("Pack of 3 large").isPresent());
    }

    @Test
    void testExtract_NoSizeIsAbsent() {
        SizeInfo size = extractor.extract("Tata Salt");

        assertFalse(size.isPresent());
        assertFalse(size.hasMagnitude());
        assertEquals(UnitType.UNKNOWN, size.getUnitType());
        assertEquals("", size.getOriginal());
        assertSame(SizeInfo.absent(), extractor.extract(null));
    }

    @Test
    void testExtract_ZeroQuantityIsPresentWithoutMagnitude() {
        SizeInfo size = extractor.extract("Sample 0g");

        assertTrue(size.isPresent());
        assertFalse(size.hasMagnitude());
    }

    // =========================================================================
    // similarity
    // =========================================================================

    @Test
    void testSimilarity_IdenticalSizes() {
        assertEquals(1.0, extractor.similarity("Tata Salt 1kg", "Tata Salt 1000g"), 1e-9);
        assertEquals(1.0, extractor.similarity("Oil 1l", "Oil 1000 ml"), 1e-9);
    }

    @Test
    void testSimilarity_AliasSpellingsMatchShortUnits() {
        assertEquals(1.0, extractor.similarity("Mustard Oil 1 Ltr", "Mustard Oil 1L"), 1e-9);
        assertEquals(1.0, extractor.similarity("Basmati Rice 5kgs", "Basmati Rice 5kg"), 1e-9);
        assertEquals(1.0, extractor.similarity("Atta 500 grams", "Atta 0.5 kg"), 1e-9);
    }

    @Test
    void testSimilarity_WithinTwoPercentIsExact() {
        assertEquals(1.0, extractor.similarity("Rice 1kg", "Rice 990g"), 1e-9);
    }

    @Test
    void testSimilarity_RatioBands() {
        // 2000 / 5000 = 0.4 -> 0.4 * 0.3
        assertEquals(0.12, extractor.similarity("Basmati Rice 5kg", "Basmati Rice 2kg"), 1e-9);
        // 600 / 1000 = 0.6 -> 0.6 * 0.6
        assertEquals(0.36, extractor.similarity("Rice 1kg", "Rice 600g"), 1e-9);
        // 800 / 1000 = 0.8 -> unchanged
        assertEquals(0.8, extractor.similarity("Rice 1kg", "Rice 800g"), 1e-9);
    }

    @Test
    void testSimilarity_DifferentUnitTypes() {
        assertEquals(0.1, extractor.similarity("Oil 1kg", "Oil 1l"), 1e-9);
        assertEquals(0.3, extractor.similarity("Oil 1kg", "Oil"), 1e-9);
    }

    @Test
    void testSimilarity_NoMagnitudeIsNeutral() {
        assertEquals(0.5, extractor.similarity("Salt", "Sugar"), 1e-9);
        assertEquals(0.5, extractor.similarity("Sample 0g", "Rice 1kg"), 1e-9);
    }

    @Test
    void testSimilarity_SymmetricAndMonotonic() {
        double previous = 1.0;
        for (int grams = 1000; grams >= 50; grams -= 50) {
            String other = "Rice " + grams + "g";
            double forward = extractor.similarity("Rice 1kg", other);
            double backward = extractor.similarity(other, "Rice 1kg");

            assertEquals(forward, backward, 1e-12);
            assertTrue(forward <= previous + 1e-12, "not monotonic at " + grams + "g");
            previous = forward;
        }
    }
}
