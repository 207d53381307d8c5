package in.co.pricematch.services;

import in.co.pricematch.pojos.MatchScore;
import in.co.pricematch.pojos.ProductRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConfidenceCalculatorTest {

    private ConfidenceCalculator calculator;
    private HybridSimilarityScorer scorer;

    @BeforeEach
    void setUp() {
        BagOfWordsEmbeddingModel model = new BagOfWordsEmbeddingModel();
        calculator = TestRules.calculator(model);
        scorer = TestRules.scorer(model);
    }

    private MatchScore score(String primary, String candidate) {
        return calculator.calculate(ProductRecord.of(1L, primary), ProductRecord.of(2L, candidate));
    }

    // =========================================================================
    // Scenarios
    // =========================================================================

    @Test
    void testCalculate_IdenticalProductIsExact() {
        MatchScore result = score("Tata Salt 1kg", "Tata Salt 1kg");

        assertEquals(MatchScore.Outcome.SCORED, result.getOutcome());
        assertTrue(result.getScore() >= 0.9);
        assertEquals(1.0, result.getScore(), 1e-9);
        assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    void testCalculate_DifferentSpicesForbidden() {
        MatchScore result = score("Everest Turmeric Powder 200g", "Badshah Coriander Powder 200g");

        assertEquals(0.0, result.getScore());
        assertEquals(MatchScore.Outcome.FORBIDDEN, result.getOutcome());
        assertEquals(1, result.getWarnings().size());
        assertTrue(result.getWarnings().get(0).contains("Different spices"));
    }

    @Test
    void testCalculate_SignificantSizeMismatchHalvesScore() {
        MatchScore result = score("Basmati Rice 5kg", "Basmati Rice 2kg");

        assertEquals(0.5, result.getScore(), 1e-6);
        assertEquals(List.of("Significant size mismatch: 5000g vs 2000g"), result.getWarnings());
    }

    @Test
    void testCalculate_NoCommonWordsRejected() {
        MatchScore result = score("Tata Salt 1kg", "Daawat Basmati Rice 1kg");

        assertEquals(0.0, result.getScore());
        assertEquals(MatchScore.Outcome.DISSIMILAR, result.getOutcome());
        assertEquals(List.of("Very low name similarity: 0.10"), result.getWarnings());
    }

    @Test
    void testCalculate_ForbiddenTypePair() {
        MatchScore result = score("Tata Salt 1kg", "Tata Tea 1kg");

        assertEquals(0.0, result.getScore());
        assertTrue(result.isRejected());
        assertFalse(result.getWarnings().isEmpty());
    }

    // =========================================================================
    // Category step
    // =========================================================================

    @Test
    void testCalculate_ConfiguredTypePenalty() {
        double base = scorer.similarity("Rice 1kg", "Rice Flour 1kg");

        MatchScore result = score("Rice 1kg", "Rice Flour 1kg");

        assertEquals(base * 0.2 + 0.05, result.getScore(), 1e-9);
        assertEquals(List.of("Type mismatch: rice vs flour"), result.getWarnings());
    }

    @Test
    void testCalculate_StrictSubtypeMismatch() {
        double base = scorer.similarity("Toor Dal 1kg", "Moong Dal 1kg");

        MatchScore result = score("Toor Dal 1kg", "Moong Dal 1kg");

        assertEquals(base * 0.3 + 0.05, result.getScore(), 1e-9);
        assertEquals(List.of("Strict subtype mismatch: toor vs moong"), result.getWarnings());
    }

    @Test
    void testCalculate_SubtypeMismatch() {
        double base = scorer.similarity("Basmati Rice 1kg", "Rice 1kg");

        MatchScore result = score("Basmati Rice 1kg", "Rice 1kg");

        assertEquals(Math.min(base * 0.7 + 0.05, 1.0), result.getScore(), 1e-9);
        assertEquals(List.of("Subtype mismatch: basmati vs generic"), result.getWarnings());
    }

    // =========================================================================
    // Size, price and borderline steps
    // =========================================================================

    @Test
    void testCalculate_UnknownSizesPenalized() {
        MatchScore result = score("Tata Salt", "Tata Salt");

        assertEquals(0.8, result.getScore(), 1e-9);
        assertEquals(List.of("Size difference: unknown vs unknown"), result.getWarnings());
    }

    @Test
    void testCalculate_LargePriceDifference() {
        MatchScore result = calculator.calculate(
                ProductRecord.of(1L, "Tata Salt 1kg", 20.0), ProductRecord.of(2L, "Tata Salt 1kg", 250.0));

        assertEquals(0.6, result.getScore(), 1e-9);
        assertEquals(List.of("Large price difference: 12.5x"), result.getWarnings());
    }

    @Test
    void testCalculate_MediumPriceDifference() {
        MatchScore result = calculator.calculate(
                ProductRecord.of(1L, "Tata Salt 1kg", 120.0), ProductRecord.of(2L, "Tata Salt 1kg", 20.0));

        assertEquals(0.8, result.getScore(), 1e-9);
        assertEquals(List.of("Price difference: 6.0x"), result.getWarnings());
    }

    @Test
    void testCalculate_ZeroPriceIgnored() {
        MatchScore result = calculator.calculate(
                ProductRecord.of(1L, "Tata Salt 1kg", 0.0), ProductRecord.of(2L, "Tata Salt 1kg", 500.0));

        assertEquals(1.0, result.getScore(), 1e-9);
        assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    void testCalculate_BorderlineWithTwoCommonWordsUnchanged() {
        // 1.0 -> size unknown x0.8 -> price 6x x0.8 = 0.64
        MatchScore result = calculator.calculate(
                ProductRecord.of(1L, "Tata Salt", 20.0), ProductRecord.of(2L, "Tata Salt", 120.0));

        assertEquals(0.64, result.getScore(), 1e-9);
        assertEquals(2, result.getWarnings().size());
    }

    @Test
    void testCalculate_BorderlineWithOneCommonWordPenalized() {
        // 1.0 -> size unknown x0.8 -> price 6x x0.8 = 0.64 -> one common word x0.7
        MatchScore result = calculator.calculate(
                ProductRecord.of(1L, "Salt", 20.0), ProductRecord.of(2L, "Salt", 120.0));

        assertEquals(0.448, result.getScore(), 1e-9);
        assertEquals(List.of("Size difference: unknown vs unknown", "Price difference: 6.0x",
                "Insufficient common meaningful words"), result.getWarnings());
    }

    @Test
    void testCalculate_AlwaysWithinUnitInterval() {
        List<String> names = List.of("Tata Salt 1kg", "Salt", "Basmati Rice 5kg", "Rice Flour 1kg",
                "Toor Dal 500g", "Moong Dal 1kg", "Everest Turmeric 100g", "Mustard Oil 1l", "Desi Ghee 1l",
                "Tata Tea 250g", "Daawat Basmati Rice 1kg");
        for (String a : names) {
            for (String b : names) {
                double value = score(a, b).getScore();
                assertTrue(value >= 0.0 && value <= 1.0, a + " / " + b + " = " + value);
            }
        }
    }

    @Test
    void testMeaningfulCommonWords_IgnoresUnitTokens() {
        assertEquals(2, ConfidenceCalculator.meaningfulCommonWords("Tata Salt kg", "tata salt KG"));
        assertEquals(1, ConfidenceCalculator.meaningfulCommonWords("Salt 1 kg", "Salt 2 kg"));
    }
}
