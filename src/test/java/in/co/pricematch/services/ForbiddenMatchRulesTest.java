package in.co.pricematch.services;

import in.co.pricematch.pojos.Classification;
import in.co.pricematch.pojos.ForbiddenCheck;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ForbiddenMatchRulesTest {

    private CategoryClassifier classifier;
    private ForbiddenMatchRules rules;

    @BeforeEach
    void setUp() {
        classifier = new CategoryClassifier(TestRules.store());
        rules = new ForbiddenMatchRules(TestRules.store());
    }

    private ForbiddenCheck check(String a, String b) {
        return rules.check(a, b, classifier.classify(a), classifier.classify(b));
    }

    // =========================================================================
    // Configured rules
    // =========================================================================

    @Test
    void testCheck_QualifiedPair() {
        ForbiddenCheck result = check("Besan 1kg", "Atta 1kg");

        assertTrue(result.isForbidden());
        assertEquals("Forbidden type combination: flour:besan vs flour:atta", result.getReason());
    }

    @Test
    void testCheck_TypePairBothOrders() {
        ForbiddenCheck forward = check("Tata Salt 1kg", "Tata Tea 500g");
        ForbiddenCheck backward = check("Tata Tea 500g", "Tata Salt 1kg");

        assertTrue(forward.isForbidden());
        assertEquals("Forbidden type combination: salt vs tea", forward.getReason());
        assertTrue(backward.isForbidden());
        assertEquals("Forbidden type combination: tea vs salt", backward.getReason());
    }

    @Test
    void testCheck_Pattern() {
        ForbiddenCheck result = check("Tata Salt 1kg", "Masala Namkeen 200g");

        assertTrue(result.isForbidden());
        assertEquals("Matches forbidden pattern: chips|namkeen vs salt:table", result.getReason());
    }

    @Test
    void testCheck_IncompatibleCategories() {
        ForbiddenCheck result = check("Mustard Oil 1l", "Desi Ghee 1l");

        assertTrue(result.isForbidden());
        assertEquals("Incompatible categories: oil vs ghee", result.getReason());
    }

    // =========================================================================
    // Built-in exclusions
    // =========================================================================

    @Test
    void testCheck_DifferentSpices() {
        ForbiddenCheck result = check("Everest Turmeric Powder 200g", "Badshah Coriander Powder 200g");

        assertTrue(result.isForbidden());
        assertEquals("Different spices: turmeric vs coriander", result.getReason());
    }

    @Test
    void testCheck_SameSpiceAllowed() {
        assertFalse(check("Everest Turmeric Powder 200g", "Badshah Turmeric Powder 100g").isForbidden());
    }

    @Test
    void testCheck_BakingAgentsVsSpices() {
        ForbiddenCheck powder = check("Baking Powder 100g", "Chili Powder 100g");
        ForbiddenCheck soda = check("Garam Masala 100g", "Baking Soda 100g");

        assertTrue(powder.isForbidden());
        assertEquals("Baking agents cannot match with spices", powder.getReason());
        assertTrue(soda.isForbidden());
    }

    @Test
    void testCheck_CoconutVsCurry() {
        ForbiddenCheck result = check("Coconut Powder 200g", "Curry Powder 200g");

        assertTrue(result.isForbidden());
        assertEquals("Coconut products cannot match with curry products", result.getReason());
    }

    @Test
    void testCheck_UnrelatedAllowed() {
        ForbiddenCheck result = check("Tata Salt 1kg", "Catch Salt 1kg");

        assertFalse(result.isForbidden());
        assertEquals("", result.getReason());
    }

    @Test
    void testCheck_EmptyRulesStillApplyBuiltIns() {
        ForbiddenMatchRules bare = new ForbiddenMatchRules(RuleStore.empty());
        Classification other = Classification.other();

        assertTrue(bare.check("Turmeric 100g", "Cumin 100g", other, other).isForbidden());
        assertFalse(bare.check("Salt", "Tea", other, other).isForbidden());
    }
}
