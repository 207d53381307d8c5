package in.co.pricematch.services;

import in.co.pricematch.pojos.CategoryRule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RuleStoreLoaderTest {

    // =========================================================================
    // Classpath loading
    // =========================================================================

    @Test
    void testFromClasspath_LoadsAllTables() {
        RuleStore store = RuleStoreLoader.fromClasspath("test-rules");

        assertEquals(14, store.getCategories().size());
        assertEquals(2, store.forbiddenPairCount());
        assertEquals(3, store.getForbiddenPatterns().size());
        assertEquals(2, store.getSynonymGroups().size());
        assertEquals(List.of("Tata", "Everest", "Badshah", "India Gate", "Daawat"), store.getBrands());
        assertTrue(store.isStrictCategory("lentils:toor"));
        assertEquals(1, store.getIncompatibleCategories().size());
        assertEquals(0.2, store.penaltyFor("rice", "flour"), 1e-9);
        assertNull(store.penaltyFor("rice", "salt"));
    }

    @Test
    void testFromClasspath_ForbiddenPairsIndexedBothWays() {
        RuleStore store = TestRules.store();

        assertTrue(store.isForbiddenTypePair("salt", "tea"));
        assertTrue(store.isForbiddenTypePair("tea", "salt"));
        assertTrue(store.isForbiddenQualifiedPair("flour:atta", "flour:besan"));
        assertFalse(store.isForbiddenTypePair("salt", "rice"));
    }

    @Test
    void testFromClasspath_MalformedPatternKeptButNeverParsable() {
        RuleStore store = TestRules.store();

        long unparsable = store.getForbiddenPatterns().stream().filter(p -> !p.isParsable()).count();
        assertEquals(1, unparsable);
    }

    @Test
    void testFromClasspath_MissingPrefixGivesEmptyStore() {
        RuleStore store = RuleStoreLoader.fromClasspath("no-such-rules/");

        assertTrue(store.getCategories().isEmpty());
        assertEquals(0, store.forbiddenPairCount());
        assertTrue(store.getBrands().isEmpty());
    }

    @Test
    void testLoadDefaults_BundledRulesPresent() {
        RuleStore store = RuleStoreLoader.loadDefaults();

        assertFalse(store.getCategories().isEmpty());
        assertTrue(store.getBrands().contains("Tata"));
        assertTrue(store.forbiddenPairCount() > 0);
    }

    // =========================================================================
    // Directory loading
    // =========================================================================

    @Test
    void testFromDirectory_PartialConfiguration(@TempDir Path dir) throws IOException {
        write(dir, RuleStoreLoader.CLASSIFICATIONS_FILE,
                "{\"categories\": [{\"type\": \"Ghee\", \"keywords\": [\"Ghee\", \"Clarified Butter\"]}]}");

        RuleStore store = RuleStoreLoader.fromDirectory(dir);

        assertEquals(1, store.getCategories().size());
        CategoryRule rule = store.getCategories().get(0);
        assertEquals("ghee", rule.getType());
        assertEquals("generic", rule.getSubtype());
        assertEquals(List.of("ghee", "clarified butter"), rule.getKeywords());
        assertTrue(store.getSynonymGroups().isEmpty());
        assertTrue(store.getForbiddenPatterns().isEmpty());
    }

    @Test
    void testFromDirectory_UnreadableFileDegradesToEmpty(@TempDir Path dir) throws IOException {
        write(dir, RuleStoreLoader.BRANDS_FILE, "{ not json");
        write(dir, RuleStoreLoader.SYNONYMS_FILE,
                "{\"groups\": [{\"canonical\": \"turmeric\", \"terms\": [\"haldi\"]}]}");

        RuleStore store = RuleStoreLoader.fromDirectory(dir);

        assertTrue(store.getBrands().isEmpty());
        assertEquals(1, store.getSynonymGroups().size());
    }

    @Test
    void testFromDirectory_SkipsCategoryWithoutType(@TempDir Path dir) throws IOException {
        write(dir, RuleStoreLoader.CLASSIFICATIONS_FILE,
                "{\"categories\": [{\"subtype\": \"x\", \"keywords\": [\"x\"]}, {\"type\": \"salt\", \"keywords\": [\"salt\"]}]}");

        RuleStore store = RuleStoreLoader.fromDirectory(dir);

        assertEquals(1, store.getCategories().size());
        assertEquals("salt", store.getCategories().get(0).getType());
    }

    @Test
    void testFromDirectory_PenaltyKeysMatchLowercasedTypes(@TempDir Path dir) throws IOException {
        write(dir, RuleStoreLoader.FORBIDDEN_FILE,
                "{\"pairs\": [], \"rules\": {\"penalty_multipliers\": {\" different_Rice_vs_FLOUR \": 0.25}}}");

        RuleStore store = RuleStoreLoader.fromDirectory(dir);

        assertEquals(0.25, store.penaltyFor("rice", "flour"), 1e-9);
        assertNull(store.penaltyFor("flour", "rice"));
    }

    private static void write(Path dir, String file, String json) throws IOException {
        Files.write(dir.resolve(file), json.getBytes(StandardCharsets.UTF_8));
    }
}
