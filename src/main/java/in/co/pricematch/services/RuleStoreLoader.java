package in.co.pricematch.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Loads the four rule documents into a {@link RuleStore}:
 *
 * <pre>
 *   classifications.json  categories[], matching_rules.strict_category_matching[], matching_rules.incompatible_categories[][]
 *   forbidden.json        pairs[][], rules.penalty_multipliers{}
 *   synonyms.json         groups[{canonical, terms[]}]
 *   brands.json           known_brands[]
 * </pre>
 *
 * Every document is optional. A missing or unreadable file is logged and its tables stay
 * empty; loading never fails because of rule data.
 */
public class RuleStoreLoader {

    public static final String CLASSIFICATIONS_FILE = "classifications.json";
    public static final String FORBIDDEN_FILE = "forbidden.json";
    public static final String SYNONYMS_FILE = "synonyms.json";
    public static final String BRANDS_FILE = "brands.json";

    /** Classpath prefix of the rule set bundled with the library. */
    public static final String DEFAULT_CLASSPATH_PREFIX = "rules/";

    private static final ObjectMapper mapper = new ObjectMapper();

    private RuleStoreLoader() {}

    /**
     * Load the rule set bundled under {@code rules/} on the classpath.
     */
    public static RuleStore loadDefaults() {
        return fromClasspath(DEFAULT_CLASSPATH_PREFIX);
    }

    public static RuleStore fromDirectory(Path directory) {
        long start = LoggingService.logOperationStart("rule_store_load", LoggingService.data("source", String.valueOf(directory)));
        RuleStore store = build(
                readFile(directory.resolve(CLASSIFICATIONS_FILE)),
                readFile(directory.resolve(FORBIDDEN_FILE)),
                readFile(directory.resolve(SYNONYMS_FILE)),
                readFile(directory.resolve(BRANDS_FILE)));
        logLoaded(store, start);
        return store;
    }

    public static RuleStore fromClasspath(String prefix) {
        String base = prefix.endsWith("/") ? prefix : prefix + "/";
        long start = LoggingService.logOperationStart("rule_store_load", LoggingService.data("source", "classpath:" + base));
        RuleStore store = build(
                readResource(base + CLASSIFICATIONS_FILE),
                readResource(base + FORBIDDEN_FILE),
                readResource(base + SYNONYMS_FILE),
                readResource(base + BRANDS_FILE));
        logLoaded(store, start);
        return store;
    }

    // =========================================================================
    // Document reading
    // =========================================================================

    private static JsonNode readFile(Path file) {
        if (!Files.isRegularFile(file)) {
            LoggingService.warn("rule_table_missing", LoggingService.data("file", file.toString()));
            return MissingNode.getInstance();
        }
        try (InputStream in = Files.newInputStream(file)) {
            return mapper.readTree(in);
        } catch (IOException e) {
            LoggingService.warn("rule_table_unreadable", LoggingService.data("file", file.toString(), "error", e.getMessage()));
            return MissingNode.getInstance();
        }
    }

    private static JsonNode readResource(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = RuleStoreLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                LoggingService.warn("rule_table_missing", LoggingService.data("resource", resource));
                return MissingNode.getInstance();
            }
            return mapper.readTree(in);
        } catch (IOException e) {
            LoggingService.warn("rule_table_unreadable", LoggingService.data("resource", resource, "error", e.getMessage()));
            return MissingNode.getInstance();
        }
    }

    // =========================================================================
    // Table parsing
    // =========================================================================

    static RuleStore build(JsonNode classifications, JsonNode forbidden, JsonNode synonyms, JsonNode brands) {
        RuleStore.Builder builder = RuleStore.builder();

        for (JsonNode category : classifications.path("categories")) {
            String type = category.path("type").asText("");
            if (type.isEmpty()) {
                LoggingService.warn("rule_category_skipped", LoggingService.data("reason", "missing type"));
                continue;
            }
            builder.category(type, category.path("subtype").asText("generic"), strings(category.path("keywords")));
        }

        JsonNode matchingRules = classifications.path("matching_rules");
        for (String strict : strings(matchingRules.path("strict_category_matching"))) {
            builder.strictCategory(strict);
        }
        for (JsonNode pair : matchingRules.path("incompatible_categories")) {
            List<String> tokens = strings(pair);
            if (tokens.size() == 2) {
                builder.incompatible(tokens.get(0), tokens.get(1));
            }
        }

        for (JsonNode pair : forbidden.path("pairs")) {
            List<String> tokens = strings(pair);
            if (tokens.size() == 2) {
                builder.forbiddenPair(tokens.get(0), tokens.get(1));
            } else {
                LoggingService.warn("forbidden_pair_skipped", LoggingService.data("pair", pair.toString()));
            }
        }
        Iterator<Map.Entry<String, JsonNode>> penalties = forbidden.path("rules").path("penalty_multipliers").fields();
        while (penalties.hasNext()) {
            Map.Entry<String, JsonNode> entry = penalties.next();
            if (entry.getValue().isNumber()) {
                builder.penaltyMultiplier(entry.getKey(), entry.getValue().asDouble());
            }
        }

        for (JsonNode group : synonyms.path("groups")) {
            String canonical = group.path("canonical").asText("");
            if (!canonical.isEmpty()) {
                builder.synonyms(canonical, strings(group.path("terms")));
            }
        }

        builder.brands(strings(brands.path("known_brands")));
        return builder.build();
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array.isArray()) {
            for (JsonNode node : array) {
                if (node.isTextual()) {
                    values.add(node.asText());
                }
            }
        }
        return values;
    }

    private static void logLoaded(RuleStore store, long start) {
        LoggingService.logOperationEnd("rule_store_load", start, LoggingService.data(
                "categories", store.getCategories().size(),
                "forbiddenPairs", store.forbiddenPairCount(),
                "forbiddenPatterns", store.getForbiddenPatterns().size(),
                "synonymGroups", store.getSynonymGroups().size(),
                "brands", store.getBrands().size()));
    }
}
