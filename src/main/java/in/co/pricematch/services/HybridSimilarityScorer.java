package in.co.pricematch.services;

import in.co.pricematch.pojos.ProductRecord;
import in.co.pricematch.pojos.SizeInfo;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static in.co.pricematch.services.MatchingConfig.*;

/**
 * Name similarity blending sentence-embedding cosine (semantic) with token-sort ratio
 * (lexical), followed by a brand adjustment.
 *
 * <pre>
 *   hybrid = 0.4 * semantic + 0.6 * lexical
 *   same brand      -> min(hybrid + 0.1, 1.0)
 *   different brand -> hybrid * 0.85
 * </pre>
 *
 * Names sharing no word after normalization short-circuit to 0.1 without touching the
 * embedding model.
 */
public class HybridSimilarityScorer {

    private final RuleStore rules;
    private final SizeExtractor sizeExtractor;
    private final EmbeddingCache embeddings;

    public HybridSimilarityScorer(RuleStore rules, SizeExtractor sizeExtractor, EmbeddingCache embeddings) {
        this.rules = rules;
        this.sizeExtractor = sizeExtractor;
        this.embeddings = embeddings;
    }

    public double similarity(String nameA, String nameB) {
        return similarity(nameA, nameB, extractBrand(nameA), extractBrand(nameB));
    }

    /**
     * Like {@link #similarity(String, String)}. A brand set on the record is used only when no
     * known brand occurs in the name.
     */
    public double similarity(ProductRecord a, ProductRecord b) {
        return similarity(a.getName(), b.getName(), resolveBrand(a), resolveBrand(b));
    }

    private double similarity(String nameA, String nameB, String brandA, String brandB) {
        String normA = normalize(nameA);
        String normB = normalize(nameB);
        if (normA.isEmpty() || normB.isEmpty()) {
            return 0.0;
        }

        Set<String> common = new HashSet<>(Arrays.asList(normA.split(" ")));
        common.retainAll(Arrays.asList(normB.split(" ")));
        if (common.isEmpty()) {
            return NO_COMMON_WORDS_SIMILARITY;
        }

        double semantic = embeddings.cosine(normA, normB);
        double lexical = LexicalSimilarity.tokenSortRatio(normA, normB);
        double hybrid = SEMANTIC_WEIGHT * semantic + LEXICAL_WEIGHT * lexical;

        if (brandA != null && brandB != null) {
            if (brandA.equalsIgnoreCase(brandB)) {
                hybrid = Math.min(hybrid + SAME_BRAND_BONUS, 1.0);
            } else {
                hybrid *= DIFFERENT_BRAND_FACTOR;
            }
        }
        return hybrid;
    }

    /**
     * Strip the size token, lowercase, turn punctuation into spaces and drop stop words.
     */
    public String normalize(String name) {
        if (name == null) {
            return "";
        }
        String working = name;
        SizeInfo size = sizeExtractor.extract(name);
        if (size.isPresent()) {
            working = working.replace(size.getOriginal(), "");
        }
        working = working.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}\\s]", " ");

        List<String> words = new ArrayList<>();
        for (String word : working.trim().split("\\s+")) {
            if (!word.isEmpty() && !STOP_WORDS.contains(word)) {
                words.add(word);
            }
        }
        return String.join(" ", words);
    }

    /**
     * First configured brand, in declaration order, that occurs in the name; null if none.
     */
    public String extractBrand(String name) {
        if (name == null) {
            return null;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (String brand : rules.getBrands()) {
            if (lower.contains(brand.toLowerCase(Locale.ROOT))) {
                return brand;
            }
        }
        return null;
    }

    private String resolveBrand(ProductRecord product) {
        String fromName = extractBrand(product.getName());
        if (fromName != null) {
            return fromName;
        }
        if (product.getBrand() != null && !product.getBrand().isBlank()) {
            return product.getBrand().trim();
        }
        return null;
    }

    /**
     * Pre-embed the normalized names of all products in one batch.
     */
    public int warmUp(List<ProductRecord> products) {
        List<String> names = new ArrayList<>(products.size());
        for (ProductRecord product : products) {
            names.add(normalize(product.getName()));
        }
        return embeddings.warmUp(names);
    }
}
