package in.co.pricematch.pojos;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An accepted match between a primary product and a competitor product.
 * Immutable; handed to persistence or reporting code by value.
 */
public final class ProductMatch {

    private final long primaryId;
    private final long matchedId;
    private final double confidence;
    private final MatchType matchType;
    private final double sizeSimilarity;
    private final List<String> warnings;

    public ProductMatch(long primaryId, long matchedId, double confidence, MatchType matchType,
                        double sizeSimilarity, List<String> warnings) {
        this.primaryId = primaryId;
        this.matchedId = matchedId;
        this.confidence = confidence;
        this.matchType = matchType;
        this.sizeSimilarity = sizeSimilarity;
        this.warnings = List.copyOf(warnings);
    }

    public long getPrimaryId() { return primaryId; }
    public long getMatchedId() { return matchedId; }
    public double getConfidence() { return confidence; }
    public MatchType getMatchType() { return matchType; }
    public double getSizeSimilarity() { return sizeSimilarity; }
    public List<String> getWarnings() { return warnings; }

    /**
     * Convert to map for storage.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("primary_product_id", primaryId);
        map.put("matched_product_id", matchedId);
        map.put("confidence_score", confidence);
        map.put("match_type", matchType.getValue());
        map.put("size_similarity", sizeSimilarity);
        map.put("warnings", warnings);
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProductMatch that = (ProductMatch) o;
        return primaryId == that.primaryId && matchedId == that.matchedId
                && Double.compare(that.confidence, confidence) == 0
                && Double.compare(that.sizeSimilarity, sizeSimilarity) == 0
                && matchType == that.matchType && warnings.equals(that.warnings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(primaryId, matchedId, confidence, matchType, sizeSimilarity, warnings);
    }

    @Override
    public String toString() {
        return String.format("ProductMatch{primary=%d, matched=%d, confidence=%.3f, type=%s, size=%.2f, warnings=%s}",
                primaryId, matchedId, confidence, matchType.getValue(), sizeSimilarity, warnings);
    }
}
