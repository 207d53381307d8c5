package in.co.pricematch.pojos;

import java.util.List;

/**
 * Counts of a match set by match type and by confidence tier.
 */
public final class MatchStatistics {

    private static final double HIGH_TIER = 0.9;
    private static final double MEDIUM_TIER = 0.75;

    public final int totalMatches;
    public final int exactMatches;
    public final int similarMatches;
    public final int substituteMatches;
    public final int highConfidence;
    public final int mediumConfidence;
    public final int lowConfidence;
    public final double averageConfidence;

    private MatchStatistics(int totalMatches, int exactMatches, int similarMatches, int substituteMatches,
                            int highConfidence, int mediumConfidence, int lowConfidence, double averageConfidence) {
        this.totalMatches = totalMatches;
        this.exactMatches = exactMatches;
        this.similarMatches = similarMatches;
        this.substituteMatches = substituteMatches;
        this.highConfidence = highConfidence;
        this.mediumConfidence = mediumConfidence;
        this.lowConfidence = lowConfidence;
        this.averageConfidence = averageConfidence;
    }

    public static MatchStatistics from(List<ProductMatch> matches) {
        int exact = 0, similar = 0, substitute = 0;
        int high = 0, medium = 0, low = 0;
        double sum = 0.0;
        for (ProductMatch match : matches) {
            switch (match.getMatchType()) {
                case EXACT: exact++; break;
                case SIMILAR: similar++; break;
                case SUBSTITUTE: substitute++; break;
            }
            double confidence = match.getConfidence();
            if (confidence >= HIGH_TIER) {
                high++;
            } else if (confidence >= MEDIUM_TIER) {
                medium++;
            } else {
                low++;
            }
            sum += confidence;
        }
        double average = matches.isEmpty() ? 0.0 : sum / matches.size();
        return new MatchStatistics(matches.size(), exact, similar, substitute, high, medium, low, average);
    }

    @Override
    public String toString() {
        return String.format("MatchStatistics{total=%d, exact=%d, similar=%d, substitute=%d, high=%d, medium=%d, low=%d, avg=%.3f}",
                totalMatches, exactMatches, similarMatches, substituteMatches,
                highConfidence, mediumConfidence, lowConfidence, averageConfidence);
    }
}
