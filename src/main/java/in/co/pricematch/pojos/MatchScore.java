package in.co.pricematch.pojos;

import java.util.List;

/**
 * Confidence for one (primary, candidate) pair with the warnings collected on the way,
 * in the order they were generated.
 */
public final class MatchScore {

    /**
     * How scoring ended. FORBIDDEN and DISSIMILAR are terminal rejections with score 0.
     */
    public enum Outcome {
        FORBIDDEN,
        DISSIMILAR,
        SCORED
    }

    private final double score;
    private final List<String> warnings;
    private final Outcome outcome;

    private MatchScore(double score, List<String> warnings, Outcome outcome) {
        this.score = score;
        this.warnings = List.copyOf(warnings);
        this.outcome = outcome;
    }

    public static MatchScore forbidden(String reason) {
        return new MatchScore(0.0, List.of(reason), Outcome.FORBIDDEN);
    }

    public static MatchScore dissimilar(String warning) {
        return new MatchScore(0.0, List.of(warning), Outcome.DISSIMILAR);
    }

    public static MatchScore scored(double score, List<String> warnings) {
        return new MatchScore(Math.min(Math.max(score, 0.0), 1.0), warnings, Outcome.SCORED);
    }

    public double getScore() { return score; }
    public List<String> getWarnings() { return warnings; }
    public Outcome getOutcome() { return outcome; }

    public boolean isRejected() {
        return outcome != Outcome.SCORED;
    }

    @Override
    public String toString() {
        return String.format("MatchScore{score=%.4f, outcome=%s, warnings=%s}", score, outcome, warnings);
    }
}
