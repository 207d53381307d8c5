package in.co.pricematch.pojos;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary of one validation pass over raw matches.
 */
public final class QualityReport {

    public final int totalRawMatches;
    public final int validatedMatches;
    public final int rejectedMatches;
    /** Share of analysed matches whose prices could be compared per unit, in [0, 1]. */
    public final double normalizationSuccessRate;
    /** Rejection summary -> number of matches rejected for it. */
    public final Map<String, Integer> rejectionReasons;

    public QualityReport(int totalRawMatches, int validatedMatches, int rejectedMatches,
                         double normalizationSuccessRate, Map<String, Integer> rejectionReasons) {
        this.totalRawMatches = totalRawMatches;
        this.validatedMatches = validatedMatches;
        this.rejectedMatches = rejectedMatches;
        this.normalizationSuccessRate = normalizationSuccessRate;
        this.rejectionReasons = Collections.unmodifiableMap(new LinkedHashMap<>(rejectionReasons));
    }

    @Override
    public String toString() {
        return String.format("QualityReport{raw=%d, validated=%d, rejected=%d, normalizationRate=%.2f, reasons=%s}",
                totalRawMatches, validatedMatches, rejectedMatches, normalizationSuccessRate, rejectionReasons);
    }
}
