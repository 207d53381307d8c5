package in.co.pricematch.pojos;

import java.util.List;

/**
 * Output of match validation: accepted matches, rejected ones with reasons, the per-match
 * price comparisons that were computed, and the aggregate report.
 */
public final class ValidationResult {

    private final List<ProductMatch> validated;
    private final List<RejectedMatch> rejected;
    private final List<PriceComparison> priceComparisons;
    private final QualityReport report;

    public ValidationResult(List<ProductMatch> validated, List<RejectedMatch> rejected,
                            List<PriceComparison> priceComparisons, QualityReport report) {
        this.validated = List.copyOf(validated);
        this.rejected = List.copyOf(rejected);
        this.priceComparisons = List.copyOf(priceComparisons);
        this.report = report;
    }

    public List<ProductMatch> getValidated() { return validated; }
    public List<RejectedMatch> getRejected() { return rejected; }
    public List<PriceComparison> getPriceComparisons() { return priceComparisons; }
    public QualityReport getReport() { return report; }
}
