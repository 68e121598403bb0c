package visualqa.compare;

import visualqa.model.CanonicalImage;
import visualqa.model.CompareResult;

/**
 * How strictly a captured image must match its reference.
 *
 * <p>A positive {@code maxDiffPercent} selects
 * {@link ImageComparator#fuzzyPercent}; otherwise {@link ImageComparator#fuzzy} is
 * used with {@code tolerance}. The tolerance also drives {@link DiffRenderer} when a
 * diff image is produced.
 *
 * @param tolerance      per-channel tolerance, 0–255
 * @param maxDiffPercent allowed share of differing pixels in percent; 0 disables the percentage mode
 */
public record ComparisonPolicy(int tolerance, double maxDiffPercent) {

    public static final ComparisonPolicy EXACT = new ComparisonPolicy(0, 0.0);

    public ComparisonPolicy {
        ImageComparator.checkTolerance(tolerance);
        if (Double.isNaN(maxDiffPercent) || maxDiffPercent < 0) {
            throw new IllegalArgumentException("maxDiffPercent must be >= 0, got " + maxDiffPercent);
        }
    }

    public static ComparisonPolicy tolerance(int tolerance) {
        return new ComparisonPolicy(tolerance, 0.0);
    }

    public static ComparisonPolicy maxDiffPercent(double maxDiffPercent) {
        return new ComparisonPolicy(0, maxDiffPercent);
    }

    public boolean usesPercentage() {
        return maxDiffPercent > 0;
    }

    /** Compares {@code actual} against {@code expected} under this policy. */
    public CompareResult evaluate(CanonicalImage expected, CanonicalImage actual) {
        return usesPercentage()
                ? ImageComparator.fuzzyPercent(expected, actual, maxDiffPercent)
                : ImageComparator.fuzzy(expected, actual, tolerance);
    }

    /** Diff image of the two inputs at this policy's tolerance. */
    public CanonicalImage renderDiff(CanonicalImage expected, CanonicalImage actual) {
        return DiffRenderer.render(expected, actual, tolerance);
    }
}
