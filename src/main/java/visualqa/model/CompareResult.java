package visualqa.model;

/**
 * Outcome of comparing two {@link CanonicalImage}s under a tolerance policy.
 *
 * <p>A mismatch (including a size mismatch) is a normal result, never an exception.
 *
 * @param matched           whether the images satisfy the policy
 * @param totalPixels       {@code width * height}; 0 when the comparison stopped early
 * @param differentPixels   pixels whose largest channel difference exceeded the tolerance
 * @param differencePercent {@code 100 * differentPixels / totalPixels}
 * @param maxChannelDiff    largest channel difference over every examined pixel
 * @param avgChannelDiff    mean channel difference over every examined channel value
 * @param message           human-readable summary
 */
public record CompareResult(
        boolean matched,
        long totalPixels,
        long differentPixels,
        double differencePercent,
        int maxChannelDiff,
        double avgChannelDiff,
        String message) {

    /** Result that carries no statistics, used when the comparison cannot examine pixels. */
    public static CompareResult withoutStatistics(boolean matched, String message) {
        return new CompareResult(matched, 0, 0, 0.0, 0, 0.0, message);
    }
}
