package visualqa.compare;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visualqa.model.CanonicalImage;
import visualqa.model.CompareResult;

import java.util.Locale;

/**
 * Pixel comparison of two {@link CanonicalImage}s.
 *
 * <p>Three policies are offered:
 * <ol>
 *   <li><b>Exact</b>: every channel of every pixel must be equal.</li>
 *   <li><b>Fuzzy</b>: a pixel counts as different only when one of its R, G, B, A
 *       channels differs by more than {@code tolerance}; any such pixel fails the
 *       comparison.</li>
 *   <li><b>Fuzzy percent</b>: the fuzzy scan at the maximum tolerance supplies the
 *       statistics, and the verdict becomes {@code differencePercent <= maxDiffPercent}.
 *       This bounds the share of differing pixels, not their magnitude. A size
 *       mismatch is never overridden and always fails.</li>
 * </ol>
 *
 * <p>Differences are reported through {@link CompareResult}, never by throwing.
 * The per-pixel work has no ordering dependency, so results do not depend on
 * traversal order.
 */
public final class ImageComparator {

    private static final Logger log = LoggerFactory.getLogger(ImageComparator.class);

    /** Largest possible per-channel difference. */
    public static final int MAX_TOLERANCE = 255;

    private ImageComparator() {}

    /** Equivalent to {@code fuzzy(expected, actual, 0)}. */
    public static CompareResult exact(CanonicalImage expected, CanonicalImage actual) {
        return fuzzy(expected, actual, 0);
    }

    /**
     * Compares with a per-channel tolerance.
     *
     * @param tolerance largest per-channel difference still treated as equal, 0–255
     * @throws IllegalArgumentException if {@code tolerance} is outside 0–255
     */
    public static CompareResult fuzzy(CanonicalImage expected, CanonicalImage actual, int tolerance) {
        checkTolerance(tolerance);
        CompareResult early = checkShape(expected, actual);
        if (early != null) {
            return early;
        }

        Stats stats = scan(expected, actual, tolerance);
        boolean matched = stats.differentPixels == 0;

        String message;
        if (matched) {
            message = tolerance > 0 ? "Images match (within tolerance " + tolerance + ")" : "Images match";
        } else {
            message = describeDifference(stats);
        }
        CompareResult result = stats.toResult(matched, message);
        log.debug("fuzzy(tolerance={}): {}", tolerance, result);
        return result;
    }

    /**
     * Runs {@link #fuzzy} at {@link #MAX_TOLERANCE} and passes when the share of
     * differing pixels is within {@code maxDiffPercent}. Size and emptiness
     * outcomes are returned as {@link #fuzzy} reports them.
     *
     * @param maxDiffPercent largest share of differing pixels, in percent, that still passes
     * @throws IllegalArgumentException if {@code maxDiffPercent} is negative or NaN
     */
    public static CompareResult fuzzyPercent(CanonicalImage expected, CanonicalImage actual,
                                             double maxDiffPercent) {
        if (Double.isNaN(maxDiffPercent) || maxDiffPercent < 0) {
            throw new IllegalArgumentException("maxDiffPercent must be >= 0, got " + maxDiffPercent);
        }
        CompareResult early = checkShape(expected, actual);
        if (early != null) {
            return early;
        }

        CompareResult full = fuzzy(expected, actual, MAX_TOLERANCE);
        boolean matched = full.differencePercent() <= maxDiffPercent;

        String message = full.message();
        if (matched && full.differentPixels() > 0) {
            message = String.format(Locale.ROOT, "%d pixels differ (%.6f%%) - within %s%% threshold",
                    full.differentPixels(), full.differencePercent(), formatPercent(maxDiffPercent));
        }
        CompareResult result = new CompareResult(matched, full.totalPixels(), full.differentPixels(),
                full.differencePercent(), full.maxChannelDiff(), full.avgChannelDiff(), message);
        log.debug("fuzzyPercent(max={}%): {}", maxDiffPercent, result);
        return result;
    }

    static void checkTolerance(int tolerance) {
        if (tolerance < 0 || tolerance > MAX_TOLERANCE) {
            throw new IllegalArgumentException("Tolerance must be within 0-" + MAX_TOLERANCE + ", got " + tolerance);
        }
    }

    // ── Internals ─────────────────────────────────────────────────────────────

    /** Size mismatch and emptiness outcomes, or {@code null} when pixels must be examined. */
    private static CompareResult checkShape(CanonicalImage expected, CanonicalImage actual) {
        if (expected.getWidth() != actual.getWidth() || expected.getHeight() != actual.getHeight()) {
            return CompareResult.withoutStatistics(false, String.format(
                    "Dimension mismatch: %dx%d vs %dx%d",
                    expected.getWidth(), expected.getHeight(), actual.getWidth(), actual.getHeight()));
        }
        if (expected.isEmpty() || actual.isEmpty()) {
            boolean bothEmpty = expected.isEmpty() && actual.isEmpty();
            return CompareResult.withoutStatistics(bothEmpty, bothEmpty ? "Both images empty" : "One image empty");
        }
        return null;
    }

    private static Stats scan(CanonicalImage expected, CanonicalImage actual, int tolerance) {
        Stats stats = new Stats(expected.getPixelCount());

        for (int y = 0; y < expected.getHeight(); y++) {
            for (int x = 0; x < expected.getWidth(); x++) {
                int pixelMax = 0;
                for (int c = 0; c < CanonicalImage.BYTES_PER_PIXEL; c++) {
                    int d = Math.abs(expected.getChannel(x, y, c) - actual.getChannel(x, y, c));
                    stats.channelDiffSum += d;
                    if (d > pixelMax) pixelMax = d;
                }
                if (pixelMax > stats.maxChannelDiff) {
                    stats.maxChannelDiff = pixelMax;
                }
                if (pixelMax > tolerance) {
                    stats.differentPixels++;
                }
            }
        }
        return stats;
    }

    private static String describeDifference(Stats stats) {
        return String.format(Locale.ROOT, "%d pixels differ (%.6f%%), max channel diff: %d",
                stats.differentPixels, stats.differencePercent(), stats.maxChannelDiff);
    }

    private static String formatPercent(double percent) {
        return percent == Math.rint(percent) && !Double.isInfinite(percent)
                ? String.valueOf((long) percent)
                : String.valueOf(percent);
    }

    private static final class Stats {
        final long totalPixels;
        long differentPixels;
        long channelDiffSum;
        int maxChannelDiff;

        Stats(long totalPixels) {
            this.totalPixels = totalPixels;
        }

        double differencePercent() {
            return totalPixels > 0 ? 100.0 * differentPixels / totalPixels : 0.0;
        }

        double avgChannelDiff() {
            long channels = totalPixels * CanonicalImage.BYTES_PER_PIXEL;
            return channels > 0 ? (double) channelDiffSum / channels : 0.0;
        }

        CompareResult toResult(boolean matched, String message) {
            return new CompareResult(matched, totalPixels, differentPixels, differencePercent(),
                    maxChannelDiff, avgChannelDiff(), message);
        }
    }
}
