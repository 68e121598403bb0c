package visualqa.compare;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visualqa.model.CanonicalImage;
import visualqa.model.Pixel;

/**
 * Renders a picture of where two images disagree.
 *
 * <p>The canvas is as wide and as tall as the larger of the two inputs. Each
 * coordinate is painted as follows:
 * <ul>
 *   <li>present in neither image: opaque black</li>
 *   <li>present only in the actual image: {@link #ONLY_IN_ACTUAL} (green)</li>
 *   <li>present only in the expected image: {@link #ONLY_IN_EXPECTED} (blue)</li>
 *   <li>largest channel difference above the tolerance: a red highlight, paler for
 *       small differences and saturated for differences of 128 or more</li>
 *   <li>otherwise: the expected pixel at half brightness, opaque</li>
 * </ul>
 */
public final class DiffRenderer {

    private static final Logger log = LoggerFactory.getLogger(DiffRenderer.class);

    public static final Pixel ONLY_IN_ACTUAL   = Pixel.opaque(0, 255, 0);
    public static final Pixel ONLY_IN_EXPECTED = Pixel.opaque(0, 0, 255);
    public static final Pixel OUTSIDE_BOTH     = Pixel.OPAQUE_BLACK;

    private DiffRenderer() {}

    /**
     * @param expected  reference image (pixels of matching areas are taken from here)
     * @param actual    image under test
     * @param tolerance largest per-channel difference treated as matching, 0–255
     * @throws IllegalArgumentException if {@code tolerance} is outside 0–255
     */
    public static CanonicalImage render(CanonicalImage expected, CanonicalImage actual, int tolerance) {
        ImageComparator.checkTolerance(tolerance);
        int width  = Math.max(expected.getWidth(), actual.getWidth());
        int height = Math.max(expected.getHeight(), actual.getHeight());
        CanonicalImage.Builder canvas = CanonicalImage.builder(width, height);

        long highlighted = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                boolean inExpected = expected.contains(x, y);
                boolean inActual   = actual.contains(x, y);

                if (!inExpected && !inActual) {
                    canvas.set(x, y, OUTSIDE_BOTH);
                } else if (!inExpected) {
                    canvas.set(x, y, ONLY_IN_ACTUAL);
                } else if (!inActual) {
                    canvas.set(x, y, ONLY_IN_EXPECTED);
                } else {
                    Pixel p = expected.getPixel(x, y);
                    int diff = p.maxChannelDiff(actual.getPixel(x, y));
                    if (diff > tolerance) {
                        canvas.set(x, y, highlight(diff));
                        highlighted++;
                    } else {
                        canvas.set(x, y, p.r() / 2, p.g() / 2, p.b() / 2, 255);
                    }
                }
            }
        }

        log.debug("Rendered {}x{} diff ({} highlighted pixels, tolerance {})", width, height, highlighted, tolerance);
        return canvas.build();
    }

    /** Red tint whose strength is twice the channel difference, capped at full red. */
    static Pixel highlight(int diff) {
        int intensity = Math.min(255, diff * 2);
        return Pixel.opaque(255, 255 - intensity, 255 - intensity);
    }
}
