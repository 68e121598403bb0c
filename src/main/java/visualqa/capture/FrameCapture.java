package visualqa.capture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visualqa.model.CanonicalImage;

/**
 * Pulls one frame from a {@link FrameSource} and normalizes it.
 *
 * <p>Every way the capture side can fail (a thrown {@link CaptureException}, any
 * other runtime failure, or a {@code null} frame) surfaces as a single
 * {@link CaptureException}. There is no retry here; a caller that wants one wraps
 * this call.
 */
public class FrameCapture {

    private static final Logger log = LoggerFactory.getLogger(FrameCapture.class);

    private final PixelFormatNormalizer normalizer;

    public FrameCapture(PixelFormatNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * @throws CaptureException if the source fails or returns no frame
     */
    public CanonicalImage capture(FrameSource source) {
        RawFrame frame;
        try {
            frame = source.grab();
        } catch (CaptureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CaptureException("Frame source failed: " + e.getMessage(), e);
        }
        if (frame == null) {
            throw new CaptureException("Frame source returned no frame");
        }
        log.debug("Captured {}", frame);
        return normalizer.normalize(frame);
    }

    public PixelFormatNormalizer getNormalizer() {
        return normalizer;
    }
}
