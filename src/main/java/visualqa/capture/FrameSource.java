package visualqa.capture;

/**
 * Supplies raw frames from a rendering surface.
 *
 * <p>Implementations own the window or drawable and whatever graphics API call
 * reads its pixels back. They may throw {@link CaptureException} when no frame can
 * be read; returning {@code null} is treated the same way by {@link FrameCapture}.
 */
@FunctionalInterface
public interface FrameSource {

    /**
     * Grabs the current contents of the surface.
     *
     * @return the raw frame, or {@code null} if the surface produced nothing
     * @throws CaptureException if the surface cannot be read
     */
    RawFrame grab();
}
