package visualqa.image;

import java.io.IOException;

/**
 * Thrown when an image file is readable but its content is corrupt, is not a
 * supported raster encoding, or cannot be represented (for example, an empty image
 * on save). Filesystem failures are reported as plain {@link IOException}s.
 */
public class ImageFormatException extends IOException {

    public ImageFormatException(String message) {
        super(message);
    }

    public ImageFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
