package visualqa.capture;

import java.util.Arrays;
import java.util.Objects;

/**
 * A driver-native packed-pixel buffer as delivered by the capture side, together
 * with the {@link PixelFormatDescriptor} needed to interpret it.
 *
 * <p>The constructor copies {@code pixelData}; the collaborator's buffer is never
 * retained past the call that builds the frame, so the collaborator may reuse or
 * release it immediately afterwards.
 *
 * @param width     pixels per row
 * @param height    number of rows
 * @param stride    bytes from the start of one row to the start of the next
 * @param pixelData packed pixel bytes; copied on construction
 * @param format    pixel layout
 */
public record RawFrame(int width, int height, int stride, byte[] pixelData, PixelFormatDescriptor format) {

    /**
     * @throws CaptureException if the buffer is missing or too short for the declared
     *                          geometry, or the geometry itself is invalid
     */
    public RawFrame {
        if (pixelData == null) {
            throw new CaptureException("Capture returned no pixel data");
        }
        if (format == null) {
            throw new CaptureException("Raw frame has no pixel format descriptor");
        }
        if (width < 0 || height < 0 || stride < 0) {
            throw new CaptureException(String.format(
                    "Invalid frame geometry: %dx%d, stride %d", width, height, stride));
        }
        long rowBytes = rowBytes(width, format.bitsPerPixel());
        if (width > 0 && height > 0) {
            if (stride < rowBytes) {
                throw new CaptureException(String.format(
                        "Stride %d is shorter than a %d-pixel row at %d bpp (%d bytes)",
                        stride, width, format.bitsPerPixel(), rowBytes));
            }
            long required = (long) stride * (height - 1) + rowBytes;
            if (pixelData.length < required) {
                throw new CaptureException(String.format(
                        "Pixel buffer holds %d bytes but a %dx%d frame with stride %d needs %d",
                        pixelData.length, width, height, stride, required));
            }
        }
        pixelData = pixelData.clone();
    }

    /** Frame whose rows are tightly packed (stride equals the row size). */
    public static RawFrame packed(int width, int height, byte[] pixelData, PixelFormatDescriptor format) {
        if (format == null) {
            throw new CaptureException("Raw frame has no pixel format descriptor");
        }
        return new RawFrame(width, height, (int) rowBytes(Math.max(width, 0), format.bitsPerPixel()),
                pixelData, format);
    }

    /** Minimum number of bytes one row of {@code width} pixels occupies. */
    public static long rowBytes(int width, int bitsPerPixel) {
        return ((long) width * bitsPerPixel + 7) / 8;
    }

    /** Copy of the packed bytes. */
    @Override
    public byte[] pixelData() {
        return pixelData.clone();
    }

    /** Unsigned byte at {@code index} of the packed buffer. */
    int byteAt(int index) {
        return pixelData[index] & 0xFF;
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawFrame that)) return false;
        return width == that.width && height == that.height && stride == that.stride
                && Arrays.equals(pixelData, that.pixelData) && format.equals(that.format);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(width, height, stride, format) + Arrays.hashCode(pixelData);
    }

    @Override
    public String toString() {
        return "RawFrame{" + width + "x" + height + ", stride=" + stride
                + ", bytes=" + pixelData.length + ", " + format + "}";
    }
}
