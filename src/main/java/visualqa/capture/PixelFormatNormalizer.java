package visualqa.capture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visualqa.model.CanonicalImage;

import java.nio.ByteOrder;
import java.util.List;

/**
 * Converts a {@link RawFrame} in any bit-packed pixel format into a
 * {@link CanonicalImage}.
 *
 * <p>Each channel is located by its mask: the lowest set bit gives the shift, the
 * population count gives the channel width. The raw channel value is rescaled
 * linearly from {@code [0, 2^bits - 1]} to {@code [0, 255]} with rounding, so a
 * 5-bit red of 31 becomes 255 and a 6-bit green of 32 becomes 130. A channel
 * with an empty mask reads as 0.
 *
 * <p>Masks are clamped to the pixel's storage width before use; a descriptor that
 * claims bits the pixel does not have only loses those bits.
 *
 * <p>Normalization of a frame that passed {@link RawFrame} validation cannot fail.
 * Instances are stateless apart from the alpha policy and may be shared.
 */
public class PixelFormatNormalizer {

    private static final Logger log = LoggerFactory.getLogger(PixelFormatNormalizer.class);

    private final ZeroAlphaPolicy zeroAlphaPolicy;

    /** Normalizer that treats zero alpha as opaque. */
    public PixelFormatNormalizer() {
        this(ZeroAlphaPolicy.OPAQUE);
    }

    public PixelFormatNormalizer(ZeroAlphaPolicy zeroAlphaPolicy) {
        if (zeroAlphaPolicy == null) {
            throw new IllegalArgumentException("Zero-alpha policy must not be null");
        }
        this.zeroAlphaPolicy = zeroAlphaPolicy;
    }

    public ZeroAlphaPolicy getZeroAlphaPolicy() {
        return zeroAlphaPolicy;
    }

    /**
     * Normalizes {@code frame}. A frame with zero width or height yields an empty
     * image of the same dimensions.
     */
    public CanonicalImage normalize(RawFrame frame) {
        PixelFormatDescriptor format = frame.format();
        if (frame.isEmpty()) {
            log.debug("Normalizing empty {}x{} frame", frame.width(), frame.height());
            return CanonicalImage.builder(frame.width(), frame.height()).build();
        }

        List<String> violations = format.violations();
        if (!violations.isEmpty()) {
            log.warn("Inconsistent pixel format {}: {}; masks clamped to {} bits",
                    format, violations, format.bitsPerPixel());
        }

        long storage = format.storageMask();
        Channel red   = new Channel(format.redMask() & storage);
        Channel green = new Channel(format.greenMask() & storage);
        Channel blue  = new Channel(format.blueMask() & storage);
        Channel alpha = new Channel(format.effectiveAlphaMask());
        boolean hasAlpha = alpha.mask != 0;

        CanonicalImage.Builder out = CanonicalImage.builder(frame.width(), frame.height());
        PixelReader reader = new PixelReader(frame);

        for (int y = 0; y < frame.height(); y++) {
            for (int x = 0; x < frame.width(); x++) {
                long pixel = reader.read(x, y);
                int a = 255;
                if (hasAlpha) {
                    a = alpha.extract(pixel);
                    if (a == 0 && zeroAlphaPolicy == ZeroAlphaPolicy.OPAQUE) {
                        a = 255;
                    }
                }
                out.set(x, y, red.extract(pixel), green.extract(pixel), blue.extract(pixel), a);
            }
        }

        log.debug("Normalized {}x{} frame ({}) alpha={}", frame.width(), frame.height(), format,
                hasAlpha ? zeroAlphaPolicy : "none");
        return out.build();
    }

    /**
     * Rescales {@code value}, a channel of {@code bits} bits, to 0–255 with rounding.
     * Values above the channel range (possible with a non-contiguous mask) clamp to 255.
     */
    static int scaleTo8Bit(long value, int bits) {
        if (bits <= 0) {
            return 0;
        }
        if (bits == 8) {
            return (int) Math.min(value, 255L);
        }
        long max = (1L << Math.min(bits, 32)) - 1;
        long scaled = Math.round(value * 255.0 / max);
        return (int) Math.max(0L, Math.min(255L, scaled));
    }

    // ── Channel extraction ────────────────────────────────────────────────────

    private static final class Channel {
        final long mask;
        final int shift;
        final int bits;

        Channel(long mask) {
            this.mask  = mask;
            this.shift = mask == 0 ? 0 : Long.numberOfTrailingZeros(mask);
            this.bits  = Long.bitCount(mask);
        }

        int extract(long pixel) {
            if (mask == 0) {
                return 0;
            }
            return scaleTo8Bit((pixel & mask) >>> shift, bits);
        }
    }

    // ── Packed pixel access ───────────────────────────────────────────────────

    /**
     * Reads packed pixel values. Whole-byte formats assemble {@code bpp / 8} bytes in
     * the frame's byte order. Sub-byte formats (1, 2, 4 bpp) take pixels from the
     * high bits of each byte first in big-endian frames and from the low bits first
     * in little-endian frames.
     */
    private static final class PixelReader {
        private final RawFrame frame;
        private final int bpp;
        private final int bytesPerPixel;
        private final boolean littleEndian;

        PixelReader(RawFrame frame) {
            this.frame         = frame;
            this.bpp           = frame.format().bitsPerPixel();
            this.bytesPerPixel = bpp / 8;
            this.littleEndian  = frame.format().byteOrder() == ByteOrder.LITTLE_ENDIAN;
        }

        long read(int x, int y) {
            int rowStart = y * frame.stride();
            if (bpp < 8) {
                int bitOffset = x * bpp;
                int b = frame.byteAt(rowStart + bitOffset / 8);
                int within = bitOffset % 8;
                int shift = littleEndian ? within : 8 - bpp - within;
                return (b >>> shift) & ((1 << bpp) - 1);
            }

            int offset = rowStart + x * bytesPerPixel;
            long value = 0;
            if (littleEndian) {
                for (int i = bytesPerPixel - 1; i >= 0; i--) {
                    value = (value << 8) | frame.byteAt(offset + i);
                }
            } else {
                for (int i = 0; i < bytesPerPixel; i++) {
                    value = (value << 8) | frame.byteAt(offset + i);
                }
            }
            return value;
        }
    }
}
