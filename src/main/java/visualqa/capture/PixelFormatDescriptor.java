package visualqa.capture;

import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Describes how one packed pixel of a {@link RawFrame} is laid out: its storage
 * width, byte order and the bit mask of each color channel.
 *
 * <p>Masks are unsigned 32-bit values carried in a {@code long}. An alpha channel
 * exists only when {@code hasAlpha} is set; its mask may be given explicitly or
 * left at 0, in which case every storage bit not claimed by red, green or blue is
 * treated as alpha.
 *
 * <p>A descriptor whose masks overlap or spill past {@code bitsPerPixel} is still
 * accepted (drivers do report such formats); {@link #violations()} lists what is
 * wrong with it and the normalizer clamps each mask to the storage width.
 *
 * @param bitsPerPixel  storage width of one pixel: 1, 2, 4, 8, 16, 24 or 32
 * @param byteOrder     order of the bytes making up one pixel
 * @param redMask       bits holding red
 * @param greenMask     bits holding green
 * @param blueMask      bits holding blue
 * @param hasAlpha      whether the drawable carries an alpha channel at all
 * @param alphaMask     bits holding alpha, or 0 to derive them
 * @param drawableDepth depth of the source drawable, for diagnostics
 */
public record PixelFormatDescriptor(
        int bitsPerPixel,
        ByteOrder byteOrder,
        long redMask,
        long greenMask,
        long blueMask,
        boolean hasAlpha,
        long alphaMask,
        int drawableDepth) {

    public static final int MAX_BITS_PER_PIXEL = 32;

    private static final long MASK_LIMIT = 0xFFFF_FFFFL;

    public PixelFormatDescriptor {
        if (!isSupportedBitsPerPixel(bitsPerPixel)) {
            throw new CaptureException("Unsupported bits per pixel: " + bitsPerPixel
                    + " (expected 1, 2, 4, 8, 16, 24 or 32)");
        }
        if (byteOrder == null) {
            throw new CaptureException("Byte order must be specified");
        }
        checkMask("red", redMask);
        checkMask("green", greenMask);
        checkMask("blue", blueMask);
        checkMask("alpha", alphaMask);
        if (drawableDepth < 0) {
            throw new CaptureException("Negative drawable depth: " + drawableDepth);
        }
    }

    /** Descriptor without an alpha channel. */
    public static PixelFormatDescriptor opaque(int bitsPerPixel, ByteOrder byteOrder,
                                               long redMask, long greenMask, long blueMask) {
        return new PixelFormatDescriptor(bitsPerPixel, byteOrder, redMask, greenMask, blueMask,
                false, 0L, Long.bitCount(redMask | greenMask | blueMask));
    }

    /**
     * Descriptor as reported by a drawable: alpha is assumed present only when the
     * drawable depth exceeds 24 bits, and then occupies the bits left over by the
     * color masks.
     */
    public static PixelFormatDescriptor forDrawable(int bitsPerPixel, ByteOrder byteOrder,
                                                    long redMask, long greenMask, long blueMask,
                                                    int drawableDepth) {
        return new PixelFormatDescriptor(bitsPerPixel, byteOrder, redMask, greenMask, blueMask,
                drawableDepth > 24, 0L, drawableDepth);
    }

    /** All bits a pixel of this format can hold. */
    public long storageMask() {
        return bitsPerPixel >= MAX_BITS_PER_PIXEL ? MASK_LIMIT : (1L << bitsPerPixel) - 1;
    }

    /** Alpha mask actually used for extraction; 0 when the format has no alpha. */
    public long effectiveAlphaMask() {
        if (!hasAlpha) {
            return 0L;
        }
        if (alphaMask != 0L) {
            return alphaMask & storageMask();
        }
        return storageMask() & ~(redMask | greenMask | blueMask);
    }

    /**
     * Human-readable list of invariant breaches: masks overlapping each other, masks
     * with bits beyond {@code bitsPerPixel}, or more mask bits than the pixel holds.
     * Empty for a well-formed descriptor.
     */
    public List<String> violations() {
        List<String> problems = new ArrayList<>();
        long storage = storageMask();
        String[] names = {"red", "green", "blue", "alpha"};
        long[] masks = {redMask, greenMask, blueMask, effectiveAlphaMask()};

        for (int i = 0; i < masks.length; i++) {
            if ((masks[i] & ~storage) != 0) {
                problems.add(String.format("%s mask 0x%X exceeds %d-bit storage", names[i], masks[i], bitsPerPixel));
            }
            for (int j = i + 1; j < masks.length; j++) {
                if ((masks[i] & masks[j]) != 0) {
                    problems.add(String.format("%s mask 0x%X overlaps %s mask 0x%X",
                            names[i], masks[i], names[j], masks[j]));
                }
            }
        }
        int totalBits = Long.bitCount(redMask) + Long.bitCount(greenMask)
                + Long.bitCount(blueMask) + Long.bitCount(effectiveAlphaMask());
        if (totalBits > bitsPerPixel) {
            problems.add("channel masks use " + totalBits + " bits but a pixel holds " + bitsPerPixel);
        }
        return problems;
    }

    /** Sub-byte widths that divide a byte evenly, or whole bytes up to four. */
    public static boolean isSupportedBitsPerPixel(int bitsPerPixel) {
        if (bitsPerPixel < 1 || bitsPerPixel > MAX_BITS_PER_PIXEL) {
            return false;
        }
        return bitsPerPixel < 8 ? 8 % bitsPerPixel == 0 : bitsPerPixel % 8 == 0;
    }

    private static void checkMask(String name, long mask) {
        if (mask < 0 || mask > MASK_LIMIT) {
            throw new CaptureException(String.format("%s mask 0x%X is not a 32-bit mask", name, mask));
        }
    }

    @Override
    public String toString() {
        return String.format("PixelFormat{bpp=%d, %s, r=0x%X, g=0x%X, b=0x%X, alpha=%s, depth=%d}",
                bitsPerPixel, byteOrder, redMask, greenMask, blueMask,
                hasAlpha ? String.format("0x%X", effectiveAlphaMask()) : "none", drawableDepth);
    }
}
