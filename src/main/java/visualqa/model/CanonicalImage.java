package visualqa.model;

import java.util.Arrays;

/**
 * Hardware-independent RGBA8 image: {@code width × height} pixels stored row-major,
 * four bytes per pixel in R, G, B, A order.
 *
 * <p>Instances are immutable. The backing array is copied on the way in and on the
 * way out, so a canonical image can be shared freely between the comparator, the
 * diff renderer and the persistence layer for the whole of one check.
 *
 * <p>Use {@link Builder} to assemble an image pixel by pixel:
 * <pre>{@code
 * CanonicalImage img = CanonicalImage.builder(4, 4)
 *         .fill(Pixel.opaque(255, 0, 0))
 *         .set(0, 0, Pixel.OPAQUE_BLACK)
 *         .build();
 * }</pre>
 */
public final class CanonicalImage {

    public static final int BYTES_PER_PIXEL = 4;

    private static final CanonicalImage EMPTY = new CanonicalImage(0, 0, new byte[0], false);

    private final int width;
    private final int height;
    private final byte[] rgba;

    private CanonicalImage(int width, int height, byte[] rgba, boolean copy) {
        this.width  = width;
        this.height = height;
        this.rgba   = copy ? rgba.clone() : rgba;
    }

    // ── Factories ─────────────────────────────────────────────────────────────

    /**
     * Wraps a copy of {@code rgba}.
     *
     * @throws IllegalArgumentException if the dimensions are negative or the buffer
     *                                  length is not {@code width * height * 4}
     */
    public static CanonicalImage of(int width, int height, byte[] rgba) {
        if (rgba == null) {
            throw new IllegalArgumentException("RGBA buffer must not be null");
        }
        checkDimensions(width, height);
        long expected = (long) width * height * BYTES_PER_PIXEL;
        if (rgba.length != expected) {
            throw new IllegalArgumentException(String.format(
                    "RGBA buffer length %d does not match %dx%d (expected %d)",
                    rgba.length, width, height, expected));
        }
        return new CanonicalImage(width, height, rgba, true);
    }

    /** The 0×0 image. */
    public static CanonicalImage empty() {
        return EMPTY;
    }

    /** An image with every pixel set to {@code pixel}. */
    public static CanonicalImage filled(int width, int height, Pixel pixel) {
        return builder(width, height).fill(pixel).build();
    }

    /** Converts tightly packed BGRA bytes (4 per pixel) to a canonical image. */
    public static CanonicalImage fromBgra(byte[] bgra, int width, int height) {
        Builder builder = builder(width, height);
        requireLength(bgra, (long) width * height * 4, "BGRA");
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int src = (y * width + x) * 4;
                builder.set(x, y, bgra[src + 2] & 0xFF, bgra[src + 1] & 0xFF,
                        bgra[src] & 0xFF, bgra[src + 3] & 0xFF);
            }
        }
        return builder.build();
    }

    /** Converts tightly packed RGB bytes (3 per pixel) to an opaque canonical image. */
    public static CanonicalImage fromRgb(byte[] rgb, int width, int height) {
        Builder builder = builder(width, height);
        requireLength(rgb, (long) width * height * 3, "RGB");
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int src = (y * width + x) * 3;
                builder.set(x, y, rgb[src] & 0xFF, rgb[src + 1] & 0xFF, rgb[src + 2] & 0xFF, 255);
            }
        }
        return builder.build();
    }

    public static Builder builder(int width, int height) {
        return new Builder(width, height);
    }

    // ── Accessors ─────────────────────────────────────────────────────────────

    public int getWidth()  { return width; }
    public int getHeight() { return height; }

    /** Number of pixels, {@code width * height}. */
    public long getPixelCount() {
        return (long) width * height;
    }

    /** True when the image holds no pixels (either dimension is zero). */
    public boolean isEmpty() {
        return rgba.length == 0;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    /**
     * @throws IndexOutOfBoundsException if {@code (x, y)} lies outside the image
     */
    public Pixel getPixel(int x, int y) {
        int offset = offset(x, y);
        return new Pixel(rgba[offset] & 0xFF, rgba[offset + 1] & 0xFF,
                rgba[offset + 2] & 0xFF, rgba[offset + 3] & 0xFF);
    }

    /** Single channel value (0 = R … 3 = A) without allocating a {@link Pixel}. */
    public int getChannel(int x, int y, int channel) {
        if (channel < 0 || channel >= BYTES_PER_PIXEL) {
            throw new IndexOutOfBoundsException("Channel out of range: " + channel);
        }
        return rgba[offset(x, y) + channel] & 0xFF;
    }

    /** Copy of the RGBA buffer. */
    public byte[] toRgbaBytes() {
        return rgba.clone();
    }

    private int offset(int x, int y) {
        if (!contains(x, y)) {
            throw new IndexOutOfBoundsException(
                    "Pixel (" + x + "," + y + ") outside " + width + "x" + height + " image");
        }
        return (y * width + x) * BYTES_PER_PIXEL;
    }

    // ── Value semantics ───────────────────────────────────────────────────────

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CanonicalImage that)) return false;
        return width == that.width && height == that.height && Arrays.equals(rgba, that.rgba);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(rgba);
    }

    @Override
    public String toString() {
        return "CanonicalImage{" + width + "x" + height + "}";
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static void checkDimensions(int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative image dimensions: " + width + "x" + height);
        }
        if ((long) width * height * BYTES_PER_PIXEL > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Image too large: " + width + "x" + height);
        }
    }

    private static void requireLength(byte[] data, long expected, String kind) {
        if (data == null || data.length < expected) {
            throw new IllegalArgumentException(kind + " buffer too short: expected " + expected
                    + " bytes, got " + (data == null ? "null" : data.length));
        }
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    /**
     * Mutable staging buffer for a {@link CanonicalImage}. Not thread-safe; a builder
     * should be confined to the code producing one image.
     */
    public static final class Builder {

        private final int width;
        private final int height;
        private byte[] rgba;

        private Builder(int width, int height) {
            checkDimensions(width, height);
            this.width  = width;
            this.height = height;
            this.rgba   = new byte[width * height * BYTES_PER_PIXEL];
        }

        public int getWidth()  { return width; }
        public int getHeight() { return height; }

        public Builder set(int x, int y, int r, int g, int b, int a) {
            if (x < 0 || y < 0 || x >= width || y >= height) {
                throw new IndexOutOfBoundsException(
                        "Pixel (" + x + "," + y + ") outside " + width + "x" + height + " image");
            }
            int offset = (y * width + x) * BYTES_PER_PIXEL;
            rgba[offset]     = (byte) r;
            rgba[offset + 1] = (byte) g;
            rgba[offset + 2] = (byte) b;
            rgba[offset + 3] = (byte) a;
            return this;
        }

        public Builder set(int x, int y, Pixel pixel) {
            return set(x, y, pixel.r(), pixel.g(), pixel.b(), pixel.a());
        }

        public Builder fill(Pixel pixel) {
            for (int i = 0; i < rgba.length; i += BYTES_PER_PIXEL) {
                rgba[i]     = (byte) pixel.r();
                rgba[i + 1] = (byte) pixel.g();
                rgba[i + 2] = (byte) pixel.b();
                rgba[i + 3] = (byte) pixel.a();
            }
            return this;
        }

        /**
         * Produces the image. The builder hands its buffer over and must not be
         * used afterwards.
         */
        public CanonicalImage build() {
            if (rgba == null) {
                throw new IllegalStateException("Builder already consumed");
            }
            byte[] data = rgba;
            rgba = null;
            return data.length == 0 && width == 0 && height == 0
                    ? EMPTY
                    : new CanonicalImage(width, height, data, false);
        }
    }
}
