package visualqa.capture;

import org.testng.annotations.Test;
import visualqa.model.CanonicalImage;
import visualqa.model.Pixel;

import java.nio.ByteOrder;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PixelFormatNormalizer}.
 *
 * <p>Frames are built by hand so every byte of the packed layout is explicit.
 */
public class PixelFormatNormalizerTest {

    private static final ByteOrder LE = ByteOrder.LITTLE_ENDIAN;
    private static final ByteOrder BE = ByteOrder.BIG_ENDIAN;

    private final PixelFormatNormalizer normalizer = new PixelFormatNormalizer();

    private static PixelFormatDescriptor xrgb32(ByteOrder order, int depth) {
        return PixelFormatDescriptor.forDrawable(32, order, 0x00FF0000L, 0x0000FF00L, 0x000000FFL, depth);
    }

    private static PixelFormatDescriptor rgb565(ByteOrder order) {
        return PixelFormatDescriptor.forDrawable(16, order, 0xF800L, 0x07E0L, 0x001FL, 16);
    }

    private static byte[] le32(long... pixels) {
        byte[] out = new byte[pixels.length * 4];
        for (int i = 0; i < pixels.length; i++) {
            for (int b = 0; b < 4; b++) {
                out[i * 4 + b] = (byte) (pixels[i] >>> (8 * b));
            }
        }
        return out;
    }

    // ── Whole-byte formats ────────────────────────────────────────────────────

    @Test
    public void depth24_redPixel_isOpaqueRed() {
        RawFrame frame = RawFrame.packed(1, 1, le32(0x00FF0000L), xrgb32(LE, 24));
        assertThat(normalizer.normalize(frame).getPixel(0, 0)).isEqualTo(new Pixel(255, 0, 0, 255));
    }

    @Test
    public void rgb565_fullRed_isOpaqueRed() {
        byte[] data = {(byte) 0x00, (byte) 0xF8};
        RawFrame frame = RawFrame.packed(1, 1, data, rgb565(LE));
        assertThat(normalizer.normalize(frame).getPixel(0, 0)).isEqualTo(new Pixel(255, 0, 0, 255));
    }

    @Test
    public void rgb565_bigEndian_readsHighByteFirst() {
        byte[] data = {(byte) 0x07, (byte) 0xE0};
        RawFrame frame = RawFrame.packed(1, 1, data, rgb565(BE));
        assertThat(normalizer.normalize(frame).getPixel(0, 0)).isEqualTo(new Pixel(0, 255, 0, 255));
    }

    @Test
    public void rgb565_midValues_areRescaledWithRounding() {
        // r=16 (5 bits), g=32 (6 bits), b=1 (5 bits)
        int packed = (16 << 11) | (32 << 5) | 1;
        byte[] data = {(byte) packed, (byte) (packed >>> 8)};
        RawFrame frame = RawFrame.packed(1, 1, data, rgb565(LE));
        assertThat(normalizer.normalize(frame).getPixel(0, 0)).isEqualTo(new Pixel(132, 130, 8, 255));
    }

    @Test
    public void rgb24_bigEndian() {
        PixelFormatDescriptor fmt = PixelFormatDescriptor.opaque(24, BE, 0xFF0000L, 0x00FF00L, 0x0000FFL);
        byte[] data = {10, 20, 30, 40, 50, 60};
        CanonicalImage img = normalizer.normalize(RawFrame.packed(2, 1, data, fmt));
        assertThat(img.getPixel(0, 0)).isEqualTo(Pixel.opaque(10, 20, 30));
        assertThat(img.getPixel(1, 0)).isEqualTo(Pixel.opaque(40, 50, 60));
    }

    @Test
    public void bgrMaskOrder_isHonoured() {
        PixelFormatDescriptor fmt = PixelFormatDescriptor.opaque(32, LE, 0x000000FFL, 0x0000FF00L, 0x00FF0000L);
        CanonicalImage img = normalizer.normalize(RawFrame.packed(1, 1, le32(0x00332211L), fmt));
        assertThat(img.getPixel(0, 0)).isEqualTo(Pixel.opaque(0x11, 0x22, 0x33));
    }

    // ── Alpha handling ────────────────────────────────────────────────────────

    @Test
    public void depth32_derivesAlphaFromSpareBits() {
        RawFrame frame = RawFrame.packed(1, 1, le32(0x80102030L), xrgb32(LE, 32));
        assertThat(normalizer.normalize(frame).getPixel(0, 0)).isEqualTo(new Pixel(0x10, 0x20, 0x30, 0x80));
    }

    @Test
    public void depth24_ignoresSpareBits() {
        RawFrame frame = RawFrame.packed(1, 1, le32(0x40102030L), xrgb32(LE, 24));
        assertThat(normalizer.normalize(frame).getPixel(0, 0).a()).isEqualTo(255);
    }

    @Test
    public void zeroAlpha_isOpaqueByDefault() {
        RawFrame frame = RawFrame.packed(1, 1, le32(0x00000000L), xrgb32(LE, 32));
        assertThat(normalizer.normalize(frame).getPixel(0, 0)).isEqualTo(new Pixel(0, 0, 0, 255));
    }

    @Test
    public void zeroAlpha_preservedWhenPolicySaysSo() {
        PixelFormatNormalizer preserving = new PixelFormatNormalizer(ZeroAlphaPolicy.PRESERVE);
        RawFrame frame = RawFrame.packed(2, 1, le32(0x00000000L, 0xFF000000L), xrgb32(LE, 32));
        CanonicalImage img = preserving.normalize(frame);
        assertThat(img.getPixel(0, 0)).isEqualTo(new Pixel(0, 0, 0, 0));
        assertThat(img.getPixel(1, 0)).isEqualTo(new Pixel(0, 0, 0, 255));
    }

    @Test
    public void explicitAlphaMask_isUsed() {
        // ARGB4444
        PixelFormatDescriptor fmt = new PixelFormatDescriptor(16, LE, 0x0F00L, 0x00F0L, 0x000FL, true, 0xF000L, 16);
        byte[] data = {(byte) 0x0F, (byte) 0x8F};
        CanonicalImage img = normalizer.normalize(RawFrame.packed(1, 1, data, fmt));
        assertThat(img.getPixel(0, 0)).isEqualTo(new Pixel(255, 0, 255, 136));
    }

    // ── Degenerate formats ────────────────────────────────────────────────────

    @Test
    public void zeroMasks_yieldZeroChannels() {
        PixelFormatDescriptor fmt = PixelFormatDescriptor.opaque(8, LE, 0L, 0L, 0L);
        CanonicalImage img = normalizer.normalize(RawFrame.packed(1, 1, new byte[]{(byte) 0xAB}, fmt));
        assertThat(img.getPixel(0, 0)).isEqualTo(new Pixel(0, 0, 0, 255));
    }

    @Test
    public void sameMaskOnAllChannels_collapsesToGray() {
        PixelFormatDescriptor fmt = PixelFormatDescriptor.opaque(8, LE, 0xFFL, 0xFFL, 0xFFL);
        CanonicalImage img = normalizer.normalize(RawFrame.packed(1, 1, new byte[]{(byte) 0x7F}, fmt));
        assertThat(img.getPixel(0, 0)).isEqualTo(Pixel.opaque(0x7F, 0x7F, 0x7F));
    }

    @Test
    public void maskWiderThanStorage_isClamped() {
        // red claims bits 11..16 but only 0..15 exist; bit 16 is dropped
        PixelFormatDescriptor fmt = PixelFormatDescriptor.opaque(16, LE, 0x1F800L, 0x07E0L, 0x001FL);
        assertThat(fmt.violations()).isNotEmpty();
        byte[] data = {(byte) 0x00, (byte) 0xF8};
        CanonicalImage img = normalizer.normalize(RawFrame.packed(1, 1, data, fmt));
        assertThat(img.getPixel(0, 0)).isEqualTo(Pixel.opaque(255, 0, 0));
    }

    @Test
    public void maskEntirelyOutsideStorage_readsZero() {
        PixelFormatDescriptor fmt = PixelFormatDescriptor.opaque(8, LE, 0xFF00L, 0L, 0xFFL);
        CanonicalImage img = normalizer.normalize(RawFrame.packed(1, 1, new byte[]{(byte) 0xFF}, fmt));
        assertThat(img.getPixel(0, 0)).isEqualTo(Pixel.opaque(0, 0, 255));
    }

    @Test
    public void wellFormedDescriptor_hasNoViolations() {
        assertThat(xrgb32(LE, 32).violations()).isEmpty();
        assertThat(rgb565(LE).violations()).isEmpty();
    }

    @Test
    public void overlappingMasks_areReported() {
        PixelFormatDescriptor fmt = PixelFormatDescriptor.opaque(16, LE, 0xFF00L, 0x0FF0L, 0x000FL);
        assertThat(fmt.violations()).anyMatch(v -> v.contains("overlaps"));
    }

    // ── Sub-byte formats and geometry ─────────────────────────────────────────

    @Test
    public void onebpp_bigEndian_readsMostSignificantBitFirst() {
        PixelFormatDescriptor fmt = PixelFormatDescriptor.opaque(1, BE, 1L, 1L, 1L);
        byte[] data = {(byte) 0b1010_0000};
        CanonicalImage img = normalizer.normalize(RawFrame.packed(4, 1, data, fmt));
        assertThat(img.getPixel(0, 0)).isEqualTo(Pixel.OPAQUE_WHITE);
        assertThat(img.getPixel(1, 0)).isEqualTo(Pixel.OPAQUE_BLACK);
        assertThat(img.getPixel(2, 0)).isEqualTo(Pixel.OPAQUE_WHITE);
        assertThat(img.getPixel(3, 0)).isEqualTo(Pixel.OPAQUE_BLACK);
    }

    @Test
    public void fourbpp_littleEndian_readsLowNibbleFirst() {
        PixelFormatDescriptor fmt = PixelFormatDescriptor.opaque(4, LE, 0xFL, 0xFL, 0xFL);
        byte[] data = {(byte) 0xF0};
        CanonicalImage img = normalizer.normalize(RawFrame.packed(2, 1, data, fmt));
        assertThat(img.getPixel(0, 0)).isEqualTo(Pixel.OPAQUE_BLACK);
        assertThat(img.getPixel(1, 0)).isEqualTo(Pixel.OPAQUE_WHITE);
    }

    @Test
    public void rowPadding_isSkipped() {
        PixelFormatDescriptor fmt = PixelFormatDescriptor.opaque(8, LE, 0xFFL, 0L, 0L);
        // 2 pixels per row, stride 4 with two bytes of padding
        byte[] data = {1, 2, 99, 99, 3, 4};
        CanonicalImage img = normalizer.normalize(new RawFrame(2, 2, 4, data, fmt));
        assertThat(img.getPixel(0, 1).r()).isEqualTo(3);
        assertThat(img.getPixel(1, 1).r()).isEqualTo(4);
    }

    @Test
    public void emptyFrame_normalizesToEmptyImage() {
        RawFrame frame = new RawFrame(0, 0, 0, new byte[0], xrgb32(LE, 24));
        CanonicalImage img = normalizer.normalize(frame);
        assertThat(img.isEmpty()).isTrue();
        assertThat(img.getWidth()).isZero();

        CanonicalImage tall = normalizer.normalize(new RawFrame(0, 5, 0, new byte[0], xrgb32(LE, 24)));
        assertThat(tall.isEmpty()).isTrue();
        assertThat(tall.getHeight()).isEqualTo(5);
    }

    @Test
    public void frameDoesNotAliasCallerBuffer() {
        byte[] data = le32(0x00FF0000L);
        RawFrame frame = RawFrame.packed(1, 1, data, xrgb32(LE, 24));
        data[2] = 0;
        assertThat(normalizer.normalize(frame).getPixel(0, 0).r()).isEqualTo(255);
    }

    // ── Channel rescale ───────────────────────────────────────────────────────

    @Test
    public void scaleTo8Bit_coversRangeEndpoints() {
        assertThat(PixelFormatNormalizer.scaleTo8Bit(0, 5)).isZero();
        assertThat(PixelFormatNormalizer.scaleTo8Bit(31, 5)).isEqualTo(255);
        assertThat(PixelFormatNormalizer.scaleTo8Bit(63, 6)).isEqualTo(255);
        assertThat(PixelFormatNormalizer.scaleTo8Bit(1, 1)).isEqualTo(255);
        assertThat(PixelFormatNormalizer.scaleTo8Bit(1023, 10)).isEqualTo(255);
        assertThat(PixelFormatNormalizer.scaleTo8Bit(512, 10)).isEqualTo(128);
        assertThat(PixelFormatNormalizer.scaleTo8Bit(200, 8)).isEqualTo(200);
        assertThat(PixelFormatNormalizer.scaleTo8Bit(5, 0)).isZero();
    }

    @Test
    public void scaleTo8Bit_clampsValuesAboveRange() {
        // non-contiguous mask 0b101 has 2 bits but can yield 5 after shifting
        assertThat(PixelFormatNormalizer.scaleTo8Bit(5, 2)).isEqualTo(255);
    }
}
