package visualqa.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visualqa.model.CanonicalImage;

import javax.imageio.ImageIO;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lossless PNG persistence for {@link CanonicalImage}s.
 *
 * <p>Images are written as 8-bit RGBA, non-interlaced. On load, whatever encoding
 * the file uses (palette, grayscale with or without alpha, RGB, 1–16 bits per
 * sample) is brought to RGBA8 by reading raster samples directly, so no color-space
 * or gamma conversion is applied on the way in: {@code load(save(img))} reproduces
 * every RGBA quadruple of {@code img}.
 *
 * <p>Filesystem problems surface as {@link IOException}; content that cannot be
 * decoded as a supported raster surfaces as {@link ImageFormatException}.
 */
public final class PngImageStore {

    private static final Logger log = LoggerFactory.getLogger(PngImageStore.class);

    private static final String FORMAT = "png";

    private PngImageStore() {}

    // ── Public API ────────────────────────────────────────────────────────────

    /**
     * Writes {@code image} to {@code path} as RGBA PNG, creating parent directories.
     *
     * @throws ImageFormatException if the image is empty (PNG has no 0-pixel form)
     * @throws IOException          if the file cannot be written
     */
    public static void save(CanonicalImage image, Path path) throws IOException {
        byte[] png = encode(image);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(path, png);
        log.debug("Saved {}x{} image to {} ({} bytes)", image.getWidth(), image.getHeight(), path, png.length);
    }

    /**
     * Reads a PNG (or any raster format ImageIO understands) from {@code path}.
     *
     * @throws java.nio.file.NoSuchFileException if the file does not exist
     * @throws ImageFormatException              if the content cannot be decoded
     * @throws IOException                       if the file cannot be read
     */
    public static CanonicalImage load(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        try {
            CanonicalImage image = decode(bytes);
            log.debug("Loaded {}x{} image from {}", image.getWidth(), image.getHeight(), path);
            return image;
        } catch (ImageFormatException e) {
            throw new ImageFormatException(path + ": " + e.getMessage(), e);
        }
    }

    /** Encodes {@code image} as PNG bytes. */
    public static byte[] encode(CanonicalImage image) throws ImageFormatException {
        if (image.isEmpty()) {
            throw new ImageFormatException("Cannot encode an empty " + image.getWidth() + "x"
                    + image.getHeight() + " image as PNG");
        }
        BufferedImage buffered = toBufferedImage(image);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(buffered, FORMAT, out)) {
                throw new ImageFormatException("No ImageIO writer available for " + FORMAT);
            }
        } catch (ImageFormatException e) {
            throw e;
        } catch (IOException e) {
            throw new ImageFormatException("PNG encoding failed: " + e.getMessage(), e);
        }
        return out.toByteArray();
    }

    /** Decodes PNG (or other ImageIO-readable) bytes into a canonical image. */
    public static CanonicalImage decode(byte[] bytes) throws ImageFormatException {
        BufferedImage buffered;
        try {
            buffered = ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException | RuntimeException e) {
            throw new ImageFormatException("Corrupt image data: " + e.getMessage(), e);
        }
        if (buffered == null) {
            throw new ImageFormatException("Unrecognized image encoding (" + bytes.length + " bytes)");
        }
        return fromBufferedImage(buffered);
    }

    // ── BufferedImage conversion ──────────────────────────────────────────────

    /** Non-premultiplied ARGB copy of {@code image}. */
    public static BufferedImage toBufferedImage(CanonicalImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        byte[] rgba = image.toRgbaBytes();
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int i = (y * width + x) * 4;
                int argb = (rgba[i + 3] & 0xFF) << 24
                        | (rgba[i] & 0xFF) << 16
                        | (rgba[i + 1] & 0xFF) << 8
                        | (rgba[i + 2] & 0xFF);
                out.setRGB(x, y, argb);
            }
        }
        return out;
    }

    /**
     * Converts a decoded image to RGBA8 from its raw samples.
     *
     * @throws ImageFormatException if the color model is neither indexed, gray nor RGB
     */
    public static CanonicalImage fromBufferedImage(BufferedImage image) throws ImageFormatException {
        ColorModel cm = image.getColorModel();
        Raster raster = image.getRaster();
        int width = image.getWidth();
        int height = image.getHeight();
        CanonicalImage.Builder out = CanonicalImage.builder(width, height);

        if (cm instanceof IndexColorModel icm) {
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    int argb = icm.getRGB(raster.getSample(x, y, 0));
                    out.set(x, y, (argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF, (argb >>> 24) & 0xFF);
                }
            }
            return out.build();
        }

        int colorSpaceType = cm.getColorSpace().getType();
        int colorComponents = cm.getNumColorComponents();
        boolean gray = colorSpaceType == ColorSpace.TYPE_GRAY && colorComponents == 1;
        boolean rgb = colorSpaceType == ColorSpace.TYPE_RGB && colorComponents == 3;
        if (!gray && !rgb) {
            throw new ImageFormatException("Unsupported color model: " + colorComponents
                    + " components, color space type " + colorSpaceType);
        }
        if (raster.getNumBands() < cm.getNumComponents()) {
            throw new ImageFormatException("Raster has " + raster.getNumBands()
                    + " bands, color model expects " + cm.getNumComponents());
        }

        int alphaBand = cm.hasAlpha() ? colorComponents : -1;
        int[] bits = cm.getComponentSize();

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int r;
                int g;
                int b;
                if (gray) {
                    r = g = b = to8Bit(raster.getSample(x, y, 0), bits[0]);
                } else {
                    r = to8Bit(raster.getSample(x, y, 0), bits[0]);
                    g = to8Bit(raster.getSample(x, y, 1), bits[1]);
                    b = to8Bit(raster.getSample(x, y, 2), bits[2]);
                }
                int a = alphaBand < 0 ? 255 : to8Bit(raster.getSample(x, y, alphaBand), bits[alphaBand]);
                out.set(x, y, r, g, b, a);
            }
        }
        return out.build();
    }

    /**
     * 8-bit samples pass through, 16-bit samples keep their high byte, other depths
     * are rescaled to 0–255.
     */
    static int to8Bit(int sample, int bits) {
        if (bits == 8) {
            return sample & 0xFF;
        }
        if (bits == 16) {
            return (sample >>> 8) & 0xFF;
        }
        if (bits <= 0 || bits > 16) {
            return Math.min(255, Math.max(0, sample));
        }
        int max = (1 << bits) - 1;
        return (int) Math.min(255L, Math.round(sample * 255.0 / max));
    }
}
