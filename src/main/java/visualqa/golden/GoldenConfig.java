package visualqa.golden;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visualqa.capture.ZeroAlphaPolicy;
import visualqa.compare.ComparisonPolicy;
import visualqa.compare.ImageComparator;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Reads {@code config.properties} from the classpath and exposes typed golden-file
 * settings with sensible defaults.
 *
 * <p>All values can be overridden by placing a {@code config.local.properties}
 * file on the classpath (higher priority, not committed to VCS).
 */
public class GoldenConfig {

    private static final Logger log = LoggerFactory.getLogger(GoldenConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Property keys
    static final String KEY_REFERENCE_DIR      = "golden.reference.dir";
    static final String KEY_FAILURE_DIR        = "golden.failure.dir";
    static final String KEY_REGENERATE         = "golden.regenerate";
    static final String KEY_SAVE_FAILURES      = "golden.save.failures";
    static final String KEY_DEFAULT_TOLERANCE  = "golden.default.tolerance";
    static final String KEY_DEFAULT_PERCENT    = "golden.default.diff.percent";
    static final String KEY_ZERO_ALPHA_OPAQUE  = "capture.zero.alpha.opaque";

    // Defaults
    private static final String  DEFAULT_REFERENCE_DIR     = "reference";
    private static final boolean DEFAULT_REGENERATE        = false;
    private static final boolean DEFAULT_SAVE_FAILURES     = true;
    private static final int     DEFAULT_TOLERANCE         = 0;
    private static final double  DEFAULT_DIFF_PERCENT      = 0.0;
    private static final boolean DEFAULT_ZERO_ALPHA_OPAQUE = true;

    private final Properties props;

    /**
     * Loads golden-file settings from {@code config.properties} on the classpath,
     * then applies {@code config.local.properties} on top when present.
     *
     * @throws RuntimeException if the base config.properties cannot be loaded
     */
    public GoldenConfig() {
        this(CONFIG_FILE, CONFIG_LOCAL_FILE);
    }

    /**
     * Loads {@code baseResource} (required) and {@code overrideResource} (optional)
     * from the classpath; later keys win.
     */
    GoldenConfig(String baseResource, String overrideResource) {
        props = new Properties();
        ClassLoader loader = GoldenConfig.class.getClassLoader();

        try (InputStream base = loader.getResourceAsStream(baseResource)) {
            if (base == null) {
                throw new IOException("Golden settings not found on classpath: " + baseResource);
            }
            props.load(base);
        } catch (IOException e) {
            throw new RuntimeException("Cannot read golden settings from " + baseResource, e);
        }

        int overrides = 0;
        try (InputStream local = loader.getResourceAsStream(overrideResource)) {
            if (local != null) {
                Properties extra = new Properties();
                extra.load(local);
                props.putAll(extra);
                overrides = extra.size();
            }
        } catch (IOException e) {
            log.warn("Ignoring unreadable golden overrides {}: {}", overrideResource, e.getMessage());
        }
        log.debug("Golden settings loaded from {} ({} local overrides)", baseResource, overrides);
    }

    /** Settings taken directly from {@code props}, without touching the classpath. */
    GoldenConfig(Properties props) {
        this.props = props;
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    /** Directory holding reference images (default: "reference"). */
    public Path getReferenceDir() {
        return Path.of(getString(KEY_REFERENCE_DIR, DEFAULT_REFERENCE_DIR));
    }

    /** Directory for failure artifacts; falls back to the reference directory when unset. */
    public Path getFailureDir() {
        String raw = props.getProperty(KEY_FAILURE_DIR);
        return raw == null || raw.isBlank() ? getReferenceDir() : Path.of(raw.trim());
    }

    /** Whether existing references are overwritten with the current capture (default: false). */
    public boolean isRegenerate() {
        return getBool(KEY_REGENERATE, DEFAULT_REGENERATE);
    }

    /** Whether captured, diff and report files are written on failure (default: true). */
    public boolean isSaveFailures() {
        return getBool(KEY_SAVE_FAILURES, DEFAULT_SAVE_FAILURES);
    }

    /** Per-channel tolerance, 0–255 (default: 0). Out-of-range values fall back to the default. */
    public int getDefaultTolerance() {
        int value = getInt(KEY_DEFAULT_TOLERANCE, DEFAULT_TOLERANCE);
        if (value < 0 || value > ImageComparator.MAX_TOLERANCE) {
            log.warn("Tolerance {} for key '{}' outside 0-{}; using default {}",
                    value, KEY_DEFAULT_TOLERANCE, ImageComparator.MAX_TOLERANCE, DEFAULT_TOLERANCE);
            return DEFAULT_TOLERANCE;
        }
        return value;
    }

    /** Allowed share of differing pixels in percent; 0 disables percentage mode (default: 0). */
    public double getDefaultDiffPercent() {
        double value = getDouble(KEY_DEFAULT_PERCENT, DEFAULT_DIFF_PERCENT);
        if (value < 0) {
            log.warn("Negative percentage {} for key '{}'; using default {}",
                    value, KEY_DEFAULT_PERCENT, DEFAULT_DIFF_PERCENT);
            return DEFAULT_DIFF_PERCENT;
        }
        return value;
    }

    /** How captured pixels with zero alpha bits are read (default: opaque). */
    public ZeroAlphaPolicy getZeroAlphaPolicy() {
        return getBool(KEY_ZERO_ALPHA_OPAQUE, DEFAULT_ZERO_ALPHA_OPAQUE)
                ? ZeroAlphaPolicy.OPAQUE
                : ZeroAlphaPolicy.PRESERVE;
    }

    /** Comparison policy built from the default tolerance and percentage. */
    public ComparisonPolicy getDefaultPolicy() {
        return new ComparisonPolicy(getDefaultTolerance(), getDefaultDiffPercent());
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private String getString(String key, String defaultValue) {
        String raw = props.getProperty(key);
        return raw == null || raw.isBlank() ? defaultValue : raw.trim();
    }

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}'; using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private double getDouble(String key, double defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            double value = Double.parseDouble(raw.trim());
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new NumberFormatException("not finite");
            }
            return value;
        } catch (NumberFormatException e) {
            log.warn("Invalid number for key '{}': '{}'; using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBool(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }
}
