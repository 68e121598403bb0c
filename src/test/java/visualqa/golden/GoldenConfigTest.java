package visualqa.golden;

import org.testng.annotations.Test;
import visualqa.capture.ZeroAlphaPolicy;
import visualqa.compare.ComparisonPolicy;

import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link GoldenConfig}.
 */
public class GoldenConfigTest {

    private static GoldenConfig configWith(String... keyValues) {
        Properties p = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            p.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return new GoldenConfig(p);
    }

    // ── Defaults ──────────────────────────────────────────────────────────────

    @Test
    public void emptyProperties_useDefaults() {
        GoldenConfig config = new GoldenConfig(new Properties());

        assertThat(config.getReferenceDir()).isEqualTo(Path.of("reference"));
        assertThat(config.getFailureDir()).isEqualTo(Path.of("reference"));
        assertThat(config.isRegenerate()).isFalse();
        assertThat(config.isSaveFailures()).isTrue();
        assertThat(config.getDefaultTolerance()).isZero();
        assertThat(config.getDefaultDiffPercent()).isZero();
        assertThat(config.getZeroAlphaPolicy()).isEqualTo(ZeroAlphaPolicy.OPAQUE);
        assertThat(config.getDefaultPolicy()).isEqualTo(ComparisonPolicy.EXACT);
    }

    @Test
    public void classpathConfig_loadsBundledDefaults() {
        GoldenConfig config = new GoldenConfig();
        assertThat(config.getReferenceDir()).isEqualTo(Path.of("reference"));
        assertThat(config.isSaveFailures()).isTrue();
        assertThat(config.getDefaultPolicy()).isEqualTo(ComparisonPolicy.EXACT);
    }

    @Test
    public void overrideResource_winsOverBaseResource() {
        GoldenConfig config = new GoldenConfig("golden/base.properties", "golden/override.properties");
        assertThat(config.getReferenceDir()).isEqualTo(Path.of("refs/base"));
        assertThat(config.getDefaultTolerance()).isEqualTo(9);
        assertThat(config.isSaveFailures()).isFalse();
    }

    @Test
    public void missingOverrideResource_keepsBaseValues() {
        GoldenConfig config = new GoldenConfig("golden/base.properties", "golden/absent.properties");
        assertThat(config.getDefaultTolerance()).isEqualTo(4);
        assertThat(config.isSaveFailures()).isTrue();
    }

    @Test
    public void missingBaseResource_throws() {
        assertThatThrownBy(() -> new GoldenConfig("golden/absent.properties", "golden/override.properties"))
                .isInstanceOf(RuntimeException.class)
                .hasMessageContaining("golden/absent.properties");
    }

    // ── Overrides ─────────────────────────────────────────────────────────────

    @Test
    public void explicitValues_override() {
        GoldenConfig config = configWith(
                GoldenConfig.KEY_REFERENCE_DIR, "golden/ref",
                GoldenConfig.KEY_FAILURE_DIR, " build/failures ",
                GoldenConfig.KEY_REGENERATE, "true",
                GoldenConfig.KEY_SAVE_FAILURES, "false",
                GoldenConfig.KEY_DEFAULT_TOLERANCE, "3",
                GoldenConfig.KEY_DEFAULT_PERCENT, "0.5",
                GoldenConfig.KEY_ZERO_ALPHA_OPAQUE, "false");

        assertThat(config.getReferenceDir()).isEqualTo(Path.of("golden/ref"));
        assertThat(config.getFailureDir()).isEqualTo(Path.of("build/failures"));
        assertThat(config.isRegenerate()).isTrue();
        assertThat(config.isSaveFailures()).isFalse();
        assertThat(config.getDefaultTolerance()).isEqualTo(3);
        assertThat(config.getDefaultDiffPercent()).isEqualTo(0.5);
        assertThat(config.getZeroAlphaPolicy()).isEqualTo(ZeroAlphaPolicy.PRESERVE);
        assertThat(config.getDefaultPolicy()).isEqualTo(new ComparisonPolicy(3, 0.5));
    }

    @Test
    public void blankFailureDir_fallsBackToReferenceDir() {
        GoldenConfig config = configWith(
                GoldenConfig.KEY_REFERENCE_DIR, "refs",
                GoldenConfig.KEY_FAILURE_DIR, "   ");
        assertThat(config.getFailureDir()).isEqualTo(Path.of("refs"));
    }

    // ── Invalid values ────────────────────────────────────────────────────────

    @Test
    public void invalidNumbers_fallBackToDefaults() {
        GoldenConfig config = configWith(
                GoldenConfig.KEY_DEFAULT_TOLERANCE, "lots",
                GoldenConfig.KEY_DEFAULT_PERCENT, "NaN");
        assertThat(config.getDefaultTolerance()).isZero();
        assertThat(config.getDefaultDiffPercent()).isZero();
    }

    @Test
    public void outOfRangeValues_fallBackToDefaults() {
        GoldenConfig config = configWith(
                GoldenConfig.KEY_DEFAULT_TOLERANCE, "256",
                GoldenConfig.KEY_DEFAULT_PERCENT, "-1");
        assertThat(config.getDefaultTolerance()).isZero();
        assertThat(config.getDefaultDiffPercent()).isZero();
        assertThat(config.getDefaultPolicy()).isEqualTo(ComparisonPolicy.EXACT);
    }

    @Test
    public void verifierFromConfig_usesConfiguredDirectories() {
        GoldenConfig config = configWith(
                GoldenConfig.KEY_REFERENCE_DIR, "refs",
                GoldenConfig.KEY_FAILURE_DIR, "out",
                GoldenConfig.KEY_ZERO_ALPHA_OPAQUE, "false");

        GoldenVerifier verifier = new GoldenVerifier(config);

        assertThat(verifier.referencePath("x")).isEqualTo(Path.of("refs", "x.png"));
        assertThat(verifier.reportPath("x")).isEqualTo(Path.of("out", "x_result.json"));
        assertThat(verifier.isSaveFailures()).isTrue();
    }
}
