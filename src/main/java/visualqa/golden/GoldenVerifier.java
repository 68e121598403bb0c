package visualqa.golden;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visualqa.capture.CaptureException;
import visualqa.capture.FrameCapture;
import visualqa.capture.FrameSource;
import visualqa.capture.PixelFormatNormalizer;
import visualqa.compare.ComparisonPolicy;
import visualqa.image.PngImageStore;
import visualqa.model.CanonicalImage;
import visualqa.model.CompareResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Golden-file regression checks: captures, stores and compares named images.
 *
 * <h3>Reference workflow</h3>
 * <pre>{@code
 * GoldenVerifier verifier = new GoldenVerifier(new GoldenConfig());
 *
 * // First run: no reference yet, the capture becomes the reference (GENERATED)
 * // Later runs: compared against the reference (PASSED / FAILED)
 * VerificationReport report = verifier.verify("gradient-fill", source, ComparisonPolicy.tolerance(2));
 * }</pre>
 *
 * <p>References live at {@code <referenceDir>/<name>.png}. When a check fails and
 * failure saving is on, three artifacts go to the failure directory:
 * {@code <name>_fail.png} (the capture), {@code <name>_diff.png} (rendered at the
 * policy tolerance) and {@code <name>_result.json}. An artifact that cannot be
 * written is logged and does not change the outcome.
 *
 * <p>Capture and reference I/O failures end the check with {@link Outcome#ERROR};
 * nothing is retried.
 */
public class GoldenVerifier {

    private static final Logger log = LoggerFactory.getLogger(GoldenVerifier.class);

    private final Path referenceDir;
    private final Path failureDir;
    private final boolean regenerate;
    private final boolean saveFailures;
    private final FrameCapture capture;

    // ── Constructors ──────────────────────────────────────────────────────────

    public GoldenVerifier(GoldenConfig config) {
        this(config.getReferenceDir(), config.getFailureDir(), config.isRegenerate(), config.isSaveFailures(),
                new FrameCapture(new PixelFormatNormalizer(config.getZeroAlphaPolicy())));
    }

    public GoldenVerifier(Path referenceDir, Path failureDir, boolean regenerate, boolean saveFailures,
                          FrameCapture capture) {
        this.referenceDir = referenceDir;
        this.failureDir   = failureDir;
        this.regenerate   = regenerate;
        this.saveFailures = saveFailures;
        this.capture      = capture;
    }

    // ── Verification ──────────────────────────────────────────────────────────

    /**
     * Captures a frame from {@code source} and checks it against the reference for
     * {@code name}. A capture failure yields an {@link Outcome#ERROR} report.
     */
    public VerificationReport verify(String name, FrameSource source, ComparisonPolicy policy) {
        CanonicalImage captured;
        try {
            captured = capture.capture(source);
        } catch (CaptureException e) {
            log.error("GoldenVerifier: capture failed for '{}': {}", name, e.getMessage());
            VerificationReport report = new VerificationReport(name, Outcome.ERROR, e.getMessage());
            report.setPolicy(policy);
            return report;
        }
        return verify(name, captured, policy);
    }

    /**
     * Checks an already normalized capture against the reference for {@code name},
     * generating the reference if it is missing or regeneration is on.
     */
    public VerificationReport verify(String name, CanonicalImage captured, ComparisonPolicy policy) {
        Path reference = referencePath(name);
        boolean exists = Files.exists(reference);

        if (regenerate || !exists) {
            return storeReference(name, captured, policy, reference, exists);
        }

        CanonicalImage expected;
        try {
            expected = PngImageStore.load(reference);
        } catch (IOException e) {
            log.error("GoldenVerifier: cannot load reference {}: {}", reference, e.getMessage());
            VerificationReport report = new VerificationReport(name, Outcome.ERROR,
                    "Failed to load reference: " + e.getMessage());
            report.setPolicy(policy);
            report.setReferencePath(reference.toString());
            return report;
        }

        CompareResult result = policy.evaluate(expected, captured);
        VerificationReport report = new VerificationReport(name,
                result.matched() ? Outcome.PASSED : Outcome.FAILED, result.message());
        report.setPolicy(policy);
        report.setResult(result);
        report.setReferencePath(reference.toString());

        if (result.matched()) {
            if (result.differentPixels() > 0) {
                log.info("GoldenVerifier: '{}' PASSED ({} pixels within tolerance)", name, result.differentPixels());
            } else {
                log.info("GoldenVerifier: '{}' PASSED", name);
            }
            return report;
        }

        log.warn("GoldenVerifier: '{}' FAILED: {}", name, result.message());
        if (saveFailures) {
            saveFailureArtifacts(name, expected, captured, policy, report);
        }
        return report;
    }

    /**
     * Like {@link #verify(String, FrameSource, ComparisonPolicy)} but throws when the
     * check does not succeed, for use directly inside a test method.
     *
     * @throws AssertionError if the outcome is {@link Outcome#FAILED} or {@link Outcome#ERROR}
     */
    public VerificationReport assertMatchesReference(String name, FrameSource source, ComparisonPolicy policy) {
        VerificationReport report = verify(name, source, policy);
        if (!report.isSuccess()) {
            StringBuilder sb = new StringBuilder()
                    .append("Golden check '").append(name).append("' ").append(report.getOutcome())
                    .append(": ").append(report.getMessage());
            if (report.getDiffPath() != null) {
                sb.append(". Diff saved: ").append(report.getDiffPath());
            }
            throw new AssertionError(sb.toString());
        }
        return report;
    }

    // ── Paths ─────────────────────────────────────────────────────────────────

    public Path referencePath(String name) {
        return referenceDir.resolve(sanitize(name) + ".png");
    }

    public Path capturePath(String name) {
        return failureDir.resolve(sanitize(name) + "_fail.png");
    }

    public Path diffPath(String name) {
        return failureDir.resolve(sanitize(name) + "_diff.png");
    }

    public Path reportPath(String name) {
        return failureDir.resolve(sanitize(name) + "_result.json");
    }

    public Path getReferenceDir() { return referenceDir; }
    public Path getFailureDir()   { return failureDir; }
    public boolean isRegenerate() { return regenerate; }
    public boolean isSaveFailures() { return saveFailures; }

    /** Replaces everything outside {@code [A-Za-z0-9_-]} with an underscore. */
    static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_\\-]", "_");
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private VerificationReport storeReference(String name, CanonicalImage captured, ComparisonPolicy policy,
                                              Path reference, boolean existed) {
        try {
            PngImageStore.save(captured, reference);
        } catch (IOException e) {
            log.error("GoldenVerifier: cannot save reference {}: {}", reference, e.getMessage());
            VerificationReport report = new VerificationReport(name, Outcome.ERROR,
                    "Failed to save reference: " + e.getMessage());
            report.setPolicy(policy);
            report.setReferencePath(reference.toString());
            return report;
        }

        Outcome outcome = existed ? Outcome.REGENERATED : Outcome.GENERATED;
        log.info("GoldenVerifier: reference {} for '{}' at {}", outcome.name().toLowerCase(Locale.ROOT), name,
                reference.toAbsolutePath());
        VerificationReport report = new VerificationReport(name, outcome,
                existed ? "Reference regenerated" : "Reference generated");
        report.setPolicy(policy);
        report.setReferencePath(reference.toString());
        return report;
    }

    private void saveFailureArtifacts(String name, CanonicalImage expected, CanonicalImage captured,
                                      ComparisonPolicy policy, VerificationReport report) {
        Path capturePath = capturePath(name);
        try {
            PngImageStore.save(captured, capturePath);
            report.setCapturePath(capturePath.toString());
        } catch (IOException e) {
            log.warn("GoldenVerifier: could not save capture for '{}': {}", name, e.getMessage());
        }

        Path diffPath = diffPath(name);
        try {
            PngImageStore.save(policy.renderDiff(expected, captured), diffPath);
            report.setDiffPath(diffPath.toString());
        } catch (IOException e) {
            log.warn("GoldenVerifier: could not save diff for '{}': {}", name, e.getMessage());
        }

        Path reportPath = reportPath(name);
        try {
            ReportWriter.write(report, reportPath);
        } catch (IOException e) {
            log.warn("GoldenVerifier: could not save report for '{}': {}", name, e.getMessage());
        }
        log.info("GoldenVerifier: failure artifacts for '{}' saved to {}", name, failureDir.toAbsolutePath());
    }
}
