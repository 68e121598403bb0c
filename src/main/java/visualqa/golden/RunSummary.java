package visualqa.golden;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tallies the outcomes of a series of golden checks.
 *
 * <p>Not thread-safe; one summary belongs to one run.
 */
public class RunSummary {

    private static final Logger log = LoggerFactory.getLogger(RunSummary.class);

    private final Map<Outcome, Integer> counts = new EnumMap<>(Outcome.class);
    private final List<VerificationReport> unsuccessful = new ArrayList<>();

    public RunSummary() {
        for (Outcome o : Outcome.values()) {
            counts.put(o, 0);
        }
    }

    /** Adds one report to the tally and returns it. */
    public VerificationReport record(VerificationReport report) {
        counts.merge(report.getOutcome(), 1, Integer::sum);
        if (!report.isSuccess()) {
            unsuccessful.add(report);
        }
        return report;
    }

    public int count(Outcome outcome) {
        return counts.get(outcome);
    }

    /** Checks that passed, including newly generated references. */
    public int getPassed() {
        return count(Outcome.PASSED) + getGenerated();
    }

    public int getGenerated() {
        return count(Outcome.GENERATED) + count(Outcome.REGENERATED);
    }

    public int getFailed() {
        return count(Outcome.FAILED);
    }

    public int getErrors() {
        return count(Outcome.ERROR);
    }

    public int getTotal() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    /** True when nothing failed and nothing errored. */
    public boolean isSuccessful() {
        return getFailed() == 0 && getErrors() == 0;
    }

    /** Failed and errored reports, in the order they were recorded. */
    public List<VerificationReport> getUnsuccessful() {
        return Collections.unmodifiableList(unsuccessful);
    }

    /** Multi-line summary suitable for a console or log. */
    public String format() {
        StringBuilder sb = new StringBuilder("Summary:\n");
        sb.append("  Passed:    ").append(getPassed());
        if (getGenerated() > 0) {
            sb.append(" (").append(getGenerated()).append(" generated)");
        }
        sb.append('\n');
        sb.append("  Failed:    ").append(getFailed()).append('\n');
        if (getErrors() > 0) {
            sb.append("  Errors:    ").append(getErrors()).append('\n');
        }
        sb.append("  Total:     ").append(getTotal());
        for (VerificationReport r : unsuccessful) {
            sb.append("\n    ").append(r.getOutcome()).append(' ').append(r.getName())
                    .append(": ").append(r.getMessage());
        }
        return sb.toString();
    }

    /** Writes {@link #format()} to the log at INFO, or WARN when the run failed. */
    public void log() {
        if (isSuccessful()) {
            log.info("{}", format());
        } else {
            log.warn("{}", format());
        }
    }
}
