package visualqa.golden;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import visualqa.compare.ComparisonPolicy;
import visualqa.model.CompareResult;

import java.time.Instant;

/**
 * Record of one golden-file check: what was compared, under which policy, the
 * outcome, and where any artifacts were written.
 *
 * <p>Serialized to {@code <name>_result.json} next to the failure artifacts by
 * {@link ReportWriter}. {@code result} is absent for generated references and for
 * checks that ended in {@link Outcome#ERROR}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VerificationReport {

    @JsonProperty("name")
    private String name;

    @JsonProperty("outcome")
    private Outcome outcome;

    @JsonProperty("message")
    private String message;

    @JsonProperty("policy")
    private ComparisonPolicy policy;

    @JsonProperty("result")
    private CompareResult result;

    @JsonProperty("referencePath")
    private String referencePath;

    @JsonProperty("capturePath")
    private String capturePath;

    @JsonProperty("diffPath")
    private String diffPath;

    @JsonProperty("timestamp")
    private Instant timestamp;

    public VerificationReport() {}

    public VerificationReport(String name, Outcome outcome, String message) {
        this.name      = name;
        this.outcome   = outcome;
        this.message   = message;
        this.timestamp = Instant.now();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return outcome != null && outcome.isSuccess();
    }

    public String getName()            { return name; }
    public Outcome getOutcome()        { return outcome; }
    public String getMessage()         { return message; }
    public ComparisonPolicy getPolicy() { return policy; }
    public CompareResult getResult()   { return result; }
    public String getReferencePath()   { return referencePath; }
    public String getCapturePath()     { return capturePath; }
    public String getDiffPath()        { return diffPath; }
    public Instant getTimestamp()      { return timestamp; }

    public void setName(String name)                  { this.name = name; }
    public void setOutcome(Outcome outcome)           { this.outcome = outcome; }
    public void setMessage(String message)            { this.message = message; }
    public void setPolicy(ComparisonPolicy policy)    { this.policy = policy; }
    public void setResult(CompareResult result)       { this.result = result; }
    public void setReferencePath(String referencePath) { this.referencePath = referencePath; }
    public void setCapturePath(String capturePath)    { this.capturePath = capturePath; }
    public void setDiffPath(String diffPath)          { this.diffPath = diffPath; }
    public void setTimestamp(Instant timestamp)       { this.timestamp = timestamp; }

    @Override
    public String toString() {
        return String.format("VerificationReport{name=%s, outcome=%s, message=%s}", name, outcome, message);
    }
}
