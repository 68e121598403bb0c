package visualqa.golden;

/** Result of checking one named capture against its reference image. */
public enum Outcome {

    /** No reference existed; the capture was saved as the new reference. */
    GENERATED,

    /** Regeneration was requested; an existing reference was replaced. */
    REGENERATED,

    /** The capture matched the reference under the comparison policy. */
    PASSED,

    /** The capture did not match the reference. */
    FAILED,

    /** The check could not be carried out (capture or file I/O failure). */
    ERROR;

    /** Whether this outcome lets a run succeed. */
    public boolean isSuccess() {
        return this == GENERATED || this == REGENERATED || this == PASSED;
    }
}
