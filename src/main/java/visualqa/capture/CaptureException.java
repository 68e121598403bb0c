package visualqa.capture;

/**
 * Unchecked exception thrown when the capture side cannot supply a usable raw
 * frame: the collaborator returned nothing, failed outright, or handed over a
 * buffer or format descriptor that is structurally invalid.
 */
public class CaptureException extends RuntimeException {

    public CaptureException(String msg) {
        super(msg);
    }

    public CaptureException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
