package fasal.common.exception;

/**
 * The detection did not finish within the configured deadline. Safe to retry.
 */
public class DetectionTimeoutException extends RRException {
    private static final long serialVersionUID = 1L;

    public DetectionTimeoutException(long timeoutMillis) {
        super(504, "Detection timed out after " + timeoutMillis + " ms, please retry");
    }
}
