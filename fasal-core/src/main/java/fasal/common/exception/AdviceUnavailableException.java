package fasal.common.exception;

public class AdviceUnavailableException extends RRException {
    private static final long serialVersionUID = 1L;

    public AdviceUnavailableException(String msg) {
        super(502, msg);
    }

    public AdviceUnavailableException(String msg, Throwable cause) {
        super(502, msg, cause);
    }
}
