package fasal.common.exception;

public class DecodeException extends RRException {
    private static final long serialVersionUID = 1L;

    public DecodeException(String msg) {
        super(422, msg);
    }

    public DecodeException(String msg, Throwable cause) {
        super(422, msg, cause);
    }
}
