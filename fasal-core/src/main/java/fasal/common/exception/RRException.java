package fasal.common.exception;

import lombok.Getter;

/**
 * Base runtime exception carrying a response code and a caller-facing message.
 */
@Getter
public class RRException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int code;
    private final String msg;

    public RRException(String msg) {
        this(500, msg);
    }

    public RRException(int code, String msg) {
        super(msg);
        this.code = code;
        this.msg = msg;
    }

    public RRException(int code, String msg, Throwable cause) {
        super(msg, cause);
        this.code = code;
        this.msg = msg;
    }
}
