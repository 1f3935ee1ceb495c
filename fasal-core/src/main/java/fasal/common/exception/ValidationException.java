package fasal.common.exception;

import lombok.Getter;

@Getter
public class ValidationException extends RRException {
    private static final long serialVersionUID = 1L;

    private final ValidationReason reason;

    public ValidationException(ValidationReason reason, String detail) {
        super(400, detail);
        this.reason = reason;
    }
}
