package fasal.common.exception;

/**
 * Machine readable reason attached to a rejected upload.
 */
public enum ValidationReason {
    TOO_LARGE("TooLarge"),
    TOO_SMALL("TooSmall"),
    UNSUPPORTED_TYPE("UnsupportedType"),
    MISSING_CROP_HINT("MissingCropHint");

    private final String code;

    ValidationReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
