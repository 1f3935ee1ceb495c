package fasal.common.exception;

import fasal.disease.pojo.DetectionResponse;
import lombok.Getter;

/**
 * Raised while the classifier is degraded. Optionally carries a fallback response
 * that callers can show instead of a diagnosis.
 */
@Getter
public class ModelUnavailableException extends RRException {
    private static final long serialVersionUID = 1L;

    private final String reason;
    private final transient DetectionResponse fallbackResponse;

    public ModelUnavailableException(String reason) {
        this(reason, null);
    }

    public ModelUnavailableException(String reason, DetectionResponse fallbackResponse) {
        super(503, "Disease detection model is not available: " + reason);
        this.reason = reason;
        this.fallbackResponse = fallbackResponse;
    }
}
