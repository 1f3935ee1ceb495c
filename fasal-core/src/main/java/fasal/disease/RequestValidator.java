package fasal.disease;

import cn.hutool.core.util.StrUtil;
import fasal.common.exception.ValidationException;
import fasal.common.exception.ValidationReason;
import fasal.config.pojo.UploadConfig;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Cheap checks on upload metadata, run before the image is decoded.
 */
public class RequestValidator {

    private final long maxBytes;
    private final long minBytes;
    private final Set<String> acceptedTypes;
    private final boolean requireCropHint;

    public RequestValidator(UploadConfig config) {
        this.maxBytes = config.getMaxBytes();
        this.minBytes = Math.max(1, config.getMinBytes());
        this.acceptedTypes = config.getAcceptedTypes().stream()
                .map(RequestValidator::normalizeType)
                .collect(Collectors.toSet());
        this.requireCropHint = config.isRequireCropHint();
    }

    public void validate(long byteLength, String contentType, String cropHint) {
        if (byteLength > maxBytes) {
            throw new ValidationException(ValidationReason.TOO_LARGE,
                    StrUtil.format("File size {} bytes exceeds the {} byte limit", byteLength, maxBytes));
        }
        if (byteLength < minBytes) {
            throw new ValidationException(ValidationReason.TOO_SMALL,
                    StrUtil.format("File size {} bytes is below the {} byte minimum", byteLength, minBytes));
        }
        if (contentType == null || !acceptedTypes.contains(normalizeType(contentType))) {
            throw new ValidationException(ValidationReason.UNSUPPORTED_TYPE,
                    "Unsupported file type " + contentType + ", expected one of " + acceptedTypes);
        }
        if (requireCropHint && StrUtil.isBlank(cropHint)) {
            throw new ValidationException(ValidationReason.MISSING_CROP_HINT, "Crop type is required");
        }
    }

    // "Image/JPEG; charset=x" -> "image/jpeg"
    static String normalizeType(String contentType) {
        int semicolon = contentType.indexOf(';');
        String base = semicolon >= 0 ? contentType.substring(0, semicolon) : contentType;
        return base.trim().toLowerCase(Locale.ROOT);
    }
}
