package fasal.config.pojo;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Limits applied to an upload before any decoding happens.
 */
@Data
public class UploadConfig {

    @JsonProperty("max_bytes")
    private long maxBytes = 10L * 1024 * 1024;

    @JsonProperty("min_bytes")
    private long minBytes = 100;

    @JsonProperty("accepted_types")
    private List<String> acceptedTypes = new ArrayList<>(Arrays.asList(
            "image/jpeg", "image/jpg", "image/png", "image/bmp", "image/gif"));

    @JsonProperty("require_crop_hint")
    private boolean requireCropHint = true;
}
