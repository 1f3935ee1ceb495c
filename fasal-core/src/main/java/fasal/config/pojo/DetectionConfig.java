package fasal.config.pojo;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class DetectionConfig {

    @JsonProperty("timeout_millis")
    private long timeoutMillis = 30000;

    @JsonProperty("worker_threads")
    private int workerThreads = 4;

    @JsonProperty("queue_size")
    private int queueSize = 64;

    /**
     * IGNORE or WARN when the detected crop differs from the declared one.
     */
    @JsonProperty("crop_mismatch_policy")
    private CropMismatchPolicy cropMismatchPolicy = CropMismatchPolicy.IGNORE;

    public enum CropMismatchPolicy {
        IGNORE,
        WARN
    }
}
