package fasal.config.pojo;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Root of fasal.yml.
 */
@Data
public class GlobalConfigurations {

    @JsonProperty("system_title")
    private String systemTitle = "Fasal Mitra";

    @JsonProperty("upload")
    private UploadConfig upload = new UploadConfig();

    @JsonProperty("classifier")
    private ClassifierConfig classifier = new ClassifierConfig();

    @JsonProperty("severity")
    private SeverityConfig severity = new SeverityConfig();

    @JsonProperty("advice")
    private AdviceConfig advice = new AdviceConfig();

    @JsonProperty("detection")
    private DetectionConfig detection = new DetectionConfig();

    @JsonProperty("data")
    private DataConfig data = new DataConfig();
}
