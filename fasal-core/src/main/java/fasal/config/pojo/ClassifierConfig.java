package fasal.config.pojo;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Pretrained leaf classifier settings.
 */
@Data
public class ClassifierConfig {

    /**
     * onnx is the only runtime shipped
     */
    @JsonProperty("backend")
    private String backend = "onnx";

    @JsonProperty("model_path")
    private String modelPath = "models/plant_disease_recog_model.onnx";

    @JsonProperty("model_name")
    private String modelName = "CNN (39 classes)";

    /**
     * Square edge length the model was trained on.
     */
    @JsonProperty("input_size")
    private int inputSize = 160;

    @JsonProperty("scale_min")
    private float scaleMin = 0f;

    @JsonProperty("scale_max")
    private float scaleMax = 1f;

    /**
     * Set when the exported model emits logits instead of probabilities.
     */
    @JsonProperty("apply_softmax")
    private boolean applySoftmax = false;

    /**
     * Load at startup instead of on the first detection.
     */
    @JsonProperty("eager_load")
    private boolean eagerLoad = true;

    @JsonProperty("intra_op_threads")
    private int intraOpThreads = 0;
}
