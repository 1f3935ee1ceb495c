package fasal.config.pojo;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Classpath locations of the static tables.
 */
@Data
public class DataConfig {

    @JsonProperty("class_labels")
    private String classLabels = "/data/class_labels.txt";

    @JsonProperty("disease_database")
    private String diseaseDatabase = "/data/plant_diseases.json";
}
