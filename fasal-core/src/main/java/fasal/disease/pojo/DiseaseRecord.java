package fasal.disease.pojo;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Knowledge base entry for one disease label.
 */
@Getter
@ToString
@AllArgsConstructor
public class DiseaseRecord {
    private final ClassLabel label;
    private final String name;
    private final String cause;
    private final String cure;
}
