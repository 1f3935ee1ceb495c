package fasal.disease.pojo;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class ClassificationResult {
    private final ClassLabel label;
    private final int classIndex;
    private final double confidencePercent;
}
