package fasal.llm.pojo;

import fasal.disease.pojo.SeverityTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What the advice generator is told about one diagnosis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdviceContext {
    private String crop;
    private String condition;
    private SeverityTier severity;
    private double confidencePercent;
    private String location;
}
