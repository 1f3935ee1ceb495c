package fasal.disease.pojo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@Builder
@ToString
@AllArgsConstructor
public class TreatmentPlan {
    private final String cause;
    private final String treatment;
    private final List<String> recommendations;
    private final List<String> nextSteps;
    private final String generatedAdvice;
}
