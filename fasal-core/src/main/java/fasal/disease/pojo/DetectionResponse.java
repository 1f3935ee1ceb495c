package fasal.disease.pojo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionResponse {
    private String detectionId;
    private String timestamp;
    private String cropType;
    private String cropDetected;
    private String location;
    private String diseaseLabel;
    private String conditionName;
    private String diseaseName;
    private Boolean isHealthy;
    private double confidencePercent;
    private SeverityTier severity;
    private String urgency;
    private String cause;
    private String treatment;
    @Builder.Default
    private List<String> recommendations = new ArrayList<>();
    @Builder.Default
    private List<String> nextSteps = new ArrayList<>();
    private String generatedAdvice;
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
    private String modelUsed;
    private boolean fallback;
    private String error;
}
