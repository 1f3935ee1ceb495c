package fasal.disease;

import cn.hutool.core.util.StrUtil;
import fasal.config.pojo.DetectionConfig.CropMismatchPolicy;
import fasal.disease.pojo.ClassLabel;
import fasal.disease.pojo.ClassificationResult;
import fasal.disease.pojo.DetectionRequest;
import fasal.disease.pojo.DetectionResponse;
import fasal.disease.pojo.SeverityTier;
import fasal.disease.pojo.TreatmentPlan;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

public class ResponseAssembler {
    public static final String MODEL_NOT_AVAILABLE = "MODEL_NOT_AVAILABLE";

    private final CropMismatchPolicy mismatchPolicy;
    private final Clock clock;

    public ResponseAssembler(CropMismatchPolicy mismatchPolicy) {
        this(mismatchPolicy, Clock.systemDefaultZone());
    }

    public ResponseAssembler(CropMismatchPolicy mismatchPolicy, Clock clock) {
        this.mismatchPolicy = mismatchPolicy == null ? CropMismatchPolicy.IGNORE : mismatchPolicy;
        this.clock = clock;
    }

    public DetectionResponse assemble(DetectionRequest request, ClassificationResult result,
                                      SeverityTier severity, TreatmentPlan plan, String modelUsed) {
        ClassLabel label = result.getLabel();
        if (label.isDisease() && (plan.getRecommendations() == null || plan.getRecommendations().isEmpty())) {
            throw new IllegalStateException("No recommendations produced for " + label.getKey());
        }
        SeverityTier tier = severity == null ? SeverityTier.NONE : severity;
        return DetectionResponse.builder()
                .detectionId(UUID.randomUUID().toString())
                .timestamp(OffsetDateTime.now(clock).toString())
                .cropType(request.getCropHint())
                .cropDetected(label.getCrop())
                .location(request.getLocation())
                .diseaseLabel(label.getKey())
                .conditionName(label.getConditionName())
                .diseaseName(label.getDisplayName())
                .isHealthy(label.isHealthy())
                .confidencePercent(Math.max(0, Math.min(100, result.getConfidencePercent())))
                .severity(tier)
                .urgency(tier.getUrgency())
                .cause(plan.getCause())
                .treatment(plan.getTreatment())
                .recommendations(new ArrayList<>(plan.getRecommendations()))
                .nextSteps(new ArrayList<>(plan.getNextSteps()))
                .generatedAdvice(plan.getGeneratedAdvice())
                .warnings(warnings(request.getCropHint(), label))
                .modelUsed(modelUsed)
                .fallback(false)
                .build();
    }

    /**
     * Response shown while the classifier is unavailable. Clearly marked, never a diagnosis.
     */
    public DetectionResponse assembleFallback(DetectionRequest request, String reason) {
        return DetectionResponse.builder()
                .detectionId(UUID.randomUUID().toString())
                .timestamp(OffsetDateTime.now(clock).toString())
                .cropType(request == null ? null : request.getCropHint())
                .location(request == null ? null : request.getLocation())
                .diseaseLabel(MODEL_NOT_AVAILABLE)
                .diseaseName("Unable to detect disease")
                .confidencePercent(0)
                .severity(SeverityTier.NONE)
                .urgency(SeverityTier.NONE.getUrgency())
                .cause("Disease detection model not loaded")
                .treatment("Please consult a local agricultural expert until the service is restored")
                .recommendations(new ArrayList<>(Arrays.asList(
                        "Disease detection model is not available. Please contact the administrator.",
                        "Fallback: consult your local agricultural expert for a manual diagnosis")))
                .nextSteps(new ArrayList<>(Arrays.asList(
                        "1. Try again later",
                        "2. For immediate help, consult an agricultural expert")))
                .modelUsed("Fallback (model not loaded)")
                .fallback(true)
                .error(reason)
                .build();
    }

    private List<String> warnings(String cropHint, ClassLabel label) {
        List<String> warnings = new ArrayList<>();
        if (mismatchPolicy == CropMismatchPolicy.WARN && !label.isBackground()
                && StrUtil.isNotBlank(cropHint) && !label.getCrop().equalsIgnoreCase(cropHint.trim())) {
            warnings.add(StrUtil.format("Selected crop '{}' differs from the detected crop '{}'",
                    cropHint.trim(), label.getCrop()));
        }
        return warnings;
    }
}
