package fasal.disease;

import fasal.common.exception.AdviceUnavailableException;
import fasal.disease.pojo.ClassLabel;
import fasal.disease.pojo.ClassificationResult;
import fasal.disease.pojo.DiseaseRecord;
import fasal.disease.pojo.SeverityTier;
import fasal.disease.pojo.TreatmentPlan;
import fasal.llm.adapter.IAdviceGeneratorAdapter;
import fasal.llm.pojo.AdviceContext;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Builds the recommendation list and next-steps checklist for a diagnosis.
 * The generated narrative is optional: any generator failure only drops that field.
 */
@Slf4j
public class TreatmentAdvisor {
    public static final String REUPLOAD_RECOMMENDATION =
            "No plant leaf detected. Please re-upload a clearer image of the affected plant leaf.";
    static final String HEALTHY_CAUSE = "No disease detected";
    static final String HEALTHY_TREATMENT = "No treatment needed";

    private final DiseaseKnowledgeBase knowledgeBase;
    private final IAdviceGeneratorAdapter adviceGenerator;

    public TreatmentAdvisor(DiseaseKnowledgeBase knowledgeBase, IAdviceGeneratorAdapter adviceGenerator) {
        this.knowledgeBase = knowledgeBase;
        this.adviceGenerator = adviceGenerator;
    }

    public TreatmentPlan advise(ClassificationResult result, SeverityTier severity, String location) {
        ClassLabel label = result.getLabel();
        if (label.isBackground()) {
            return TreatmentPlan.builder()
                    .recommendations(backgroundRecommendations())
                    .nextSteps(Arrays.asList(
                            "1. Photograph a single affected leaf against a plain background",
                            "2. Make sure the leaf fills most of the frame and is in focus",
                            "3. Upload the new image"))
                    .build();
        }
        if (label.isHealthy()) {
            return TreatmentPlan.builder()
                    .cause(HEALTHY_CAUSE)
                    .treatment(HEALTHY_TREATMENT)
                    .recommendations(healthyRecommendations(label.getCrop()))
                    .nextSteps(Arrays.asList(
                            "Continue regular monitoring",
                            "Maintain good agricultural practices",
                            "Keep records of plant health"))
                    .build();
        }

        DiseaseRecord record = knowledgeBase.record(label);
        return TreatmentPlan.builder()
                .cause(record.getCause())
                .treatment(record.getCure())
                .recommendations(diseaseRecommendations(label.getCrop(), severity, result.getConfidencePercent()))
                .nextSteps(diseaseNextSteps(severity))
                .generatedAdvice(generatedAdvice(label, severity, result.getConfidencePercent(), location))
                .build();
    }

    public boolean isAdviceEnabled() {
        return adviceGenerator != null && adviceGenerator.isEnabled();
    }

    private String generatedAdvice(ClassLabel label, SeverityTier severity, double confidence, String location) {
        if (!isAdviceEnabled()) {
            return null;
        }
        AdviceContext context = AdviceContext.builder()
                .crop(label.getCrop())
                .condition(label.getConditionName())
                .severity(severity)
                .confidencePercent(confidence)
                .location(location)
                .build();
        try {
            return adviceGenerator.generateAdvice(context);
        } catch (AdviceUnavailableException e) {
            log.warn("Generated advice omitted for {}: {}", label.getKey(), e.getMsg());
        } catch (RuntimeException e) {
            log.warn("Generated advice omitted for {}", label.getKey(), e);
        }
        return null;
    }

    private static List<String> backgroundRecommendations() {
        List<String> recommendations = new ArrayList<>();
        recommendations.add(REUPLOAD_RECOMMENDATION);
        recommendations.add("Use daylight and avoid shadows or blur");
        return recommendations;
    }

    private static List<String> healthyRecommendations(String crop) {
        List<String> recommendations = new ArrayList<>();
        recommendations.add("Your " + crop + " plant appears healthy!");
        recommendations.add("Continue current care practices");
        recommendations.add("Monitor regularly for any changes");
        recommendations.add("Maintain proper watering and fertilization");
        return recommendations;
    }

    private static List<String> diseaseRecommendations(String crop, SeverityTier severity, double confidence) {
        List<String> recommendations = new ArrayList<>();
        recommendations.add(String.format(Locale.ROOT, "Disease detected with %.1f%% confidence", confidence));
        switch (severity) {
            case SEVERE:
                recommendations.add("URGENT: Immediate action required");
                recommendations.add("Inspect entire " + crop + " field for similar symptoms");
                recommendations.add("Isolate affected plants immediately");
                recommendations.add("Contact local agricultural extension officer");
                break;
            case MODERATE:
                recommendations.add("Monitor your " + crop + " plants closely");
                recommendations.add("Begin treatment within 24-48 hours");
                recommendations.add("Check neighboring plants for symptoms");
                recommendations.add("Document affected area for tracking");
                break;
            default:
                recommendations.add("Monitor " + crop + " plants daily");
                recommendations.add("Early intervention can prevent spread");
                recommendations.add("Consider preventive treatment for nearby plants");
                break;
        }
        return recommendations;
    }

    private static List<String> diseaseNextSteps(SeverityTier severity) {
        switch (severity) {
            case SEVERE:
                return Arrays.asList(
                        "1. Apply recommended treatment immediately",
                        "2. Remove and destroy severely affected plant parts",
                        "3. Prevent spread to healthy plants",
                        "4. Consult agricultural expert if condition worsens",
                        "5. Monitor daily for the next week");
            case MODERATE:
                return Arrays.asList(
                        "1. Apply recommended treatment within 48 hours",
                        "2. Monitor affected plants twice daily",
                        "3. Isolate affected area if possible",
                        "4. Document progression with photos");
            default:
                return Arrays.asList(
                        "1. Apply preventive treatment",
                        "2. Monitor daily for changes",
                        "3. Maintain good field hygiene",
                        "4. Keep records for future reference");
        }
    }
}
