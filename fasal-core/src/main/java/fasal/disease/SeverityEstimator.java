package fasal.disease;

import fasal.config.pojo.SeverityConfig;
import fasal.disease.pojo.ClassLabel;
import fasal.disease.pojo.ConditionCategory;
import fasal.disease.pojo.SeverityTier;

/**
 * Heuristic severity from condition category and confidence.
 * For a fixed category the tier never drops as confidence rises.
 */
public class SeverityEstimator {

    private final SeverityConfig config;

    public SeverityEstimator(SeverityConfig config) {
        if (config.getHighImpactModerateThreshold() > config.getSevereThreshold()) {
            throw new IllegalArgumentException("high_impact_moderate_threshold must not exceed severe_threshold");
        }
        this.config = config;
    }

    public SeverityTier severity(ClassLabel label, double confidencePercent) {
        return severity(label.getCategory(), confidencePercent);
    }

    public SeverityTier severity(ConditionCategory category, double confidencePercent) {
        if (category == ConditionCategory.HEALTHY || category == ConditionCategory.BACKGROUND) {
            return SeverityTier.NONE;
        }
        if (config.getHighImpactCategories().contains(category)) {
            if (confidencePercent >= config.getSevereThreshold()) {
                return SeverityTier.SEVERE;
            }
            if (confidencePercent >= config.getHighImpactModerateThreshold()) {
                return SeverityTier.MODERATE;
            }
            return SeverityTier.MILD;
        }
        if (config.getModerateCategories().contains(category)
                && confidencePercent >= config.getModerateThreshold()) {
            return SeverityTier.MODERATE;
        }
        return SeverityTier.MILD;
    }
}
