package fasal.config.pojo;

import com.fasterxml.jackson.annotation.JsonProperty;
import fasal.disease.pojo.ConditionCategory;
import lombok.Data;

import java.util.EnumSet;
import java.util.Set;

/**
 * Heuristic severity table. Thresholds are confidence percentages.
 */
@Data
public class SeverityConfig {

    @JsonProperty("high_impact_categories")
    private Set<ConditionCategory> highImpactCategories =
            EnumSet.of(ConditionCategory.ROT, ConditionCategory.BLIGHT, ConditionCategory.VIRAL);

    @JsonProperty("moderate_categories")
    private Set<ConditionCategory> moderateCategories =
            EnumSet.of(ConditionCategory.FUNGAL, ConditionCategory.BACTERIAL);

    @JsonProperty("severe_threshold")
    private double severeThreshold = 85.0;

    @JsonProperty("high_impact_moderate_threshold")
    private double highImpactModerateThreshold = 70.0;

    @JsonProperty("moderate_threshold")
    private double moderateThreshold = 70.0;
}
