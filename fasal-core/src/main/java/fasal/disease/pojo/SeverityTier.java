package fasal.disease.pojo;

import com.fasterxml.jackson.annotation.JsonValue;
import com.google.gson.annotations.SerializedName;

import java.util.Locale;

/**
 * Ordered from least to most serious; compareTo follows that order.
 */
public enum SeverityTier {
    @SerializedName("none") NONE("None"),
    @SerializedName("mild") MILD("Low"),
    @SerializedName("moderate") MODERATE("Medium"),
    @SerializedName("severe") SEVERE("High");

    private final String urgency;

    SeverityTier(String urgency) {
        this.urgency = urgency;
    }

    public String getUrgency() {
        return urgency;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean atLeast(SeverityTier other) {
        return compareTo(other) >= 0;
    }
}
