package fasal.disease.pojo;

/**
 * Coarse grouping of a leaf condition, used by the severity policy.
 */
public enum ConditionCategory {
    HEALTHY,
    BACKGROUND,
    FUNGAL,
    BACTERIAL,
    VIRAL,
    BLIGHT,
    ROT,
    PEST
}
