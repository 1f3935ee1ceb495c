package fasal.disease.pojo;

public enum ModelStatus {
    NOT_LOADED,
    READY,
    DEGRADED,
    CLOSED
}
