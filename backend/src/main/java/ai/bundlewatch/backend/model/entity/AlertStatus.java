package ai.bundlewatch.backend.model.entity;

public enum AlertStatus {
    PENDING,
    SENT,
    ACKNOWLEDGED,
    RESOLVED
}
