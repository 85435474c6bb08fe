package ai.bundlewatch.backend.model.entity;

public enum AlertType {
    GUIDELINE_DEVIATION
}
