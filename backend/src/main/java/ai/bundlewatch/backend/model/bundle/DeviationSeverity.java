package ai.bundlewatch.backend.model.bundle;

public enum DeviationSeverity {
    INFO("info"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String value;

    DeviationSeverity(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
