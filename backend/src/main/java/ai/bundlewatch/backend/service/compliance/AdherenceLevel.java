package ai.bundlewatch.backend.service.compliance;

public enum AdherenceLevel {
    FULL,
    PARTIAL,
    LOW;

    public static AdherenceLevel of(double percentage) {
        if (percentage >= 100.0) {
            return FULL;
        }
        return percentage > 50.0 ? PARTIAL : LOW;
    }
}
