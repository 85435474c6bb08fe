package ai.bundlewatch.backend.model.bundle;

/**
 * Age stratification for febrile infant evaluation (AAP 2021).
 * Boundaries are inclusive and expressed in days since birth.
 */
public enum AgeGroup {
    DAYS_0_7("0-7", 0, 7),
    DAYS_8_21("8-21", 8, 21),
    DAYS_22_28("22-28", 22, 28),
    DAYS_29_60("29-60", 29, 60),
    UNKNOWN("unknown", -1, -1);

    private final String label;
    private final int minDays;
    private final int maxDays;

    AgeGroup(String label, int minDays, int maxDays) {
        this.label = label;
        this.minDays = minDays;
        this.maxDays = maxDays;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Resolves the age group for an age in days.
     *
     * @param ageDays age in days, may be null when the birth date is unknown
     * @return the matching group, or UNKNOWN when the age is missing or outside 0-60 days
     */
    public static AgeGroup fromAgeDays(Integer ageDays) {
        if (ageDays == null) {
            return UNKNOWN;
        }
        for (AgeGroup group : values()) {
            if (group != UNKNOWN && ageDays >= group.minDays && ageDays <= group.maxDays) {
                return group;
            }
        }
        return UNKNOWN;
    }
}
