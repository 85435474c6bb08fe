package ai.bundlewatch.backend.service.context;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of applicability resolution for one element.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Applicability {

    public enum Decision {
        APPLICABLE,
        NOT_APPLICABLE,
        /** A prerequisite element is still PENDING. */
        UNDECIDED
    }

    private static final Applicability APPLICABLE = new Applicability(Decision.APPLICABLE, null);
    private static final Applicability UNDECIDED = new Applicability(Decision.UNDECIDED, "Awaiting prerequisite element");

    Decision decision;

    String reason;

    public static Applicability applicable() {
        return APPLICABLE;
    }

    public static Applicability undecided() {
        return UNDECIDED;
    }

    public static Applicability notApplicable(String reason) {
        return new Applicability(Decision.NOT_APPLICABLE, reason);
    }
}
