package ai.bundlewatch.backend.model.bundle;

import ai.bundlewatch.backend.model.context.PatientContext;

import java.util.function.Predicate;

/**
 * Conditional requirement evaluated against the patient context before an element is checked.
 */
public enum ContextCondition {
    INFLAMMATORY_MARKERS_ABNORMAL("inflammatory markers abnormal", PatientContext::isInflammatoryMarkersAbnormal),
    UA_ABNORMAL("urinalysis abnormal", PatientContext::isUaAbnormal),
    DISPOSITION_HOME("disposition is home", PatientContext::isDispositionHome);

    private final String description;
    private final Predicate<PatientContext> predicate;

    ContextCondition(String description, Predicate<PatientContext> predicate) {
        this.description = description;
        this.predicate = predicate;
    }

    public String getDescription() {
        return description;
    }

    public boolean test(PatientContext context) {
        return predicate.test(context);
    }
}
