package ai.bundlewatch.backend.model.bundle;

/**
 * Workup, treatment and disposition actions of the febrile infant pathway.
 */
public enum FebrileInfantAction {
    URINALYSIS,
    BLOOD_CULTURE,
    INFLAMMATORY_MARKERS,
    PROCALCITONIN,
    URINE_CULTURE,
    LUMBAR_PUNCTURE,
    PARENTERAL_ANTIBIOTICS,
    HSV_ASSESSMENT,
    ADMISSION,
    DISCHARGE_CHECKLIST
}
