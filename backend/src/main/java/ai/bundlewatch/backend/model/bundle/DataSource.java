package ai.bundlewatch.backend.model.bundle;

/**
 * Evidence capability an element is checked against. Each value maps to at most one checker.
 * Sources without a registered checker leave their elements PENDING with a diagnostic note.
 */
public enum DataSource {
    LAB,
    MEDICATION,
    NOTE,
    AGE_STRATIFIED,
    /** Imaging orders and reads. No checker. */
    IMAGING,
    /** Charted vital signs. No checker. */
    VITALS,
    /** Bedside and operative procedures. No checker. */
    PROCEDURE,
    /** Culture interpretation against colony-count thresholds. No checker. */
    MICROBIOLOGY,
    /** Follow-up appointments. No checker. */
    SCHEDULING
}
