package ai.bundlewatch.backend.model.bundle;

public enum MedicationCategory {
    /** Broad-spectrum antibiotic by any route. */
    BROAD_SPECTRUM_ANTIBIOTIC,
    /** Crystalloid given as a bolus rather than maintenance fluid. */
    CRYSTALLOID_BOLUS,
    /** Any antibiotic given by a parenteral route. */
    PARENTERAL_ANTIBIOTIC,
    /** Aminopenicillin or penicillin, first line for uncomplicated pneumonia. */
    FIRST_LINE_PNEUMONIA_ANTIBIOTIC,
    /** Oral cephalosporin, TMP-SMX or nitrofurantoin. */
    UTI_EMPIRIC_ANTIBIOTIC,
    /** Cefepime, piperacillin-tazobactam or meropenem. */
    ANTIPSEUDOMONAL_BETA_LACTAM
}
