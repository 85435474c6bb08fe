package ai.bundlewatch.backend.config;

/**
 * LOINC codes and clinical thresholds shared by bundle definitions and checkers.
 */
public final class ClinicalCodes {

    // Sepsis and general labs
    public static final String LOINC_LACTATE = "2524-7";
    public static final String LOINC_BLOOD_CULTURE = "600-7";
    public static final String LOINC_WOUND_CULTURE = "6462-6";

    // Vital signs
    public static final String LOINC_SYSTOLIC_BP = "8480-6";
    public static final String LOINC_MEAN_BP = "8478-0";

    // Febrile infant labs
    public static final String LOINC_PROCALCITONIN = "33959-8";
    public static final String LOINC_CRP = "1988-5";
    public static final String LOINC_ANC = "751-8";
    public static final String LOINC_UA = "5767-9";
    public static final String LOINC_UA_WBC = "5821-4";
    public static final String LOINC_UA_LE = "5799-2";
    public static final String LOINC_URINE_CULTURE = "630-4";
    public static final String LOINC_CSF_WBC = "806-0";
    public static final String LOINC_CSF_RBC = "804-5";

    // Note types
    public static final String NOTE_ID_CONSULT = "11488-4";
    public static final String NOTE_ID_CONSULT_ALT = "34117-2";
    public static final String NOTE_PROGRESS = "11506-3";

    // Inflammatory marker thresholds (AAP 2021)
    public static final double PCT_ABNORMAL_NG_ML = 0.5;
    public static final double ANC_ABNORMAL_PER_UL = 4000;
    public static final double CRP_ABNORMAL_MG_DL = 2.0;
    public static final double UA_WBC_ABNORMAL_PER_HPF = 5;

    // Hypoperfusion
    public static final double LACTATE_ELEVATED_MMOL_L = 2.0;
    public static final double LACTATE_SHOCK_MMOL_L = 4.0;
    public static final double MAP_HYPOTENSION_MMHG = 65;

    private ClinicalCodes() {
    }
}
