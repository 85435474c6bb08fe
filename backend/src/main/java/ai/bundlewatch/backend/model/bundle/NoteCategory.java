package ai.bundlewatch.backend.model.bundle;

import ai.bundlewatch.backend.config.ClinicalCodes;

import java.util.List;

/**
 * Documentation requirement checked by scanning free-text notes.
 * Each category carries its keyword set, an optional note-type filter and the offset
 * (from the trigger) at which its note window opens.
 */
public enum NoteCategory {

    REASSESSMENT(48.0,
            List.of(ClinicalCodes.NOTE_ID_CONSULT, ClinicalCodes.NOTE_ID_CONSULT_ALT, ClinicalCodes.NOTE_PROGRESS),
            List.of("reassessment", "antibiotic review", "antimicrobial review", "asp review",
                    "stewardship review", "day 2 review", "day 3 review", "48 hour", "48h review",
                    "72 hour", "culture review", "de-escalation", "narrowing", "spectrum",
                    "id consult", "infectious disease")),

    RISK_STRATIFICATION(0.0, List.of(),
            List.of("high risk", "low risk", "risk stratification", "risk assessment",
                    "mascc score", "risk category", "risk classification")),

    MARGIN_MARKING(0.0, List.of(),
            List.of("margins marked", "borders marked", "demarcated", "outlined",
                    "border outlined", "circumscribed")),

    HSV_ASSESSMENT(0.0, List.of(),
            List.of("hsv", "herpes", "acyclovir", "hsv risk", "vesicles")),

    DISCHARGE_CHECKLIST(0.0, List.of(),
            List.of("follow-up", "followup", "return precautions", "phone number", "transportation")),

    /** Keywords come from the element description instead of a fixed list. */
    GENERIC(0.0, List.of(), List.of());

    private final double opensAfterHours;
    private final List<String> noteTypes;
    private final List<String> keywords;

    NoteCategory(double opensAfterHours, List<String> noteTypes, List<String> keywords) {
        this.opensAfterHours = opensAfterHours;
        this.noteTypes = noteTypes;
        this.keywords = keywords;
    }

    public double getOpensAfterHours() {
        return opensAfterHours;
    }

    public List<String> getNoteTypes() {
        return noteTypes;
    }

    public List<String> getKeywords() {
        return keywords;
    }
}
