package ai.bundlewatch.backend.service.checker;

import ai.bundlewatch.backend.config.ClinicalCodes;
import ai.bundlewatch.backend.model.evidence.LabResult;
import ai.bundlewatch.backend.model.evidence.VitalSign;
import ai.bundlewatch.backend.service.evidence.EvidenceSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Shock / hypoperfusion assessment gating the fluid bolus element:
 * age-adjusted systolic hypotension, MAP below 65 mmHg, or lactate above 4 mmol/L.
 */
@Component
public class ShockCriteria {

    private final EvidenceSource evidenceSource;

    @Autowired
    public ShockCriteria(EvidenceSource evidenceSource) {
        this.evidenceSource = evidenceSource;
    }

    public boolean isMet(String patientId, Instant since, Integer ageDays) {
        double systolicLimit = systolicHypotensionLimit(ageDays);
        for (VitalSign vital : evidenceSource.getVitalSigns(patientId, since)) {
            if (vital.getValue() == null) {
                continue;
            }
            if (isSystolic(vital) && vital.getValue() < systolicLimit) {
                return true;
            }
            if (isMeanPressure(vital) && vital.getValue() < ClinicalCodes.MAP_HYPOTENSION_MMHG) {
                return true;
            }
        }
        List<LabResult> lactates = evidenceSource.getLabResults(patientId, List.of(ClinicalCodes.LOINC_LACTATE), since);
        return lactates.stream()
                .anyMatch(lab -> lab.getNumericValue() != null && lab.getNumericValue() > ClinicalCodes.LACTATE_SHOCK_MMOL_L);
    }

    /**
     * Systolic pressure below which a child of the given age is hypotensive (PALS).
     * Unknown ages use the adult limit.
     */
    static double systolicHypotensionLimit(Integer ageDays) {
        if (ageDays == null) {
            return 90;
        }
        if (ageDays < 28) {
            return 60;
        }
        if (ageDays < 365) {
            return 70;
        }
        int years = ageDays / 365;
        if (years <= 10) {
            return 70 + 2.0 * years;
        }
        return 90;
    }

    private static boolean isSystolic(VitalSign vital) {
        return ClinicalCodes.LOINC_SYSTOLIC_BP.equals(vital.getCode())
                || (vital.getDisplay() != null && vital.getDisplay().toLowerCase(Locale.ROOT).contains("systolic"));
    }

    private static boolean isMeanPressure(VitalSign vital) {
        return ClinicalCodes.LOINC_MEAN_BP.equals(vital.getCode())
                || (vital.getDisplay() != null && vital.getDisplay().toLowerCase(Locale.ROOT).contains("mean"));
    }
}
