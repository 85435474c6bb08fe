package ai.bundlewatch.backend.service.context;

import ai.bundlewatch.backend.config.ClinicalCodes;
import ai.bundlewatch.backend.model.bundle.AgeGroup;
import ai.bundlewatch.backend.model.bundle.DataSource;
import ai.bundlewatch.backend.model.bundle.GuidelineBundle;
import ai.bundlewatch.backend.model.context.PatientContext;
import ai.bundlewatch.backend.model.entity.Episode;
import ai.bundlewatch.backend.model.evidence.LabResult;
import ai.bundlewatch.backend.model.evidence.PatientDemographics;
import ai.bundlewatch.backend.service.checker.NoteKeywords;
import ai.bundlewatch.backend.service.evidence.EvidenceSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Computes the facts used for conditional branching. Rebuilt at the start of every cycle
 * because the underlying evidence accrues over time.
 *
 * A missing result never counts as abnormal.
 */
@Component
public class PatientContextBuilder {

    private static final Logger logger = LoggerFactory.getLogger(PatientContextBuilder.class);

    private static final Set<String> LE_POSITIVE = Set.of("positive", "pos", "+", "++", "+++");
    private static final List<String> DISCHARGE_HOME_PHRASES =
            List.of("discharged home", "discharge to home", "disposition: home");

    private final EvidenceSource evidenceSource;
    private final Clock clock;

    @Autowired
    public PatientContextBuilder(EvidenceSource evidenceSource, Clock clock) {
        this.evidenceSource = evidenceSource;
        this.clock = clock;
    }

    /**
     * Builds the context for one episode.
     *
     * Lab-derived flags are only queried for bundles with conditional or age-stratified
     * elements; age is always resolved.
     */
    public PatientContext build(Episode episode, GuidelineBundle bundle) {
        String patientId = episode.getPatientId();
        Instant since = episode.getTriggerTime();
        Integer ageDays = episode.getAgeDays() != null ? episode.getAgeDays() : ageFromBirthDate(patientId, since);

        PatientContext.PatientContextBuilder context = PatientContext.builder()
                .ageDays(ageDays)
                .ageGroup(AgeGroup.fromAgeDays(ageDays));

        if (needsClinicalFlags(bundle)) {
            context.inflammatoryMarkersAbnormal(inflammatoryMarkersAbnormal(patientId, since))
                    .uaAbnormal(uaAbnormal(patientId, since))
                    .lpPerformed(lpPerformed(patientId, since))
                    .dispositionHome(dispositionHome(patientId, since));
        }

        PatientContext built = context.build();
        logger.debug("Patient context for episode {}: {}", episode.getId(), built);
        return built;
    }

    private Integer ageFromBirthDate(String patientId, Instant triggerTime) {
        return evidenceSource.getPatient(patientId)
                .map(PatientDemographics::getBirthDate)
                .map(birth -> ageInDays(birth, triggerTime))
                .orElse(null);
    }

    private int ageInDays(LocalDate birthDate, Instant at) {
        return (int) ChronoUnit.DAYS.between(birthDate, at.atZone(clock.getZone()).toLocalDate());
    }

    private static boolean needsClinicalFlags(GuidelineBundle bundle) {
        return bundle.getElements().stream()
                .anyMatch(e -> e.getCondition() != null || e.getDataSource() == DataSource.AGE_STRATIFIED);
    }

    /**
     * PCT > 0.5 ng/mL, ANC > 4000/uL or CRP > 2.0 mg/dL; any single abnormal value trips the flag.
     */
    boolean inflammatoryMarkersAbnormal(String patientId, Instant since) {
        return anyAbove(patientId, ClinicalCodes.LOINC_PROCALCITONIN, ClinicalCodes.PCT_ABNORMAL_NG_ML, since)
                || anyAbove(patientId, ClinicalCodes.LOINC_ANC, ClinicalCodes.ANC_ABNORMAL_PER_UL, since)
                || anyAbove(patientId, ClinicalCodes.LOINC_CRP, ClinicalCodes.CRP_ABNORMAL_MG_DL, since);
    }

    /**
     * Urine WBC of at least 5/HPF or positive leukocyte esterase.
     */
    boolean uaAbnormal(String patientId, Instant since) {
        boolean wbcAbnormal = evidenceSource.getLabResults(patientId, List.of(ClinicalCodes.LOINC_UA_WBC), since).stream()
                .map(LabResult::getNumericValue)
                .anyMatch(value -> value != null && value >= ClinicalCodes.UA_WBC_ABNORMAL_PER_HPF);
        if (wbcAbnormal) {
            return true;
        }
        return evidenceSource.getLabResults(patientId, List.of(ClinicalCodes.LOINC_UA_LE), since).stream()
                .map(LabResult::getTextValue)
                .anyMatch(value -> value != null && LE_POSITIVE.contains(value.trim().toLowerCase(Locale.ROOT)));
    }

    boolean lpPerformed(String patientId, Instant since) {
        return !evidenceSource.getLabResults(patientId, List.of(ClinicalCodes.LOINC_CSF_WBC), since).isEmpty();
    }

    boolean dispositionHome(String patientId, Instant since) {
        return evidenceSource.getRecentNotes(patientId, since, List.of()).stream()
                .anyMatch(note -> NoteKeywords.mentionsAny(note.getText(), DISCHARGE_HOME_PHRASES));
    }

    private boolean anyAbove(String patientId, String code, double threshold, Instant since) {
        return evidenceSource.getLabResults(patientId, List.of(code), since).stream()
                .map(LabResult::getNumericValue)
                .anyMatch(value -> value != null && value > threshold);
    }
}
