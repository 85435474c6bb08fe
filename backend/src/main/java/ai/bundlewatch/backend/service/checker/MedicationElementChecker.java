package ai.bundlewatch.backend.service.checker;

import ai.bundlewatch.backend.model.bundle.DataSource;
import ai.bundlewatch.backend.model.bundle.MedicationCategory;
import ai.bundlewatch.backend.model.evidence.MedicationAdministration;
import ai.bundlewatch.backend.service.evidence.EvidenceSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Predicate;

/**
 * Checks medication-administration elements by category.
 * The crystalloid bolus element only applies when shock criteria are met.
 */
@Component
public class MedicationElementChecker extends AbstractElementChecker {

    private static final Logger logger = LoggerFactory.getLogger(MedicationElementChecker.class);

    private final ShockCriteria shockCriteria;

    @Autowired
    public MedicationElementChecker(EvidenceSource evidenceSource, ShockCriteria shockCriteria) {
        super(evidenceSource);
        this.shockCriteria = shockCriteria;
    }

    @Override
    public DataSource dataSource() {
        return DataSource.MEDICATION;
    }

    @Override
    public ElementCheckOutcome check(ElementEvaluationRequest request) {
        MedicationCategory category = request.getElement().getMedicationCategory();
        if (category == null) {
            logger.warn("Medication element {} has no category", request.getElement().getElementId());
            return ElementCheckOutcome.pending("Unknown medication element type");
        }
        switch (category) {
            case BROAD_SPECTRUM_ANTIBIOTIC:
                return checkAdministration(request,
                        admin -> MedicationClassifier.isBroadSpectrumAntibiotic(admin.getMedicationName()),
                        "antibiotics");
            case CRYSTALLOID_BOLUS:
                return checkBolus(request);
            case PARENTERAL_ANTIBIOTIC:
                return checkAdministration(request, MedicationElementChecker::isParenteralAntibiotic, "IV antibiotics");
            case FIRST_LINE_PNEUMONIA_ANTIBIOTIC:
                return checkAdministration(request,
                        admin -> MedicationClassifier.isFirstLinePneumoniaAntibiotic(admin.getMedicationName()),
                        "first-line antibiotic");
            case UTI_EMPIRIC_ANTIBIOTIC:
                return checkAdministration(request,
                        admin -> MedicationClassifier.isUtiEmpiricAntibiotic(admin.getMedicationName()),
                        "empiric UTI antibiotic");
            case ANTIPSEUDOMONAL_BETA_LACTAM:
                return checkAdministration(request,
                        admin -> MedicationClassifier.isAntipseudomonalBetaLactam(admin.getMedicationName()),
                        "antipseudomonal beta-lactam");
            default:
                return ElementCheckOutcome.pending("Unknown medication element type");
        }
    }

    static boolean isParenteralAntibiotic(MedicationAdministration admin) {
        return MedicationClassifier.isParenteralRoute(admin.getRoute())
                && MedicationClassifier.isAntibiotic(admin.getMedicationName());
    }

    private ElementCheckOutcome checkBolus(ElementEvaluationRequest request) {
        Integer ageDays = request.getContext() != null ? request.getContext().getAgeDays() : null;
        if (!shockCriteria.isMet(request.getPatientId(), request.getTriggerTime(), ageDays)) {
            return ElementCheckOutcome.notApplicable("Shock criteria not met - fluid bolus not required");
        }
        return checkAdministration(request,
                admin -> MedicationClassifier.isCrystalloid(admin.getMedicationName())
                        && MedicationClassifier.isBolusDose(admin.getDose()),
                "fluid bolus");
    }

    private ElementCheckOutcome checkAdministration(ElementEvaluationRequest request,
                                                    Predicate<MedicationAdministration> qualifies,
                                                    String label) {
        List<MedicationAdministration> matching = evidenceSource
                .getMedicationAdministrations(request.getPatientId(), request.getTriggerTime())
                .stream()
                .filter(qualifies)
                .toList();

        if (matching.isEmpty()) {
            return noEvidence(request,
                    "Awaiting " + label + " administration",
                    "Time window expired - " + label + " not given");
        }

        return earliestOnTime(matching, MedicationAdministration::getAdminTime, request.deadline())
                .map(admin -> ElementCheckOutcome.met(admin.getAdminTime(), admin.getMedicationName(),
                        admin.getMedicationName() + " administered"))
                .orElseGet(() -> noEvidence(request,
                        label + " found but not within required window",
                        "Time window expired - " + label + " not given within required timeframe"));
    }
}
