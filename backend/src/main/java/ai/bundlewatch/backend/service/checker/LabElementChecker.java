package ai.bundlewatch.backend.service.checker;

import ai.bundlewatch.backend.model.bundle.BundleElement;
import ai.bundlewatch.backend.model.bundle.DataSource;
import ai.bundlewatch.backend.model.entity.ElementCheckResult;
import ai.bundlewatch.backend.model.evidence.LabResult;
import ai.bundlewatch.backend.service.evidence.EvidenceSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Checks lab-based elements: the earliest result with one of the element's codes dated
 * at or before the deadline satisfies the element.
 *
 * Dependent elements (repeat measurements) need a second result strictly later than the
 * one that satisfied the prerequisite.
 */
@Component
public class LabElementChecker extends AbstractElementChecker {

    private static final Logger logger = LoggerFactory.getLogger(LabElementChecker.class);

    @Autowired
    public LabElementChecker(EvidenceSource evidenceSource) {
        super(evidenceSource);
    }

    @Override
    public DataSource dataSource() {
        return DataSource.LAB;
    }

    @Override
    public ElementCheckOutcome check(ElementEvaluationRequest request) {
        BundleElement element = request.getElement();
        if (element.hasDependency()) {
            return checkRepeat(request);
        }
        return checkEarliestLab(request, element.getResultCodes(), AbstractElementChecker::resultNote);
    }

    private ElementCheckOutcome checkRepeat(ElementEvaluationRequest request) {
        BundleElement element = request.getElement();
        ElementCheckResult prerequisite = request.getPrerequisite();
        Double initialValue = prerequisite != null ? prerequisite.numericValue() : null;

        List<LabResult> labs = sortedByTime(
                evidenceSource.getLabResults(request.getPatientId(), element.getResultCodes(), request.getTriggerTime()),
                LabResult::getEffectiveTime);

        Instant initialTime = prerequisite != null && prerequisite.getCompletedAt() != null
                ? prerequisite.getCompletedAt()
                : labs.stream().findFirst().map(LabResult::getEffectiveTime).orElse(null);

        if (initialTime == null) {
            return noEvidence(request,
                    "Initial value " + initialValue + " elevated - awaiting repeat",
                    "Initial value " + initialValue + " elevated but no repeat within window");
        }

        Optional<LabResult> repeat = labs.stream()
                .filter(lab -> lab.getEffectiveTime().isAfter(initialTime))
                .findFirst();

        if (repeat.isPresent() && TimeWindows.onOrBefore(repeat.get().getEffectiveTime(), request.deadline())) {
            LabResult lab = repeat.get();
            logger.debug("Repeat result for {} at {}", element.getElementId(), lab.getEffectiveTime());
            return ElementCheckOutcome.met(lab.getEffectiveTime(), lab.displayValue(), "Repeat result: " + lab.displayValue());
        }

        return noEvidence(request,
                "Initial value " + initialValue + " elevated - awaiting repeat within window",
                "Initial value " + initialValue + " elevated but repeat not within window");
    }
}
