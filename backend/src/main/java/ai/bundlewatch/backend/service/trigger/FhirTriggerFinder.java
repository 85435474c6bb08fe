package ai.bundlewatch.backend.service.trigger;

import ai.bundlewatch.backend.model.bundle.GuidelineBundle;
import ai.bundlewatch.backend.model.evidence.PatientDemographics;
import ai.bundlewatch.backend.model.evidence.TriggerCandidate;
import ai.bundlewatch.backend.service.evidence.EvidenceSource;
import ai.bundlewatch.backend.service.evidence.FhirConditionSearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds trigger candidates from active FHIR conditions matching a bundle's ICD-10 prefixes.
 * Candidates outside the bundle's trigger age limits are dropped.
 */
@Service
public class FhirTriggerFinder implements TriggerFinder {

    private static final Logger logger = LoggerFactory.getLogger(FhirTriggerFinder.class);

    private final FhirConditionSearch conditionSearch;
    private final EvidenceSource evidenceSource;
    private final Clock clock;

    @Autowired
    public FhirTriggerFinder(FhirConditionSearch conditionSearch, EvidenceSource evidenceSource, Clock clock) {
        this.conditionSearch = conditionSearch;
        this.evidenceSource = evidenceSource;
        this.clock = clock;
    }

    @Override
    public List<TriggerCandidate> findCandidates(GuidelineBundle bundle) {
        if (bundle.getTriggerConditionPrefixes().isEmpty()) {
            return List.of();
        }

        List<FhirConditionSearch.ConditionMatch> matches;
        try {
            matches = conditionSearch.findActiveConditions(bundle.getTriggerConditionPrefixes());
        } catch (RestClientException e) {
            logger.warn("Failed to search conditions for bundle {}: {}", bundle.getBundleId(), e.getMessage());
            return List.of();
        }

        List<TriggerCandidate> candidates = new ArrayList<>();
        for (FhirConditionSearch.ConditionMatch match : matches) {
            Instant onset = match.getOnsetTime() != null ? match.getOnsetTime() : clock.instant();
            Integer ageDays = ageAt(match.getPatientId(), onset);
            if (!bundle.acceptsTriggerAge(ageDays)) {
                logger.debug("Skipping patient {} aged {} days for bundle {}", match.getPatientId(), ageDays, bundle.getBundleId());
                continue;
            }
            candidates.add(TriggerCandidate.builder()
                    .patientId(match.getPatientId())
                    .encounterId(match.getEncounterId())
                    .conditionCode(match.getConditionCode())
                    .onsetTime(onset)
                    .ageDays(ageDays)
                    .build());
        }
        logger.info("Found {} trigger candidate(s) for bundle {}", candidates.size(), bundle.getBundleId());
        return candidates;
    }

    private Integer ageAt(String patientId, Instant onset) {
        Optional<LocalDate> birthDate = evidenceSource.getPatient(patientId)
                .map(PatientDemographics::getBirthDate);
        return birthDate
                .map(birth -> (int) ChronoUnit.DAYS.between(birth, onset.atZone(clock.getZone()).toLocalDate()))
                .orElse(null);
    }
}
