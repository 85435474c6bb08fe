package ai.bundlewatch.backend.service.evidence;

import ai.bundlewatch.backend.model.evidence.ClinicalNote;
import ai.bundlewatch.backend.model.evidence.LabResult;
import ai.bundlewatch.backend.model.evidence.MedicationAdministration;
import ai.bundlewatch.backend.model.evidence.PatientDemographics;
import ai.bundlewatch.backend.model.evidence.VitalSign;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read-only, time-scoped access to the clinical evidence for a patient.
 *
 * Implementations never throw for an unavailable upstream: a failed query is
 * reported as an empty result so that the caller treats it as "no evidence yet".
 */
public interface EvidenceSource {

    /**
     * Returns lab results with any of the given codes, effective at or after {@code since}.
     *
     * @param patientId   the patient id
     * @param resultCodes LOINC codes to match
     * @param since       lower time bound (inclusive)
     * @return matching results, in no particular order
     */
    List<LabResult> getLabResults(String patientId, Collection<String> resultCodes, Instant since);

    List<MedicationAdministration> getMedicationAdministrations(String patientId, Instant since);

    List<VitalSign> getVitalSigns(String patientId, Instant since);

    /**
     * Returns notes dated at or after {@code since}.
     *
     * @param noteTypes note type codes to filter on; empty means every type
     */
    List<ClinicalNote> getRecentNotes(String patientId, Instant since, Collection<String> noteTypes);

    Optional<PatientDemographics> getPatient(String patientId);
}
