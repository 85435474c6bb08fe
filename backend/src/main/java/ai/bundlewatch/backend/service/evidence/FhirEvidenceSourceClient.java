package ai.bundlewatch.backend.service.evidence;

import ai.bundlewatch.backend.model.evidence.ClinicalNote;
import ai.bundlewatch.backend.model.evidence.LabResult;
import ai.bundlewatch.backend.model.evidence.MedicationAdministration;
import ai.bundlewatch.backend.model.evidence.PatientDemographics;
import ai.bundlewatch.backend.model.evidence.VitalSign;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Evidence source backed by a FHIR R4 server.
 *
 * Queries are scoped by the FHIR date search parameters. Any failure to reach the
 * server is logged and reported as "no evidence", which leaves elements PENDING
 * until their window expires.
 */
@Service
public class FhirEvidenceSourceClient implements EvidenceSource {

    private static final Logger logger = LoggerFactory.getLogger(FhirEvidenceSourceClient.class);

    private static final DateTimeFormatter FHIR_SEARCH_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);
    private static final String LOINC_SYSTEM = "http://loinc.org|";

    private final FhirRestClient fhirClient;

    @Autowired
    public FhirEvidenceSourceClient(FhirRestClient fhirClient) {
        this.fhirClient = fhirClient;
    }

    @Override
    public List<LabResult> getLabResults(String patientId, Collection<String> resultCodes, Instant since) {
        if (resultCodes == null || resultCodes.isEmpty()) {
            return List.of();
        }
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("patient", patientId);
        params.add("code", resultCodes.stream().map(code -> LOINC_SYSTEM + code).collect(Collectors.joining(",")));
        params.add("date", "ge" + FHIR_SEARCH_FORMAT.format(since));
        params.add("_count", "100");
        params.add("_sort", "-date");
        try {
            return fhirClient.search("Observation", params).stream()
                    .map(FhirResourceParser::toLabResult)
                    .toList();
        } catch (RestClientException e) {
            logger.warn("Failed to get lab results {} for patient {}: {}", resultCodes, patientId, e.getMessage());
            return List.of();
        }
    }

    @Override
    public List<MedicationAdministration> getMedicationAdministrations(String patientId, Instant since) {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("patient", patientId);
        params.add("effective-time", "ge" + FHIR_SEARCH_FORMAT.format(since));
        params.add("_count", "200");
        params.add("_sort", "-effective-time");
        try {
            return fhirClient.search("MedicationAdministration", params).stream()
                    .map(FhirResourceParser::toMedicationAdministration)
                    .toList();
        } catch (RestClientException e) {
            logger.warn("Failed to get medication administrations for patient {}: {}", patientId, e.getMessage());
            return List.of();
        }
    }

    @Override
    public List<VitalSign> getVitalSigns(String patientId, Instant since) {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("patient", patientId);
        params.add("category", "vital-signs");
        params.add("date", "ge" + FHIR_SEARCH_FORMAT.format(since));
        params.add("_count", "200");
        params.add("_sort", "-date");
        try {
            return fhirClient.search("Observation", params).stream()
                    .map(FhirResourceParser::toVitalSign)
                    .toList();
        } catch (RestClientException e) {
            logger.warn("Failed to get vital signs for patient {}: {}", patientId, e.getMessage());
            return List.of();
        }
    }

    @Override
    public List<ClinicalNote> getRecentNotes(String patientId, Instant since, Collection<String> noteTypes) {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("patient", patientId);
        // DocumentReference dates are searched by day; the exact bound is applied below
        params.add("date", "ge" + since.atOffset(ZoneOffset.UTC).toLocalDate());
        params.add("_count", "50");
        params.add("_sort", "-date");
        if (noteTypes != null && !noteTypes.isEmpty()) {
            params.add("type", String.join(",", noteTypes));
        }
        try {
            return fhirClient.search("DocumentReference", params).stream()
                    .map(FhirResourceParser::toClinicalNote)
                    .flatMap(Optional::stream)
                    .filter(note -> note.getDate() == null || !note.getDate().isBefore(since))
                    .toList();
        } catch (RestClientException e) {
            logger.warn("Failed to get notes for patient {}: {}", patientId, e.getMessage());
            return List.of();
        }
    }

    @Override
    public Optional<PatientDemographics> getPatient(String patientId) {
        try {
            return fhirClient.read("Patient", patientId).map(FhirResourceParser::toPatient);
        } catch (RestClientException e) {
            logger.warn("Failed to get patient {}: {}", patientId, e.getMessage());
            return Optional.empty();
        }
    }
}
