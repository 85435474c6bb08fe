package ai.bundlewatch.backend.service.evidence;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Searches active FHIR Condition resources by ICD-10 code prefix.
 */
@Component
public class FhirConditionSearch {

    private static final String ICD10_SYSTEM = "http://hl7.org/fhir/sid/icd-10-cm|";

    private final FhirRestClient fhirClient;

    @Autowired
    public FhirConditionSearch(FhirRestClient fhirClient) {
        this.fhirClient = fhirClient;
    }

    /**
     * Returns one match per condition that names a patient.
     *
     * @param icd10Prefixes ICD-10 codes or prefixes
     * @return matches, in server order
     * @throws org.springframework.web.client.RestClientException when the server cannot be reached
     */
    public List<ConditionMatch> findActiveConditions(Collection<String> icd10Prefixes) {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("code", icd10Prefixes.stream().map(prefix -> ICD10_SYSTEM + prefix).collect(Collectors.joining(",")));
        params.add("clinical-status", "active");
        params.add("_count", "200");

        List<ConditionMatch> matches = new ArrayList<>();
        for (JsonNode condition : fhirClient.search("Condition", params)) {
            String patientId = FhirResourceParser.stripReference(condition.path("subject"), "Patient/");
            if (patientId.isEmpty()) {
                continue;
            }
            String onset = condition.hasNonNull("onsetDateTime")
                    ? condition.get("onsetDateTime").asText()
                    : condition.path("recordedDate").asText(null);
            matches.add(new ConditionMatch(
                    patientId,
                    FhirResourceParser.stripReference(condition.path("encounter"), "Encounter/"),
                    FhirResourceParser.codingCode(condition.path("code"), "icd"),
                    FhirResourceParser.parseDateTime(onset)));
        }
        return matches;
    }

    @Value
    public static class ConditionMatch {
        String patientId;
        String encounterId;
        String conditionCode;
        Instant onsetTime;
    }
}
