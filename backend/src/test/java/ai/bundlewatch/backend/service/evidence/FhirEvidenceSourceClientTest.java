package ai.bundlewatch.backend.service.evidence;

import ai.bundlewatch.backend.config.ClinicalCodes;
import ai.bundlewatch.backend.model.evidence.ClinicalNote;
import ai.bundlewatch.backend.model.evidence.LabResult;
import ai.bundlewatch.backend.model.evidence.MedicationAdministration;
import ai.bundlewatch.backend.model.evidence.PatientDemographics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class FhirEvidenceSourceClientTest {

    private static final String BASE_URL = "http://fhir.test/fhir";
    private static final Instant SINCE = Instant.parse("2024-03-01T10:00:00Z");

    private MockRestServiceServer server;
    private FhirEvidenceSourceClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new FhirEvidenceSourceClient(new FhirRestClient(restTemplate, BASE_URL + "/"));
    }

    @Test
    void getLabResults_ShouldParseObservationBundle() {
        // Arrange
        server.expect(requestTo(startsWith(BASE_URL + "/Observation?")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("patient", "patient-1"))
                .andExpect(queryParam("date", "ge2024-03-01T10:00:00Z"))
                .andRespond(withSuccess("""
                        {"resourceType": "Bundle", "type": "searchset", "entry": [
                          {"resource": {"resourceType": "Observation",
                            "code": {"coding": [{"system": "http://loinc.org", "code": "2524-7"}]},
                            "valueQuantity": {"value": 4.2, "unit": "mmol/L"},
                            "effectiveDateTime": "2024-03-01T10:45:00Z"}}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        // Act
        List<LabResult> labs = client.getLabResults("patient-1", List.of(ClinicalCodes.LOINC_LACTATE), SINCE);

        // Assert
        server.verify();
        assertEquals(1, labs.size());
        LabResult lab = labs.get(0);
        assertEquals("2524-7", lab.getCode());
        assertEquals(4.2, lab.getNumericValue());
        assertEquals("mmol/L", lab.getUnit());
        assertEquals(Instant.parse("2024-03-01T10:45:00Z"), lab.getEffectiveTime());
    }

    @Test
    void getLabResults_ServerError_ShouldReturnEmpty() {
        server.expect(requestTo(startsWith(BASE_URL + "/Observation?"))).andRespond(withServerError());

        List<LabResult> labs = client.getLabResults("patient-1", List.of(ClinicalCodes.LOINC_LACTATE), SINCE);

        assertTrue(labs.isEmpty());
    }

    @Test
    void getLabResults_NoCodes_ShouldNotQuery() {
        assertTrue(client.getLabResults("patient-1", List.of(), SINCE).isEmpty());
        server.verify();
    }

    @Test
    void getMedicationAdministrations_ShouldReadRouteDoseAndPeriodStart() {
        server.expect(requestTo(startsWith(BASE_URL + "/MedicationAdministration?")))
                .andRespond(withSuccess("""
                        {"resourceType": "Bundle", "entry": [
                          {"resource": {"resourceType": "MedicationAdministration", "status": "completed",
                            "medicationCodeableConcept": {"text": "Ceftriaxone"},
                            "effectivePeriod": {"start": "2024-03-01T10:30:00Z"},
                            "dosage": {"route": {"coding": [{"display": "IV"}]},
                                       "dose": {"value": 50, "unit": "mg/kg"}}}}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        List<MedicationAdministration> admins = client.getMedicationAdministrations("patient-1", SINCE);

        assertEquals(1, admins.size());
        MedicationAdministration admin = admins.get(0);
        assertEquals("Ceftriaxone", admin.getMedicationName());
        assertEquals("IV", admin.getRoute());
        assertEquals("50 mg/kg", admin.getDose());
        assertEquals(Instant.parse("2024-03-01T10:30:00Z"), admin.getAdminTime());
    }

    @Test
    void getRecentNotes_ShouldDecodeTextAndDropNotesBeforeSince() {
        String early = encode("Admission H&P");
        String late = encode("ID consult: de-escalation planned");
        server.expect(requestTo(startsWith(BASE_URL + "/DocumentReference?")))
                .andExpect(queryParam("date", "ge2024-03-01"))
                .andRespond(withSuccess("""
                        {"resourceType": "Bundle", "entry": [
                          {"resource": {"resourceType": "DocumentReference", "date": "2024-03-01T08:00:00Z",
                            "type": {"coding": [{"code": "34117-2", "display": "History and physical note"}]},
                            "content": [{"attachment": {"data": "%s"}}]}},
                          {"resource": {"resourceType": "DocumentReference", "date": "2024-03-03T12:00:00Z",
                            "type": {"coding": [{"code": "11488-4", "display": "Consult Note"}]},
                            "author": [{"reference": "Practitioner/dr-id"}],
                            "content": [{"attachment": {"data": "%s"}}]}},
                          {"resource": {"resourceType": "DocumentReference", "date": "2024-03-03T13:00:00Z",
                            "content": [{"attachment": {"url": "Binary/1"}}]}}
                        ]}
                        """.formatted(early, late), MediaType.APPLICATION_JSON));

        List<ClinicalNote> notes = client.getRecentNotes("patient-1", SINCE, List.of());

        assertEquals(1, notes.size());
        ClinicalNote note = notes.get(0);
        assertEquals("Consult Note", note.getTypeDisplay());
        assertEquals("dr-id", note.getAuthor());
        assertEquals("ID consult: de-escalation planned", note.getText());
    }

    @Test
    void getPatient_ShouldParseBirthDateAndMrn() {
        server.expect(requestTo(BASE_URL + "/Patient/infant-1"))
                .andRespond(withSuccess("""
                        {"resourceType": "Patient", "id": "infant-1", "gender": "female", "birthDate": "2024-02-06",
                         "name": [{"given": ["Ada"], "family": "Lovelace"}],
                         "identifier": [{"type": {"coding": [{"code": "MR"}]}, "value": "MRN-42"}]}
                        """, MediaType.APPLICATION_JSON));

        Optional<PatientDemographics> patient = client.getPatient("infant-1");

        assertTrue(patient.isPresent());
        assertEquals(LocalDate.of(2024, 2, 6), patient.get().getBirthDate());
        assertEquals("Ada Lovelace", patient.get().getName());
        assertEquals("MRN-42", patient.get().getMrn());
    }

    @Test
    void getPatient_NotFound_ShouldReturnEmpty() {
        server.expect(requestTo(BASE_URL + "/Patient/missing"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertTrue(client.getPatient("missing").isEmpty());
    }

    private static String encode(String text) {
        return Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
    }
}
