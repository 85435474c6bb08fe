package ai.bundlewatch.backend.service.checker;

import ai.bundlewatch.backend.config.ClinicalCodes;
import ai.bundlewatch.backend.model.bundle.BundleElement;
import ai.bundlewatch.backend.model.bundle.GuidelineBundle;
import ai.bundlewatch.backend.model.context.PatientContext;
import ai.bundlewatch.backend.model.entity.ElementStatus;
import ai.bundlewatch.backend.model.evidence.ClinicalNote;
import ai.bundlewatch.backend.model.evidence.LabResult;
import ai.bundlewatch.backend.model.evidence.MedicationAdministration;
import ai.bundlewatch.backend.service.catalog.StaticBundleCatalog;
import ai.bundlewatch.backend.service.evidence.EvidenceSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgeStratifiedElementCheckerTest {

    private static final Instant T = Instant.parse("2024-03-01T10:00:00Z");
    private static final String PATIENT = "infant-1";

    private final GuidelineBundle bundle = new StaticBundleCatalog(Set.of()).findBundle(StaticBundleCatalog.FEBRILE_INFANT)
            .orElseThrow();

    @Mock
    private EvidenceSource evidenceSource;

    private AgeStratifiedElementChecker checker;

    @BeforeEach
    void setUp() {
        checker = new AgeStratifiedElementChecker(evidenceSource);
    }

    @Test
    void lumbarPuncture_CsfResultWithinFourHours_ShouldBeMetAtResultTime() {
        // 15 day old, CSF result at T+3h, 4h window
        BundleElement lp = element("fi_lp_8_21d").toBuilder().timeWindowHours(4.0).build();
        when(evidenceSource.getLabResults(eq(PATIENT), any(), eq(T)))
                .thenReturn(List.of(csf(T.plus(Duration.ofHours(3)))));

        ElementCheckOutcome outcome = checker.check(request(lp, T.plus(Duration.ofHours(3).plusMinutes(15)), 15));

        assertEquals(ElementStatus.MET, outcome.getStatus());
        assertEquals(T.plus(Duration.ofHours(3)), outcome.getCompletedAt());
    }

    @Test
    void lumbarPuncture_AbnormalMarkersBranch_CsfAtFiveHoursWithinSix_ShouldBeMet() {
        BundleElement lp = element("fi_lp_22_28d_im_abnormal").toBuilder().timeWindowHours(6.0).build();
        when(evidenceSource.getLabResults(eq(PATIENT), any(), eq(T)))
                .thenReturn(List.of(csf(T.plus(Duration.ofHours(5)))));

        ElementCheckOutcome outcome = checker.check(request(lp, T.plus(Duration.ofHours(5).plusMinutes(30)), 25));

        assertEquals(ElementStatus.MET, outcome.getStatus());
        assertEquals(T.plus(Duration.ofHours(5)), outcome.getCompletedAt());
    }

    @Test
    void lumbarPuncture_NoCsfAfterWindow_ShouldBeNotMet() {
        when(evidenceSource.getLabResults(eq(PATIENT), any(), eq(T))).thenReturn(List.of());

        ElementCheckOutcome outcome = checker.check(request(element("fi_lp_8_21d"), T.plus(Duration.ofHours(3)), 15));

        assertEquals(ElementStatus.NOT_MET, outcome.getStatus());
        assertEquals("LP required but not performed within time window", outcome.getNotes());
    }

    @Test
    void parenteralAntibiotics_OralDoseDoesNotCount() {
        when(evidenceSource.getMedicationAdministrations(PATIENT, T)).thenReturn(List.of(
                admin("Amoxicillin", "PO", T.plus(Duration.ofMinutes(20))),
                admin("Ampicillin", "IV", T.plus(Duration.ofMinutes(40)))));

        ElementCheckOutcome outcome = checker.check(request(element("fi_abx_8_21d"), T.plus(Duration.ofMinutes(50)), 15));

        assertEquals(ElementStatus.MET, outcome.getStatus());
        assertEquals("Ampicillin", outcome.getValue());
        assertEquals(T.plus(Duration.ofMinutes(40)), outcome.getCompletedAt());
    }

    @Test
    void hsvAssessment_DocumentedInNote_ShouldBeMet() {
        when(evidenceSource.getMedicationAdministrations(PATIENT, T)).thenReturn(List.of());
        when(evidenceSource.getRecentNotes(PATIENT, T, List.of())).thenReturn(List.of(
                note("No maternal HSV history, no vesicles on exam", T.plus(Duration.ofHours(2)))));

        ElementCheckOutcome outcome = checker.check(request(element("fi_hsv_risk_assessment"), T.plus(Duration.ofHours(3)), 10));

        assertEquals(ElementStatus.MET, outcome.getStatus());
        assertEquals(T.plus(Duration.ofHours(2)), outcome.getCompletedAt());
    }

    @Test
    void admission_ShouldStayPendingWithDiagnosticNote() {
        ElementCheckOutcome outcome = checker.check(request(element("fi_admit_8_21d"), T.plus(Duration.ofDays(3)), 15));

        assertEquals(ElementStatus.PENDING, outcome.getStatus());
        assertEquals("Admission status check requires encounter data", outcome.getNotes());
    }

    @Test
    void dischargeChecklist_NeedsTwoDocumentingNotes() {
        when(evidenceSource.getRecentNotes(PATIENT, T, List.of())).thenReturn(List.of(
                note("Follow-up with PCP tomorrow", T.plus(Duration.ofHours(10))),
                note("Return precautions reviewed with parents", T.plus(Duration.ofHours(12)))));

        ElementCheckOutcome outcome = checker.check(request(element("fi_safe_discharge_checklist"), T.plus(Duration.ofHours(13)), 45));

        assertEquals(ElementStatus.MET, outcome.getStatus());
        assertEquals(T.plus(Duration.ofHours(12)), outcome.getCompletedAt());
        assertEquals("2", outcome.getValue());
    }

    private BundleElement element(String id) {
        return bundle.findElement(id).orElseThrow();
    }

    private static ElementEvaluationRequest request(BundleElement element, Instant now, int ageDays) {
        return ElementEvaluationRequest.builder()
                .element(element)
                .patientId(PATIENT)
                .triggerTime(T)
                .now(now)
                .context(PatientContext.builder().ageDays(ageDays).build())
                .build();
    }

    private static LabResult csf(Instant at) {
        return LabResult.builder()
                .code(ClinicalCodes.LOINC_CSF_WBC)
                .numericValue(3.0)
                .unit("/uL")
                .effectiveTime(at)
                .build();
    }

    private static MedicationAdministration admin(String name, String route, Instant at) {
        return MedicationAdministration.builder()
                .medicationName(name)
                .dose("50 mg/kg")
                .route(route)
                .status("completed")
                .adminTime(at)
                .build();
    }

    private static ClinicalNote note(String text, Instant date) {
        return ClinicalNote.builder()
                .typeDisplay("Progress Note")
                .date(date)
                .text(text)
                .build();
    }
}
