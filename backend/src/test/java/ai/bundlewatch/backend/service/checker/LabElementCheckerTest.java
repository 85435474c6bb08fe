package ai.bundlewatch.backend.service.checker;

import ai.bundlewatch.backend.config.ClinicalCodes;
import ai.bundlewatch.backend.model.bundle.BundleElement;
import ai.bundlewatch.backend.model.bundle.DataSource;
import ai.bundlewatch.backend.model.bundle.ElementDependency;
import ai.bundlewatch.backend.model.context.PatientContext;
import ai.bundlewatch.backend.model.entity.ElementCheckResult;
import ai.bundlewatch.backend.model.entity.ElementStatus;
import ai.bundlewatch.backend.model.evidence.LabResult;
import ai.bundlewatch.backend.service.evidence.EvidenceSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LabElementCheckerTest {

    private static final Instant T = Instant.parse("2024-03-01T10:00:00Z");
    private static final String PATIENT = "patient-1";

    private static final BundleElement LACTATE = BundleElement.builder()
            .elementId("sepsis_lactate")
            .name("Lactate measured")
            .timeWindowHours(3.0)
            .dataSource(DataSource.LAB)
            .resultCode(ClinicalCodes.LOINC_LACTATE)
            .build();

    private static final BundleElement REPEAT_LACTATE = BundleElement.builder()
            .elementId("sepsis_repeat_lactate")
            .name("Repeat lactate if initially elevated")
            .required(false)
            .timeWindowHours(6.0)
            .dataSource(DataSource.LAB)
            .resultCode(ClinicalCodes.LOINC_LACTATE)
            .dependency(ElementDependency.of("sepsis_lactate", 2.0))
            .build();

    @Mock
    private EvidenceSource evidenceSource;

    private LabElementChecker checker;

    @BeforeEach
    void setUp() {
        checker = new LabElementChecker(evidenceSource);
    }

    @Test
    void check_WhenResultWithinWindow_ShouldBeMetWithEarliestResult() {
        // Arrange
        when(evidenceSource.getLabResults(eq(PATIENT), any(), eq(T))).thenReturn(List.of(
                lactate(3.1, T.plus(Duration.ofHours(2))),
                lactate(3.5, T.plus(Duration.ofHours(1)))));

        // Act
        ElementCheckOutcome outcome = checker.check(request(LACTATE, T.plus(Duration.ofHours(2)), null));

        // Assert
        assertEquals(ElementStatus.MET, outcome.getStatus());
        assertEquals(T.plus(Duration.ofHours(1)), outcome.getCompletedAt());
        assertEquals("3.5", outcome.getValue());
    }

    @Test
    void check_WhenNoResultsAndWindowOpen_ShouldStayPending() {
        when(evidenceSource.getLabResults(eq(PATIENT), any(), eq(T))).thenReturn(List.of());

        ElementCheckOutcome outcome = checker.check(request(LACTATE, T.plus(Duration.ofHours(1)), null));

        assertEquals(ElementStatus.PENDING, outcome.getStatus());
        assertEquals("Awaiting lab results", outcome.getNotes());
    }

    @Test
    void check_WhenOnlyLateResultAndWindowClosed_ShouldBeNotMet() {
        when(evidenceSource.getLabResults(eq(PATIENT), any(), eq(T)))
                .thenReturn(List.of(lactate(1.2, T.plus(Duration.ofHours(4)))));

        ElementCheckOutcome outcome = checker.check(request(LACTATE, T.plus(Duration.ofHours(5)), null));

        assertEquals(ElementStatus.NOT_MET, outcome.getStatus());
        assertNull(outcome.getCompletedAt());
    }

    @Test
    void check_NoResultsAndNowExactlyAtDeadline_ShouldStayPendingUntilAfterIt() {
        when(evidenceSource.getLabResults(eq(PATIENT), any(), eq(T))).thenReturn(List.of());

        ElementCheckOutcome atDeadline = checker.check(request(LACTATE, T.plus(Duration.ofHours(3)), null));
        ElementCheckOutcome justAfter = checker.check(request(LACTATE, T.plus(Duration.ofHours(3)).plusMillis(1), null));

        assertEquals(ElementStatus.PENDING, atDeadline.getStatus());
        assertEquals(ElementStatus.NOT_MET, justAfter.getStatus());
    }

    @Test
    void check_ResultExactlyAtDeadline_ShouldCountAsOnTime() {
        when(evidenceSource.getLabResults(eq(PATIENT), any(), eq(T)))
                .thenReturn(List.of(lactate(1.0, T.plus(Duration.ofHours(3)))));

        ElementCheckOutcome outcome = checker.check(request(LACTATE, T.plus(Duration.ofHours(4)), null));

        assertEquals(ElementStatus.MET, outcome.getStatus());
        assertEquals("1", outcome.getValue());
    }

    @Test
    void checkRepeat_WhenSecondResultPastDeadline_ShouldBeNotMet() {
        // Initial lactate 3.5 at T+1h, repeat only at T+7h, window 6h, evaluated at T+8h
        when(evidenceSource.getLabResults(eq(PATIENT), any(), eq(T))).thenReturn(List.of(
                lactate(3.5, T.plus(Duration.ofHours(1))),
                lactate(2.2, T.plus(Duration.ofHours(7)))));
        ElementCheckResult initial = metResult("3.5", T.plus(Duration.ofHours(1)));

        ElementCheckOutcome outcome = checker.check(request(REPEAT_LACTATE, T.plus(Duration.ofHours(8)), initial));

        assertEquals(ElementStatus.NOT_MET, outcome.getStatus());
        assertTrue(outcome.getNotes().contains("repeat not within window"));
    }

    @Test
    void checkRepeat_WhenSecondResultWithinWindow_ShouldBeMet() {
        when(evidenceSource.getLabResults(eq(PATIENT), any(), eq(T))).thenReturn(List.of(
                lactate(3.5, T.plus(Duration.ofHours(1))),
                lactate(1.8, T.plus(Duration.ofHours(4)))));
        ElementCheckResult initial = metResult("3.5", T.plus(Duration.ofHours(1)));

        ElementCheckOutcome outcome = checker.check(request(REPEAT_LACTATE, T.plus(Duration.ofHours(5)), initial));

        assertEquals(ElementStatus.MET, outcome.getStatus());
        assertEquals(T.plus(Duration.ofHours(4)), outcome.getCompletedAt());
        assertEquals("1.8", outcome.getValue());
    }

    @Test
    void checkRepeat_InitialResultAloneNeverSatisfiesRepeat() {
        when(evidenceSource.getLabResults(eq(PATIENT), any(), eq(T)))
                .thenReturn(List.of(lactate(3.5, T.plus(Duration.ofHours(1)))));
        ElementCheckResult initial = metResult("3.5", T.plus(Duration.ofHours(1)));

        ElementCheckOutcome outcome = checker.check(request(REPEAT_LACTATE, T.plus(Duration.ofHours(2)), initial));

        assertEquals(ElementStatus.PENDING, outcome.getStatus());
    }

    private static ElementEvaluationRequest request(BundleElement element, Instant now, ElementCheckResult prerequisite) {
        return ElementEvaluationRequest.builder()
                .element(element)
                .patientId(PATIENT)
                .triggerTime(T)
                .now(now)
                .context(PatientContext.builder().build())
                .prerequisite(prerequisite)
                .build();
    }

    private static LabResult lactate(double value, Instant at) {
        return LabResult.builder()
                .code(ClinicalCodes.LOINC_LACTATE)
                .numericValue(value)
                .unit("mmol/L")
                .effectiveTime(at)
                .build();
    }

    private static ElementCheckResult metResult(String value, Instant completedAt) {
        ElementCheckResult result = new ElementCheckResult();
        result.setElementId("sepsis_lactate");
        result.setStatus(ElementStatus.MET);
        result.setValue(value);
        result.setCompletedAt(completedAt);
        return result;
    }
}
