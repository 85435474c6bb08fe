package ai.bundlewatch.backend.service.checker;

import ai.bundlewatch.backend.model.bundle.BundleElement;
import ai.bundlewatch.backend.model.bundle.DataSource;
import ai.bundlewatch.backend.model.entity.ElementStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ElementCheckerRegistryTest {

    private static final Instant T = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private ElementChecker labChecker;

    @Mock
    private ElementChecker otherLabChecker;

    @Test
    void check_WhenCheckerRegistered_ShouldDelegate() {
        // Arrange
        when(labChecker.dataSource()).thenReturn(DataSource.LAB);
        ElementEvaluationRequest request = request(DataSource.LAB);
        ElementCheckOutcome expected = ElementCheckOutcome.met(T, "1.0", "Result: 1.0");
        when(labChecker.check(request)).thenReturn(expected);
        ElementCheckerRegistry registry = new ElementCheckerRegistry(List.of(labChecker));

        // Act
        ElementCheckOutcome outcome = registry.check(request);

        // Assert
        assertSame(expected, outcome);
    }

    @Test
    void check_WhenNoCheckerForDataSource_ShouldStayPending() {
        when(labChecker.dataSource()).thenReturn(DataSource.LAB);
        ElementCheckerRegistry registry = new ElementCheckerRegistry(List.of(labChecker));

        ElementCheckOutcome outcome = registry.check(request(DataSource.NOTE));

        assertEquals(ElementStatus.PENDING, outcome.getStatus());
        assertEquals("No checker available for data source: NOTE", outcome.getNotes());
        verify(labChecker, never()).check(any());
    }

    @Test
    void constructor_WhenTwoCheckersShareDataSource_ShouldFail() {
        when(labChecker.dataSource()).thenReturn(DataSource.LAB);
        when(otherLabChecker.dataSource()).thenReturn(DataSource.LAB);

        assertThrows(IllegalStateException.class,
                () -> new ElementCheckerRegistry(List.of(labChecker, otherLabChecker)));
    }

    private static ElementEvaluationRequest request(DataSource dataSource) {
        return ElementEvaluationRequest.builder()
                .element(BundleElement.builder()
                        .elementId("element")
                        .name("Element")
                        .timeWindowHours(1.0)
                        .dataSource(dataSource)
                        .build())
                .patientId("patient-1")
                .triggerTime(T)
                .now(T)
                .build();
    }
}
