package ai.bundlewatch.backend.repository;

import ai.bundlewatch.backend.model.entity.AlertStatus;
import ai.bundlewatch.backend.model.entity.AlertType;
import ai.bundlewatch.backend.model.entity.StoredAlert;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class StoredAlertRepositoryTest {

    @Autowired
    private StoredAlertRepository alertRepository;

    @Test
    void existsBySource_ResolvedAlert_ShouldOnlyMatchAnyStatusQuery() {
        alertRepository.save(alert("ep-1:sepsis_lactate", AlertStatus.RESOLVED));

        assertTrue(alertRepository.existsByAlertTypeAndSourceId(AlertType.GUIDELINE_DEVIATION, "ep-1:sepsis_lactate"));
        assertFalse(alertRepository.existsByAlertTypeAndSourceIdAndStatusNot(
                AlertType.GUIDELINE_DEVIATION, "ep-1:sepsis_lactate", AlertStatus.RESOLVED));
    }

    @Test
    void existsBySource_PendingAlert_ShouldMatchUnresolvedQuery() {
        alertRepository.save(alert("ep-2:sepsis_abx_1hr", AlertStatus.PENDING));

        assertTrue(alertRepository.existsByAlertTypeAndSourceIdAndStatusNot(
                AlertType.GUIDELINE_DEVIATION, "ep-2:sepsis_abx_1hr", AlertStatus.RESOLVED));
        assertFalse(alertRepository.existsByAlertTypeAndSourceId(AlertType.GUIDELINE_DEVIATION, "ep-2:other"));
        assertEquals(1, alertRepository.findByStatusOrderByCreatedAtAsc(AlertStatus.PENDING).size());
    }

    private static StoredAlert alert(String sourceId, AlertStatus status) {
        StoredAlert alert = new StoredAlert();
        alert.setAlertType(AlertType.GUIDELINE_DEVIATION);
        alert.setSourceId(sourceId);
        alert.setSeverity("WARNING");
        alert.setPatientId("p1");
        alert.setTitle("Guideline deviation");
        alert.setStatus(status);
        return alert;
    }
}
