package ai.bundlewatch.backend.service.alert;

import ai.bundlewatch.backend.model.entity.AlertStatus;
import ai.bundlewatch.backend.model.entity.AlertType;
import ai.bundlewatch.backend.model.entity.StoredAlert;
import ai.bundlewatch.backend.repository.StoredAlertRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Alert sink backed by the {@code guideline_alert} table.
 */
@Service
public class JpaAlertSink implements AlertSink {

    private static final Logger logger = LoggerFactory.getLogger(JpaAlertSink.class);

    private final StoredAlertRepository alertRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public JpaAlertSink(StoredAlertRepository alertRepository, ObjectMapper objectMapper, Clock clock) {
        this.alertRepository = alertRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public boolean checkIfAlerted(AlertType alertType, String sourceId, boolean includeResolved) {
        if (includeResolved) {
            return alertRepository.existsByAlertTypeAndSourceId(alertType, sourceId);
        }
        return alertRepository.existsByAlertTypeAndSourceIdAndStatusNot(alertType, sourceId, AlertStatus.RESOLVED);
    }

    @Override
    public String saveAlert(AlertType alertType, String sourceId, String severity, String patientRef,
                            String title, String summary, Map<String, Object> content) {
        StoredAlert alert = new StoredAlert();
        alert.setAlertType(alertType);
        alert.setSourceId(sourceId);
        alert.setSeverity(severity);
        alert.setPatientId(patientRef);
        alert.setTitle(title);
        alert.setSummary(summary);
        alert.setContent(toJson(content));
        alert.setStatus(AlertStatus.PENDING);
        alert.setCreatedAt(clock.instant());

        StoredAlert saved = alertRepository.save(alert);
        logger.info("Saved {} alert {} for source {}", alertType, saved.getId(), sourceId);
        return saved.getId().toString();
    }

    @Override
    public boolean markSent(String alertId) {
        Optional<StoredAlert> alert = parseId(alertId).flatMap(alertRepository::findById);
        if (alert.isEmpty()) {
            logger.warn("Cannot mark unknown alert {} as sent", alertId);
            return false;
        }
        StoredAlert stored = alert.get();
        stored.setStatus(AlertStatus.SENT);
        stored.setSentAt(clock.instant());
        alertRepository.save(stored);
        return true;
    }

    private String toJson(Map<String, Object> content) {
        try {
            return objectMapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Alert content is not serializable", e);
        }
    }

    private static Optional<UUID> parseId(String alertId) {
        try {
            return Optional.of(UUID.fromString(alertId));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
