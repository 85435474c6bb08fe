package ai.bundlewatch.backend.service.alert;

import ai.bundlewatch.backend.model.entity.AlertType;

import java.util.Map;

/**
 * Durable store that delivers alerts to humans.
 */
public interface AlertSink {

    /**
     * Whether an alert already exists for the source.
     *
     * @param includeResolved also count alerts that were acknowledged and resolved
     */
    boolean checkIfAlerted(AlertType alertType, String sourceId, boolean includeResolved);

    /**
     * Stores a new alert.
     *
     * @return the alert id
     */
    String saveAlert(AlertType alertType, String sourceId, String severity, String patientRef,
                     String title, String summary, Map<String, Object> content);

    /**
     * @return false when no alert with that id exists
     */
    boolean markSent(String alertId);
}
