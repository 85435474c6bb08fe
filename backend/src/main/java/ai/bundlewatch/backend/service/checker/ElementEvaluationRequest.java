package ai.bundlewatch.backend.service.checker;

import ai.bundlewatch.backend.model.bundle.BundleElement;
import ai.bundlewatch.backend.model.context.PatientContext;
import ai.bundlewatch.backend.model.entity.ElementCheckResult;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Everything a checker needs to decide one element for one episode.
 */
@Value
@Builder
public class ElementEvaluationRequest {

    BundleElement element;

    String patientId;

    Instant triggerTime;

    Instant now;

    PatientContext context;

    /** Result of the prerequisite element for dependent elements, otherwise null. */
    ElementCheckResult prerequisite;

    public Instant deadline() {
        return TimeWindows.deadline(triggerTime, element.getTimeWindowHours()).orElse(null);
    }

    public boolean withinWindow() {
        return TimeWindows.withinWindow(now, triggerTime, element.getTimeWindowHours());
    }
}
