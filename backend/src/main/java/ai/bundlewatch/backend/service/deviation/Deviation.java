package ai.bundlewatch.backend.service.deviation;

import ai.bundlewatch.backend.model.bundle.DeviationSeverity;
import ai.bundlewatch.backend.model.entity.ElementCheckResult;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A NOT_MET element requiring human notification. Derived, never stored as its own entity.
 */
@Value
@Builder
public class Deviation {

    DeviationKey key;

    String patientId;

    DeviationSeverity severity;

    String title;

    String summary;

    String recommendation;

    Map<String, Object> content;

    ElementCheckResult result;
}
