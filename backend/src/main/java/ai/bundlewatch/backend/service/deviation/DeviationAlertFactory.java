package ai.bundlewatch.backend.service.deviation;

import ai.bundlewatch.backend.model.bundle.BundleElement;
import ai.bundlewatch.backend.model.bundle.DeviationSeverity;
import ai.bundlewatch.backend.model.bundle.GuidelineBundle;
import ai.bundlewatch.backend.model.entity.ElementCheckResult;
import ai.bundlewatch.backend.model.entity.Episode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the alert text and structured content for a NOT_MET element.
 */
@Component
public class DeviationAlertFactory {

    public Deviation create(GuidelineBundle bundle, BundleElement element, Episode episode,
                            ElementCheckResult result, double overallAdherencePercentage) {
        DeviationKey key = DeviationKey.of(episode.getId(), element.getElementId());
        String recommendation = recommendation(bundle, element);

        Map<String, Object> content = new LinkedHashMap<>();
        content.put("bundle_id", bundle.getBundleId());
        content.put("bundle_name", bundle.getName());
        content.put("trigger_time", String.valueOf(episode.getTriggerTime()));
        content.put("element_id", element.getElementId());
        content.put("element_name", element.getName());
        content.put("time_window_hours", element.getTimeWindowHours());
        content.put("window_expired_at", result.getDeadline() != null ? result.getDeadline().toString() : null);
        content.put("status", result.getStatus().name());
        content.put("notes", result.getNotes());
        content.put("recommendation", recommendation);
        content.put("overall_adherence_pct", overallAdherencePercentage);
        content.put("episode_id", episode.getId().toString());

        DeviationSeverity severity = element.getSeverity() != null ? element.getSeverity() : DeviationSeverity.WARNING;

        return Deviation.builder()
                .key(key)
                .patientId(episode.getPatientId())
                .severity(severity)
                .title("Guideline Deviation: " + element.getName())
                .summary(bundle.getName() + ": " + element.getName() + " not completed within required timeframe")
                .recommendation(recommendation)
                .content(content)
                .result(result)
                .build();
    }

    static String recommendation(GuidelineBundle bundle, BundleElement element) {
        if (element.getRecommendation() != null && !element.getRecommendation().isBlank()) {
            return bundle.getName() + ": " + element.getRecommendation();
        }
        return bundle.getName() + ": " + element.getName()
                + " was not completed within the required timeframe. Review and document completion or clinical rationale.";
    }
}
