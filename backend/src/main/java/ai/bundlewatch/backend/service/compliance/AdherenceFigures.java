package ai.bundlewatch.backend.service.compliance;

import lombok.Builder;
import lombok.Value;

/**
 * Per-episode element counts and the two adherence percentages.
 *
 * <p>{@code adherencePercentage} only looks at decided elements; {@code overallAdherencePercentage}
 * counts pending elements as not yet achieved, so it never exceeds the former while anything is pending.
 */
@Value
@Builder
public class AdherenceFigures {

    int met;

    int notMet;

    int pending;

    int notApplicable;

    int totalApplicable;

    double adherencePercentage;

    double overallAdherencePercentage;

    AdherenceLevel level;
}
