package ai.bundlewatch.backend.service.episode;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Counters for one evaluation cycle.
 */
@Value
@Builder
public class EvaluationCycleSummary {

    /** Bundle filter, null for all bundles. */
    String bundleId;

    boolean dryRun;

    Instant startedAt;

    Instant finishedAt;

    int episodesEvaluated;

    int episodesFailed;

    int episodesCompleted;

    int transitions;

    int newlyNotMet;

    int deviationsEmitted;

    int deviationsSuppressed;

    /** Alerts that failed to save; their NOT_MET results are offered again next cycle. */
    int deviationsFailed;

    /** True when the thread was interrupted before every episode was evaluated. */
    boolean interrupted;
}
