package ai.bundlewatch.backend.service.episode;

import ai.bundlewatch.backend.model.context.PatientContext;
import ai.bundlewatch.backend.model.entity.ElementCheckResult;
import ai.bundlewatch.backend.model.entity.Episode;
import ai.bundlewatch.backend.service.compliance.AdherenceFigures;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What one evaluation of one episode changed.
 */
@Value
@Builder
public class EpisodeEvaluation {

    Episode episode;

    PatientContext context;

    List<ElementCheckResult> results;

    AdherenceFigures figures;

    int transitions;

    int newlyNotMet;

    int deviationsEmitted;

    int deviationsSuppressed;

    int deviationsFailed;

    boolean completed;
}
