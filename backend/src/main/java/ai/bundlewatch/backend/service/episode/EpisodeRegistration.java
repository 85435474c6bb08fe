package ai.bundlewatch.backend.service.episode;

import ai.bundlewatch.backend.model.entity.Episode;
import lombok.Value;

/**
 * Outcome of an upsert: the stored episode and whether it was newly created.
 */
@Value
public class EpisodeRegistration {

    Episode episode;

    boolean created;
}
