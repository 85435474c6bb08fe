package ai.bundlewatch.backend.service.trigger;

import ai.bundlewatch.backend.model.bundle.GuidelineBundle;
import ai.bundlewatch.backend.model.evidence.TriggerCandidate;

import java.util.List;

/**
 * Discovers patients matching a bundle's entry criteria.
 */
public interface TriggerFinder {

    List<TriggerCandidate> findCandidates(GuidelineBundle bundle);
}
