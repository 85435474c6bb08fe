package ai.bundlewatch.backend.service.scheduler;

import ai.bundlewatch.backend.model.bundle.GuidelineBundle;
import ai.bundlewatch.backend.model.evidence.TriggerCandidate;
import ai.bundlewatch.backend.service.catalog.BundleCatalog;
import ai.bundlewatch.backend.service.episode.EpisodeEvaluator;
import ai.bundlewatch.backend.service.episode.EpisodeRegistrationService;
import ai.bundlewatch.backend.service.trigger.TriggerFinder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Polling loop: discover new triggers for every enabled bundle, then evaluate all active episodes.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "adherence.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class AdherenceMonitorScheduler {

    private final BundleCatalog bundleCatalog;
    private final TriggerFinder triggerFinder;
    private final EpisodeRegistrationService registrationService;
    private final EpisodeEvaluator episodeEvaluator;

    @Autowired
    public AdherenceMonitorScheduler(BundleCatalog bundleCatalog,
                                     TriggerFinder triggerFinder,
                                     EpisodeRegistrationService registrationService,
                                     EpisodeEvaluator episodeEvaluator) {
        this.bundleCatalog = bundleCatalog;
        this.triggerFinder = triggerFinder;
        this.registrationService = registrationService;
        this.episodeEvaluator = episodeEvaluator;
        log.info("AdherenceMonitorScheduler initialized for bundles {}",
                bundleCatalog.getEnabledBundles().stream().map(GuidelineBundle::getBundleId).collect(Collectors.toList()));
    }

    @Scheduled(fixedDelayString = "${adherence.scheduler.interval-ms:900000}",
            initialDelayString = "${adherence.scheduler.initial-delay-ms:30000}")
    public void runMonitoringCycle() {
        try {
            discoverTriggers();
            episodeEvaluator.runCycle(null, false);
        } catch (Exception e) {
            log.error("Monitoring cycle failed: {}", e.getMessage(), e);
        }
    }

    /**
     * @return number of newly registered episodes
     */
    int discoverTriggers() {
        int created = 0;
        for (GuidelineBundle bundle : bundleCatalog.getEnabledBundles()) {
            try {
                List<TriggerCandidate> candidates = triggerFinder.findCandidates(bundle);
                int bundleCreated = registrationService.registerAll(bundle, candidates);
                created += bundleCreated;
                log.debug("{}: {} trigger candidates, {} new episodes", bundle.getBundleId(), candidates.size(), bundleCreated);
            } catch (RuntimeException e) {
                log.warn("Trigger discovery failed for {}: {}", bundle.getBundleId(), e.getMessage());
            }
        }
        if (created > 0) {
            log.info("Registered {} new episodes", created);
        }
        return created;
    }
}
