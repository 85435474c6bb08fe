package ai.bundlewatch.backend.service.episode;

import ai.bundlewatch.backend.model.bundle.BundleElement;
import ai.bundlewatch.backend.model.bundle.GuidelineBundle;
import ai.bundlewatch.backend.model.entity.ElementCheckResult;
import ai.bundlewatch.backend.model.entity.ElementStatus;
import ai.bundlewatch.backend.model.entity.Episode;
import ai.bundlewatch.backend.model.entity.EpisodeStatus;
import ai.bundlewatch.backend.model.evidence.TriggerCandidate;
import ai.bundlewatch.backend.repository.ElementCheckResultRepository;
import ai.bundlewatch.backend.repository.EpisodeRepository;
import ai.bundlewatch.backend.service.catalog.BundleCatalog;
import ai.bundlewatch.backend.service.checker.TimeWindows;
import ai.bundlewatch.backend.service.exception.EpisodeNotFoundException;
import ai.bundlewatch.backend.service.exception.UnknownBundleException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Creates episodes from trigger candidates and applies external lifecycle signals.
 *
 * <p>Episodes are keyed by (patient, encounter, bundle). Registering the same key again keeps the
 * original trigger time and element results.
 */
@Service
public class EpisodeRegistrationService {

    private static final Logger logger = LoggerFactory.getLogger(EpisodeRegistrationService.class);

    private final EpisodeRepository episodeRepository;
    private final ElementCheckResultRepository resultRepository;
    private final BundleCatalog bundleCatalog;
    private final Validator validator;
    private final Clock clock;

    @Autowired
    public EpisodeRegistrationService(EpisodeRepository episodeRepository,
                                      ElementCheckResultRepository resultRepository,
                                      BundleCatalog bundleCatalog,
                                      Validator validator,
                                      Clock clock) {
        this.episodeRepository = episodeRepository;
        this.resultRepository = resultRepository;
        this.bundleCatalog = bundleCatalog;
        this.validator = validator;
        this.clock = clock;
    }

    /**
     * Registers an episode for the trigger, or returns the existing one for the same identity.
     *
     * @throws UnknownBundleException if the bundle is not in the catalog
     * @throws IllegalArgumentException if patient, encounter or trigger time is missing
     */
    public EpisodeRegistration register(String bundleId, TriggerCandidate candidate) {
        GuidelineBundle bundle = bundleCatalog.findBundle(bundleId)
                .orElseThrow(() -> new UnknownBundleException("Unknown bundle: " + bundleId));
        validate(candidate);

        Instant now = clock.instant();
        Optional<Episode> existing = episodeRepository.findByPatientIdAndEncounterIdAndBundleId(
                candidate.getPatientId(), candidate.getEncounterId(), bundleId);

        if (existing.isPresent()) {
            Episode episode = existing.get();
            if (episode.getAgeDays() == null && candidate.getAgeDays() != null) {
                episode.setAgeDays(candidate.getAgeDays());
            }
            episode.setUpdatedAt(now);
            logger.debug("Episode {} already registered for patient {} encounter {}",
                    episode.getId(), candidate.getPatientId(), candidate.getEncounterId());
            return new EpisodeRegistration(episodeRepository.save(episode), false);
        }

        Episode episode = new Episode();
        episode.setPatientId(candidate.getPatientId());
        episode.setEncounterId(candidate.getEncounterId());
        episode.setBundleId(bundleId);
        episode.setTriggerTime(candidate.getOnsetTime());
        episode.setAgeDays(candidate.getAgeDays());
        episode.setStatus(EpisodeStatus.ACTIVE);
        episode.setCreatedAt(now);
        episode.setUpdatedAt(now);
        Episode saved = episodeRepository.save(episode);

        List<ElementCheckResult> results = new ArrayList<>();
        List<BundleElement> elements = bundle.getElements();
        for (int i = 0; i < elements.size(); i++) {
            results.add(pendingResult(saved, elements.get(i), i, now));
        }
        resultRepository.saveAll(results);

        logger.info("Registered {} episode {} for patient {} (trigger {}, {} elements)",
                bundleId, saved.getId(), saved.getPatientId(), saved.getTriggerTime(), results.size());
        return new EpisodeRegistration(saved, true);
    }

    /**
     * Registers every candidate, skipping invalid ones.
     *
     * @return the number of newly created episodes
     */
    public int registerAll(GuidelineBundle bundle, List<TriggerCandidate> candidates) {
        int created = 0;
        for (TriggerCandidate candidate : candidates) {
            try {
                if (register(bundle.getBundleId(), candidate).isCreated()) {
                    created++;
                }
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping {} trigger candidate for patient {}: {}",
                        bundle.getBundleId(), candidate.getPatientId(), e.getMessage());
            }
        }
        return created;
    }

    /**
     * Moves an episode to CLOSED. Closed episodes are no longer evaluated.
     *
     * @throws EpisodeNotFoundException if no episode has the id
     */
    public Episode close(UUID episodeId) {
        Episode episode = episodeRepository.findById(episodeId)
                .orElseThrow(() -> new EpisodeNotFoundException("Episode not found: " + episodeId));
        if (episode.getStatus() == EpisodeStatus.CLOSED) {
            return episode;
        }
        episode.setStatus(EpisodeStatus.CLOSED);
        episode.setUpdatedAt(clock.instant());
        logger.info("Closed episode {}", episodeId);
        return episodeRepository.save(episode);
    }

    /**
     * New PENDING result for an element, with its absolute deadline.
     */
    public static ElementCheckResult pendingResult(Episode episode, BundleElement element, int displayOrder, Instant now) {
        ElementCheckResult result = new ElementCheckResult();
        result.setEpisodeId(episode.getId());
        result.setElementId(element.getElementId());
        result.setElementName(element.getName());
        result.setRequired(element.isRequired());
        result.setDisplayOrder(displayOrder);
        result.setStatus(ElementStatus.PENDING);
        result.setTimeWindowHours(element.getTimeWindowHours());
        result.setDeadline(TimeWindows.deadline(episode.getTriggerTime(), element.getTimeWindowHours()).orElse(null));
        result.setUpdatedAt(now);
        return result;
    }

    private void validate(TriggerCandidate candidate) {
        if (candidate == null) {
            throw new IllegalArgumentException("Trigger candidate is required");
        }
        Set<ConstraintViolation<TriggerCandidate>> violations = validator.validate(candidate);
        if (!violations.isEmpty()) {
            throw new IllegalArgumentException(violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.joining(", ")));
        }
    }
}
