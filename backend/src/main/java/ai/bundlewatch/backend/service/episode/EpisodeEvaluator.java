package ai.bundlewatch.backend.service.episode;

import ai.bundlewatch.backend.model.bundle.BundleElement;
import ai.bundlewatch.backend.model.bundle.GuidelineBundle;
import ai.bundlewatch.backend.model.context.PatientContext;
import ai.bundlewatch.backend.model.entity.ElementCheckResult;
import ai.bundlewatch.backend.model.entity.ElementStatus;
import ai.bundlewatch.backend.model.entity.Episode;
import ai.bundlewatch.backend.model.entity.EpisodeStatus;
import ai.bundlewatch.backend.repository.ElementCheckResultRepository;
import ai.bundlewatch.backend.repository.EpisodeRepository;
import ai.bundlewatch.backend.service.catalog.BundleCatalog;
import ai.bundlewatch.backend.service.checker.ElementCheckOutcome;
import ai.bundlewatch.backend.service.checker.ElementCheckerRegistry;
import ai.bundlewatch.backend.service.checker.ElementEvaluationRequest;
import ai.bundlewatch.backend.service.compliance.AdherenceFigures;
import ai.bundlewatch.backend.service.compliance.ComplianceAggregator;
import ai.bundlewatch.backend.service.context.Applicability;
import ai.bundlewatch.backend.service.context.ApplicabilityResolver;
import ai.bundlewatch.backend.service.context.PatientContextBuilder;
import ai.bundlewatch.backend.service.deviation.Deviation;
import ai.bundlewatch.backend.service.deviation.DeviationAlertFactory;
import ai.bundlewatch.backend.service.deviation.DeviationDeduplicator;
import ai.bundlewatch.backend.service.deviation.DeviationKey;
import ai.bundlewatch.backend.service.exception.UnknownBundleException;
import ai.bundlewatch.backend.service.metrics.AdherenceMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs evaluation cycles over ACTIVE episodes.
 *
 * <p>Each PENDING element is resolved for applicability, dispatched to its checker and moved to a
 * terminal status when the checker decides. Elements that newly become NOT_MET, and NOT_MET elements
 * no fast dedup tier has recorded yet, are handed to the {@link DeviationDeduplicator}. A failed
 * alert is counted and offered again next cycle. An exception in one episode is logged and counted,
 * and the cycle continues with the next episode.
 */
@Service
public class EpisodeEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(EpisodeEvaluator.class);

    private final EpisodeRepository episodeRepository;
    private final ElementCheckResultRepository resultRepository;
    private final BundleCatalog bundleCatalog;
    private final PatientContextBuilder contextBuilder;
    private final ApplicabilityResolver applicabilityResolver;
    private final ElementCheckerRegistry checkerRegistry;
    private final DeviationAlertFactory alertFactory;
    private final DeviationDeduplicator deduplicator;
    private final AdherenceMetricsService metricsService;
    private final Clock clock;

    @Autowired
    public EpisodeEvaluator(EpisodeRepository episodeRepository,
                            ElementCheckResultRepository resultRepository,
                            BundleCatalog bundleCatalog,
                            PatientContextBuilder contextBuilder,
                            ApplicabilityResolver applicabilityResolver,
                            ElementCheckerRegistry checkerRegistry,
                            DeviationAlertFactory alertFactory,
                            DeviationDeduplicator deduplicator,
                            AdherenceMetricsService metricsService,
                            Clock clock) {
        this.episodeRepository = episodeRepository;
        this.resultRepository = resultRepository;
        this.bundleCatalog = bundleCatalog;
        this.contextBuilder = contextBuilder;
        this.applicabilityResolver = applicabilityResolver;
        this.checkerRegistry = checkerRegistry;
        this.alertFactory = alertFactory;
        this.deduplicator = deduplicator;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Evaluates every ACTIVE episode once.
     *
     * @param bundleId only evaluate episodes of this bundle; null for all
     * @param dryRun   decide outcomes without persisting them or emitting alerts
     * @return counters for the cycle
     */
    public EvaluationCycleSummary runCycle(String bundleId, boolean dryRun) {
        long startNanos = System.nanoTime();
        Instant startedAt = clock.instant();

        List<Episode> episodes = bundleId == null
                ? episodeRepository.findByStatusOrderByTriggerTimeAsc(EpisodeStatus.ACTIVE)
                : episodeRepository.findByStatusAndBundleIdOrderByTriggerTimeAsc(EpisodeStatus.ACTIVE, bundleId);

        logger.info("Starting evaluation cycle: {} active episodes{}{}", episodes.size(),
                bundleId != null ? " for " + bundleId : "", dryRun ? " (dry run)" : "");

        int evaluated = 0;
        int failed = 0;
        int completed = 0;
        int transitions = 0;
        int newlyNotMet = 0;
        int emitted = 0;
        int suppressed = 0;
        int deviationsFailed = 0;
        boolean interrupted = false;

        for (Episode episode : episodes) {
            if (Thread.currentThread().isInterrupted()) {
                interrupted = true;
                logger.warn("Evaluation cycle interrupted after {} of {} episodes", evaluated + failed, episodes.size());
                break;
            }
            try {
                EpisodeEvaluation evaluation = evaluate(episode, dryRun);
                evaluated++;
                transitions += evaluation.getTransitions();
                newlyNotMet += evaluation.getNewlyNotMet();
                emitted += evaluation.getDeviationsEmitted();
                suppressed += evaluation.getDeviationsSuppressed();
                deviationsFailed += evaluation.getDeviationsFailed();
                if (evaluation.isCompleted()) {
                    completed++;
                }
                metricsService.recordEpisodeEvaluated();
            } catch (RuntimeException e) {
                failed++;
                metricsService.recordEpisodeFailure();
                logger.error("Failed to evaluate episode {} ({}): {}", episode.getId(), episode.getBundleId(), e.getMessage(), e);
            }
        }

        metricsService.recordCycle(Duration.ofNanos(System.nanoTime() - startNanos));

        EvaluationCycleSummary summary = EvaluationCycleSummary.builder()
                .bundleId(bundleId)
                .dryRun(dryRun)
                .startedAt(startedAt)
                .finishedAt(clock.instant())
                .episodesEvaluated(evaluated)
                .episodesFailed(failed)
                .episodesCompleted(completed)
                .transitions(transitions)
                .newlyNotMet(newlyNotMet)
                .deviationsEmitted(emitted)
                .deviationsSuppressed(suppressed)
                .deviationsFailed(deviationsFailed)
                .interrupted(interrupted)
                .build();

        logger.info("Evaluation cycle finished: {} evaluated, {} failed, {} completed, {} transitions, {} deviations emitted",
                evaluated, failed, completed, transitions, emitted);
        return summary;
    }

    /**
     * Evaluates one episode.
     *
     * <p>A dry run takes the same decisions on detached copies of the stored results, so dependent
     * elements see their prerequisite's new status, but nothing is saved and no alert is emitted.
     *
     * @throws UnknownBundleException if the episode's bundle is no longer in the catalog
     */
    public EpisodeEvaluation evaluate(Episode episode, boolean dryRun) {
        GuidelineBundle bundle = bundleCatalog.findBundle(episode.getBundleId())
                .orElseThrow(() -> new UnknownBundleException("Unknown bundle: " + episode.getBundleId()));
        Instant now = clock.instant();

        Map<String, ElementCheckResult> byElement = new LinkedHashMap<>();
        for (ElementCheckResult result : resultRepository.findByEpisodeIdOrderByDisplayOrderAsc(episode.getId())) {
            byElement.put(result.getElementId(), dryRun ? detachedCopy(result) : result);
        }
        List<BundleElement> elements = bundle.getElements();
        for (int i = 0; i < elements.size(); i++) {
            BundleElement element = elements.get(i);
            if (!byElement.containsKey(element.getElementId())) {
                ElementCheckResult created = EpisodeRegistrationService.pendingResult(episode, element, i, now);
                byElement.put(element.getElementId(), dryRun ? created : resultRepository.save(created));
            }
        }

        PatientContext context = contextBuilder.build(episode, bundle);

        int transitions = 0;
        List<ElementCheckResult> newlyNotMet = new ArrayList<>();
        List<ElementCheckResult> undelivered = new ArrayList<>();
        for (BundleElement element : evaluationOrder(elements)) {
            ElementCheckResult result = byElement.get(element.getElementId());
            if (result.getStatus().isTerminal()) {
                if (!dryRun && result.getStatus() == ElementStatus.NOT_MET
                        && !deduplicator.isRecorded(DeviationKey.of(episode.getId(), element.getElementId()))) {
                    undelivered.add(result);
                }
                continue;
            }
            ElementCheckResult prerequisite = element.hasDependency()
                    ? byElement.get(element.getDependency().getDependsOn())
                    : null;
            ElementCheckOutcome outcome = decide(bundle, element, episode, context, prerequisite, now);

            if (outcome.getStatus() == ElementStatus.PENDING) {
                if (!Objects.equals(result.getNotes(), outcome.getNotes())) {
                    result.setNotes(outcome.getNotes());
                    result.setUpdatedAt(now);
                    if (!dryRun) {
                        resultRepository.save(result);
                    }
                }
                continue;
            }

            transitions++;
            logger.debug("Episode {} element {}: PENDING -> {} ({})",
                    episode.getId(), element.getElementId(), outcome.getStatus(), outcome.getNotes());
            result.setStatus(outcome.getStatus());
            result.setCompletedAt(outcome.getCompletedAt());
            result.setValue(outcome.getValue());
            result.setNotes(outcome.getNotes());
            result.setUpdatedAt(now);
            if (outcome.getStatus() == ElementStatus.NOT_MET) {
                newlyNotMet.add(result);
            }
            if (!dryRun) {
                resultRepository.save(result);
                metricsService.recordTransition(bundle.getBundleId(), outcome.getStatus());
            }
        }

        List<ElementCheckResult> results = new ArrayList<>(byElement.values());
        AdherenceFigures figures = ComplianceAggregator.summarize(results);

        int emitted = 0;
        int suppressed = 0;
        int failed = 0;
        if (!dryRun) {
            List<ElementCheckResult> toDeliver = new ArrayList<>(undelivered);
            toDeliver.addAll(newlyNotMet);
            for (ElementCheckResult result : toDeliver) {
                BundleElement element = bundle.findElement(result.getElementId()).orElseThrow();
                Deviation deviation = alertFactory.create(bundle, element, episode, result,
                        figures.getOverallAdherencePercentage());
                try {
                    if (deduplicator.emitIfNew(deviation).isPresent()) {
                        emitted++;
                    } else {
                        suppressed++;
                    }
                } catch (RuntimeException e) {
                    failed++;
                    metricsService.recordDeviationFailure();
                    logger.error("Failed to emit deviation {}, will retry next cycle: {}",
                            deviation.getKey(), e.getMessage(), e);
                }
            }
        }

        // An episode with an unsent deviation stays ACTIVE so the next cycle offers it again.
        boolean anyPending = results.stream().anyMatch(r -> r.getStatus() == ElementStatus.PENDING);
        EpisodeStatus status = anyPending || failed > 0 ? EpisodeStatus.ACTIVE : EpisodeStatus.COMPLETE;
        boolean completed = status == EpisodeStatus.COMPLETE && episode.getStatus() != EpisodeStatus.COMPLETE;

        if (!dryRun && (status != episode.getStatus() || transitions > 0)) {
            episode.setStatus(status);
            episode.setUpdatedAt(now);
            episodeRepository.save(episode);
        }
        if (completed) {
            logger.info("Episode {} complete{}: adherence {}%, overall {}%", episode.getId(),
                    dryRun ? " (dry run)" : "", figures.getAdherencePercentage(), figures.getOverallAdherencePercentage());
        }

        return EpisodeEvaluation.builder()
                .episode(episode)
                .context(context)
                .results(results)
                .figures(figures)
                .transitions(transitions)
                .newlyNotMet(newlyNotMet.size())
                .deviationsEmitted(emitted)
                .deviationsSuppressed(suppressed)
                .deviationsFailed(failed)
                .completed(completed)
                .build();
    }

    private ElementCheckOutcome decide(GuidelineBundle bundle, BundleElement element, Episode episode,
                                       PatientContext context, ElementCheckResult prerequisite, Instant now) {
        Applicability applicability = applicabilityResolver.resolve(bundle, element, context, prerequisite);
        switch (applicability.getDecision()) {
            case NOT_APPLICABLE:
                return ElementCheckOutcome.notApplicable(applicability.getReason());
            case UNDECIDED:
                return ElementCheckOutcome.pending(applicability.getReason());
            default:
                break;
        }
        ElementEvaluationRequest request = ElementEvaluationRequest.builder()
                .element(element)
                .patientId(episode.getPatientId())
                .triggerTime(episode.getTriggerTime())
                .now(now)
                .context(context)
                .prerequisite(prerequisite)
                .build();
        return checkerRegistry.check(request);
    }

    /**
     * Independent elements first, then elements that depend on another, each group in bundle order.
     */
    private static ElementCheckResult detachedCopy(ElementCheckResult stored) {
        ElementCheckResult copy = new ElementCheckResult();
        copy.setId(stored.getId());
        copy.setEpisodeId(stored.getEpisodeId());
        copy.setElementId(stored.getElementId());
        copy.setElementName(stored.getElementName());
        copy.setRequired(stored.isRequired());
        copy.setDisplayOrder(stored.getDisplayOrder());
        copy.setStatus(stored.getStatus());
        copy.setTimeWindowHours(stored.getTimeWindowHours());
        copy.setDeadline(stored.getDeadline());
        copy.setCompletedAt(stored.getCompletedAt());
        copy.setValue(stored.getValue());
        copy.setNotes(stored.getNotes());
        copy.setUpdatedAt(stored.getUpdatedAt());
        return copy;
    }

    static List<BundleElement> evaluationOrder(List<BundleElement> elements) {
        List<BundleElement> ordered = new ArrayList<>(elements.size());
        for (BundleElement element : elements) {
            if (!element.hasDependency()) {
                ordered.add(element);
            }
        }
        for (BundleElement element : elements) {
            if (element.hasDependency()) {
                ordered.add(element);
            }
        }
        return ordered;
    }
}
