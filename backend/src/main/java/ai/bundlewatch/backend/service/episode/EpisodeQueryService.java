package ai.bundlewatch.backend.service.episode;

import ai.bundlewatch.backend.model.bundle.AgeGroup;
import ai.bundlewatch.backend.model.bundle.GuidelineBundle;
import ai.bundlewatch.backend.model.dto.ElementResultResponse;
import ai.bundlewatch.backend.model.dto.EpisodeAssessmentResponse;
import ai.bundlewatch.backend.model.entity.ElementCheckResult;
import ai.bundlewatch.backend.model.entity.Episode;
import ai.bundlewatch.backend.model.entity.EpisodeStatus;
import ai.bundlewatch.backend.repository.ElementCheckResultRepository;
import ai.bundlewatch.backend.repository.EpisodeRepository;
import ai.bundlewatch.backend.service.catalog.BundleCatalog;
import ai.bundlewatch.backend.service.compliance.AdherenceFigures;
import ai.bundlewatch.backend.service.compliance.ComplianceAggregator;
import ai.bundlewatch.backend.service.exception.EpisodeNotFoundException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read side for stored episodes.
 */
@Service
public class EpisodeQueryService {

    private final EpisodeRepository episodeRepository;
    private final ElementCheckResultRepository resultRepository;
    private final BundleCatalog bundleCatalog;

    @Autowired
    public EpisodeQueryService(EpisodeRepository episodeRepository,
                               ElementCheckResultRepository resultRepository,
                               BundleCatalog bundleCatalog) {
        this.episodeRepository = episodeRepository;
        this.resultRepository = resultRepository;
        this.bundleCatalog = bundleCatalog;
    }

    /**
     * @param status filter, or null for every episode (newest trigger first)
     */
    public List<Episode> listEpisodes(EpisodeStatus status) {
        if (status == null) {
            return episodeRepository.findAllByOrderByTriggerTimeDesc();
        }
        return episodeRepository.findByStatusOrderByTriggerTimeAsc(status);
    }

    /**
     * @throws EpisodeNotFoundException if no episode has the id
     */
    public EpisodeAssessmentResponse assess(UUID episodeId) {
        Episode episode = episodeRepository.findById(episodeId)
                .orElseThrow(() -> new EpisodeNotFoundException("Episode not found: " + episodeId));
        List<ElementCheckResult> results = resultRepository.findByEpisodeIdOrderByDisplayOrderAsc(episodeId);
        AdherenceFigures figures = ComplianceAggregator.summarize(results);
        String bundleName = bundleCatalog.findBundle(episode.getBundleId())
                .map(GuidelineBundle::getName)
                .orElse(episode.getBundleId());

        return EpisodeAssessmentResponse.builder()
                .episodeId(episode.getId().toString())
                .patientId(episode.getPatientId())
                .encounterId(episode.getEncounterId())
                .bundleId(episode.getBundleId())
                .bundleName(bundleName)
                .triggerTime(episode.getTriggerTime())
                .status(episode.getStatus())
                .ageDays(episode.getAgeDays())
                .ageGroup(AgeGroup.fromAgeDays(episode.getAgeDays()).getLabel())
                .totalMet(figures.getMet())
                .totalNotMet(figures.getNotMet())
                .totalPending(figures.getPending())
                .totalNotApplicable(figures.getNotApplicable())
                .totalApplicable(figures.getTotalApplicable())
                .adherencePercentage(figures.getAdherencePercentage())
                .overallAdherencePercentage(figures.getOverallAdherencePercentage())
                .adherenceLevel(figures.getLevel())
                .elements(results.stream().map(ElementResultResponse::from).collect(Collectors.toList()))
                .build();
    }
}
