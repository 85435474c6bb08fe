package ai.bundlewatch.backend.service.compliance;

import ai.bundlewatch.backend.model.bundle.GuidelineBundle;
import ai.bundlewatch.backend.model.dto.ComplianceReportResponse;
import ai.bundlewatch.backend.model.dto.ElementComplianceResponse;
import ai.bundlewatch.backend.model.entity.ElementCheckResult;
import ai.bundlewatch.backend.model.entity.ElementStatus;
import ai.bundlewatch.backend.repository.ElementCheckResultRepository;
import ai.bundlewatch.backend.repository.ElementCheckResultRepository.ElementStatusCount;
import ai.bundlewatch.backend.repository.EpisodeRepository;
import ai.bundlewatch.backend.repository.EpisodeRepository.EpisodeStatusCount;
import ai.bundlewatch.backend.service.catalog.BundleCatalog;
import ai.bundlewatch.backend.service.exception.UnknownBundleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes adherence for single episodes and compliance rates per element across a bundle.
 */
@Service
public class ComplianceAggregator {

    private static final Logger logger = LoggerFactory.getLogger(ComplianceAggregator.class);

    private final EpisodeRepository episodeRepository;
    private final ElementCheckResultRepository resultRepository;
    private final BundleCatalog bundleCatalog;
    private final Clock clock;

    @Autowired
    public ComplianceAggregator(EpisodeRepository episodeRepository,
                                ElementCheckResultRepository resultRepository,
                                BundleCatalog bundleCatalog,
                                Clock clock) {
        this.episodeRepository = episodeRepository;
        this.resultRepository = resultRepository;
        this.bundleCatalog = bundleCatalog;
        this.clock = clock;
    }

    /**
     * Summarizes the results of one episode.
     */
    public static AdherenceFigures summarize(Collection<ElementCheckResult> results) {
        int met = 0;
        int notMet = 0;
        int pending = 0;
        int notApplicable = 0;
        for (ElementCheckResult result : results) {
            switch (result.getStatus()) {
                case MET -> met++;
                case NOT_MET -> notMet++;
                case PENDING -> pending++;
                case NOT_APPLICABLE -> notApplicable++;
            }
        }
        int totalApplicable = met + notMet + pending;
        double adherence = percentage(met, met + notMet);
        double overall = percentage(met, totalApplicable);

        return AdherenceFigures.builder()
                .met(met)
                .notMet(notMet)
                .pending(pending)
                .notApplicable(notApplicable)
                .totalApplicable(totalApplicable)
                .adherencePercentage(adherence)
                .overallAdherencePercentage(overall)
                .level(AdherenceLevel.of(adherence))
                .build();
    }

    /**
     * Builds the compliance report for a bundle over episodes triggered in the trailing window.
     *
     * @param days trailing window length, must be positive
     */
    public ComplianceReportResponse report(String bundleId, int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive");
        }
        GuidelineBundle bundle = bundleCatalog.findBundle(bundleId)
                .orElseThrow(() -> new UnknownBundleException("Unknown bundle: " + bundleId));
        Instant since = clock.instant().minus(Duration.ofDays(days));

        Map<String, Long> episodeCounts = new LinkedHashMap<>();
        for (EpisodeStatusCount count : episodeRepository.countByStatusForBundleSince(bundleId, since)) {
            episodeCounts.put(count.getStatus().name(), count.getTotal());
        }

        Map<String, ElementComplianceResponse> byElement = new LinkedHashMap<>();
        bundle.getElements().forEach(element -> byElement.put(element.getElementId(),
                ElementComplianceResponse.builder()
                        .elementId(element.getElementId())
                        .elementName(element.getName())
                        .build()));

        for (ElementStatusCount count : resultRepository.countByElementAndStatus(bundleId, since)) {
            ElementComplianceResponse row = byElement.computeIfAbsent(count.getElementId(),
                    id -> ElementComplianceResponse.builder()
                            .elementId(id)
                            .elementName(count.getElementName())
                            .build());
            long total = count.getTotal() != null ? count.getTotal() : 0L;
            addCount(row, count.getStatus(), total);
        }

        List<ElementComplianceResponse> elements = new ArrayList<>(byElement.values());
        for (ElementComplianceResponse row : elements) {
            long decided = row.getMet() + row.getNotMet();
            row.setTotalAssessed(decided);
            row.setComplianceRate(decided == 0 ? 0.0 : percentage(row.getMet(), decided));
        }
        logger.debug("Compliance report for {} over {} days: {} elements", bundleId, days, elements.size());

        return ComplianceReportResponse.builder()
                .bundleId(bundleId)
                .bundleName(bundle.getName())
                .days(days)
                .since(since)
                .episodeCounts(episodeCounts)
                .elements(elements)
                .build();
    }

    private static void addCount(ElementComplianceResponse row, ElementStatus status, long total) {
        switch (status) {
            case MET -> row.setMet(row.getMet() + total);
            case NOT_MET -> row.setNotMet(row.getNotMet() + total);
            case PENDING -> row.setPending(row.getPending() + total);
            case NOT_APPLICABLE -> row.setNotApplicable(row.getNotApplicable() + total);
        }
    }

    /**
     * One-decimal percentage; 100 when the denominator is zero.
     */
    static double percentage(long numerator, long denominator) {
        if (denominator == 0) {
            return 100.0;
        }
        return Math.round(numerator * 1000.0 / denominator) / 10.0;
    }
}
