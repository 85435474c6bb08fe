package ai.bundlewatch.backend.controller;

import ai.bundlewatch.backend.model.dto.BundleResponse;
import ai.bundlewatch.backend.model.dto.ComplianceReportResponse;
import ai.bundlewatch.backend.model.dto.EpisodeAssessmentResponse;
import ai.bundlewatch.backend.model.dto.EpisodeRegistrationRequest;
import ai.bundlewatch.backend.model.dto.EpisodeResponse;
import ai.bundlewatch.backend.model.entity.EpisodeStatus;
import ai.bundlewatch.backend.model.evidence.TriggerCandidate;
import ai.bundlewatch.backend.model.bundle.GuidelineBundle;
import ai.bundlewatch.backend.service.catalog.BundleCatalog;
import ai.bundlewatch.backend.service.compliance.ComplianceAggregator;
import ai.bundlewatch.backend.service.episode.EpisodeEvaluator;
import ai.bundlewatch.backend.service.episode.EpisodeQueryService;
import ai.bundlewatch.backend.service.episode.EpisodeRegistration;
import ai.bundlewatch.backend.service.episode.EpisodeRegistrationService;
import ai.bundlewatch.backend.service.episode.EvaluationCycleSummary;
import ai.bundlewatch.backend.service.exception.EpisodeNotFoundException;
import ai.bundlewatch.backend.service.exception.UnknownBundleException;
import io.micrometer.core.annotation.Timed;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST runner for the adherence engine. Part of API version 1, requires a JWT.
 */
@RestController
@RequestMapping("/api/v1")
public class AdherenceController {

    private static final Logger logger = LoggerFactory.getLogger(AdherenceController.class);

    private final BundleCatalog bundleCatalog;
    private final EpisodeRegistrationService registrationService;
    private final EpisodeQueryService queryService;
    private final EpisodeEvaluator episodeEvaluator;
    private final ComplianceAggregator complianceAggregator;

    @Autowired
    public AdherenceController(BundleCatalog bundleCatalog,
                               EpisodeRegistrationService registrationService,
                               EpisodeQueryService queryService,
                               EpisodeEvaluator episodeEvaluator,
                               ComplianceAggregator complianceAggregator) {
        this.bundleCatalog = bundleCatalog;
        this.registrationService = registrationService;
        this.queryService = queryService;
        this.episodeEvaluator = episodeEvaluator;
        this.complianceAggregator = complianceAggregator;
    }

    /**
     * Lists every bundle in the catalog with its monitoring flag.
     */
    @GetMapping("/bundles")
    public ResponseEntity<List<BundleResponse>> listBundles() {
        Set<String> enabled = bundleCatalog.getEnabledBundles().stream()
                .map(GuidelineBundle::getBundleId)
                .collect(Collectors.toSet());
        List<BundleResponse> bundles = bundleCatalog.getAllBundles().stream()
                .map(bundle -> BundleResponse.from(bundle, enabled.contains(bundle.getBundleId())))
                .collect(Collectors.toList());
        return ResponseEntity.ok(bundles);
    }

    /**
     * Registers an episode for a trigger. Returns 201 for a new episode and 200 when the
     * (patient, encounter, bundle) episode already existed.
     */
    @PostMapping("/bundles/{bundleId}/episodes")
    public ResponseEntity<EpisodeResponse> registerEpisode(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String bundleId,
            @Valid @RequestBody EpisodeRegistrationRequest request
    ) {
        String userId = (jwt != null) ? jwt.getSubject() : "test-user";

        TriggerCandidate candidate = TriggerCandidate.builder()
                .patientId(request.getPatientId())
                .encounterId(request.getEncounterId())
                .onsetTime(request.getTriggerTime())
                .ageDays(request.getAgeDays())
                .build();
        try {
            EpisodeRegistration registration = registrationService.register(bundleId, candidate);
            EpisodeResponse response = EpisodeResponse.from(registration.getEpisode());
            response.setCreated(registration.isCreated());
            logger.info("Episode registration for bundle {} by user {}: {}", bundleId, userId,
                    registration.isCreated() ? "created" : "existing");
            return ResponseEntity.status(registration.isCreated() ? HttpStatus.CREATED : HttpStatus.OK).body(response);
        } catch (UnknownBundleException e) {
            logger.warn("Registration for unknown bundle {}", bundleId);
            return ResponseEntity.notFound().build();
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid registration request for bundle {}: {}", bundleId, e.getMessage());
            return ResponseEntity.badRequest().build();
        }
    }

    @GetMapping("/episodes")
    public ResponseEntity<List<EpisodeResponse>> listEpisodes(@RequestParam(required = false) EpisodeStatus status) {
        List<EpisodeResponse> episodes = queryService.listEpisodes(status).stream()
                .map(EpisodeResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(episodes);
    }

    @GetMapping("/episodes/{episodeId}")
    public ResponseEntity<EpisodeAssessmentResponse> getEpisode(@PathVariable UUID episodeId) {
        try {
            return ResponseEntity.ok(queryService.assess(episodeId));
        } catch (EpisodeNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    /**
     * Marks an episode CLOSED, e.g. on discharge.
     */
    @PostMapping("/episodes/{episodeId}/close")
    public ResponseEntity<EpisodeResponse> closeEpisode(@AuthenticationPrincipal Jwt jwt, @PathVariable UUID episodeId) {
        String userId = (jwt != null) ? jwt.getSubject() : "test-user";
        try {
            EpisodeResponse response = EpisodeResponse.from(registrationService.close(episodeId));
            logger.info("Episode {} closed by user {}", episodeId, userId);
            return ResponseEntity.ok(response);
        } catch (EpisodeNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    /**
     * Runs one evaluation cycle synchronously.
     */
    @Timed(value = "http_request_duration_seconds", description = "On-demand evaluation cycle duration",
            extraTags = {"endpoint", "/api/v1/evaluations", "operation", "evaluation_cycle"})
    @PostMapping("/evaluations")
    public ResponseEntity<EvaluationCycleSummary> runEvaluation(
            @AuthenticationPrincipal Jwt jwt,
            @RequestParam(required = false) String bundleId,
            @RequestParam(defaultValue = "false") boolean dryRun
    ) {
        String userId = (jwt != null) ? jwt.getSubject() : "test-user";
        if (bundleId != null && bundleCatalog.findBundle(bundleId).isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        logger.info("On-demand evaluation requested by user {} (bundle={}, dryRun={})", userId, bundleId, dryRun);
        return ResponseEntity.ok(episodeEvaluator.runCycle(bundleId, dryRun));
    }

    @GetMapping("/compliance/{bundleId}")
    public ResponseEntity<ComplianceReportResponse> getCompliance(@PathVariable String bundleId,
                                                                  @RequestParam(defaultValue = "30") int days) {
        try {
            return ResponseEntity.ok(complianceAggregator.report(bundleId, days));
        } catch (UnknownBundleException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }
    }
}
