package ai.bundlewatch.backend.service.episode;

import ai.bundlewatch.backend.model.dto.EpisodeAssessmentResponse;
import ai.bundlewatch.backend.model.entity.ElementCheckResult;
import ai.bundlewatch.backend.model.entity.ElementStatus;
import ai.bundlewatch.backend.model.entity.Episode;
import ai.bundlewatch.backend.model.entity.EpisodeStatus;
import ai.bundlewatch.backend.repository.ElementCheckResultRepository;
import ai.bundlewatch.backend.repository.EpisodeRepository;
import ai.bundlewatch.backend.service.catalog.StaticBundleCatalog;
import ai.bundlewatch.backend.service.compliance.AdherenceLevel;
import ai.bundlewatch.backend.service.exception.EpisodeNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EpisodeQueryServiceTest {

    private static final Instant T = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private EpisodeRepository episodeRepository;

    @Mock
    private ElementCheckResultRepository resultRepository;

    private EpisodeQueryService queryService;

    @BeforeEach
    void setUp() {
        queryService = new EpisodeQueryService(episodeRepository, resultRepository, new StaticBundleCatalog(Set.of()));
    }

    @Test
    void assess_WithDecidedAndPendingElements_ShouldReportBothPercentages() {
        // Arrange
        Episode episode = new Episode();
        episode.setId(UUID.randomUUID());
        episode.setPatientId("p1");
        episode.setEncounterId("e1");
        episode.setBundleId(StaticBundleCatalog.SEPSIS);
        episode.setTriggerTime(T);
        episode.setAgeDays(900);
        when(episodeRepository.findById(episode.getId())).thenReturn(Optional.of(episode));
        when(resultRepository.findByEpisodeIdOrderByDisplayOrderAsc(episode.getId())).thenReturn(List.of(
                result("sepsis_blood_cx", ElementStatus.MET),
                result("sepsis_lactate", ElementStatus.MET),
                result("sepsis_abx_1hr", ElementStatus.NOT_MET),
                result("sepsis_fluid_bolus", ElementStatus.PENDING),
                result("sepsis_repeat_lactate", ElementStatus.NOT_APPLICABLE)));

        // Act
        EpisodeAssessmentResponse response = queryService.assess(episode.getId());

        // Assert
        assertEquals(2, response.getTotalMet());
        assertEquals(1, response.getTotalNotMet());
        assertEquals(1, response.getTotalPending());
        assertEquals(1, response.getTotalNotApplicable());
        assertEquals(4, response.getTotalApplicable());
        assertEquals(66.7, response.getAdherencePercentage());
        assertEquals(50.0, response.getOverallAdherencePercentage());
        assertEquals(AdherenceLevel.PARTIAL, response.getAdherenceLevel());
        assertEquals("unknown", response.getAgeGroup());
        assertEquals(5, response.getElements().size());
        assertEquals("sepsis_blood_cx", response.getElements().get(0).getElementId());
        assertNotEquals(StaticBundleCatalog.SEPSIS, response.getBundleName());
    }

    @Test
    void assess_UnknownEpisode_ShouldThrow() {
        UUID id = UUID.randomUUID();
        when(episodeRepository.findById(id)).thenReturn(Optional.empty());

        assertThrows(EpisodeNotFoundException.class, () -> queryService.assess(id));
        verifyNoInteractions(resultRepository);
    }

    @Test
    void listEpisodes_WithoutStatus_ShouldReturnNewestFirst() {
        when(episodeRepository.findAllByOrderByTriggerTimeDesc()).thenReturn(List.of());

        queryService.listEpisodes(null);

        verify(episodeRepository).findAllByOrderByTriggerTimeDesc();
        verify(episodeRepository, never()).findByStatusOrderByTriggerTimeAsc(any());
    }

    private static ElementCheckResult result(String elementId, ElementStatus status) {
        ElementCheckResult result = new ElementCheckResult();
        result.setElementId(elementId);
        result.setElementName(elementId);
        result.setStatus(status);
        return result;
    }
}
