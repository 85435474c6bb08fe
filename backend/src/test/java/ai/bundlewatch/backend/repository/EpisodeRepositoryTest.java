package ai.bundlewatch.backend.repository;

import ai.bundlewatch.backend.model.entity.Episode;
import ai.bundlewatch.backend.model.entity.EpisodeStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class EpisodeRepositoryTest {

    private static final Instant T = Instant.parse("2024-03-01T10:00:00Z");

    @Autowired
    private EpisodeRepository episodeRepository;

    @Test
    void findByNaturalKey_ShouldMatchPatientEncounterAndBundle() {
        episodeRepository.save(episode("p1", "e1", "sepsis_peds_2024", T, EpisodeStatus.ACTIVE));
        episodeRepository.save(episode("p1", "e1", "febrile_infant_2024", T, EpisodeStatus.ACTIVE));

        Optional<Episode> found = episodeRepository.findByPatientIdAndEncounterIdAndBundleId("p1", "e1", "sepsis_peds_2024");

        assertTrue(found.isPresent());
        assertEquals("sepsis_peds_2024", found.get().getBundleId());
        assertTrue(episodeRepository.findByPatientIdAndEncounterIdAndBundleId("p1", "e2", "sepsis_peds_2024").isEmpty());
    }

    @Test
    void save_DuplicateNaturalKey_ShouldViolateUniqueConstraint() {
        episodeRepository.saveAndFlush(episode("p1", "e1", "sepsis_peds_2024", T, EpisodeStatus.ACTIVE));

        assertThrows(DataIntegrityViolationException.class, () ->
                episodeRepository.saveAndFlush(episode("p1", "e1", "sepsis_peds_2024", T.plusSeconds(60), EpisodeStatus.ACTIVE)));
    }

    @Test
    void findByStatus_ShouldOrderByTriggerTime() {
        episodeRepository.save(episode("p2", "e2", "sepsis_peds_2024", T.plusSeconds(3600), EpisodeStatus.ACTIVE));
        episodeRepository.save(episode("p1", "e1", "sepsis_peds_2024", T, EpisodeStatus.ACTIVE));
        episodeRepository.save(episode("p3", "e3", "sepsis_peds_2024", T, EpisodeStatus.CLOSED));
        episodeRepository.save(episode("p4", "e4", "febrile_infant_2024", T, EpisodeStatus.ACTIVE));

        List<Episode> active = episodeRepository.findByStatusAndBundleIdOrderByTriggerTimeAsc(EpisodeStatus.ACTIVE, "sepsis_peds_2024");

        assertEquals(List.of("p1", "p2"), active.stream().map(Episode::getPatientId).collect(Collectors.toList()));
        assertEquals(3, episodeRepository.findByStatusOrderByTriggerTimeAsc(EpisodeStatus.ACTIVE).size());
    }

    @Test
    void countByStatusForBundleSince_ShouldGroupAndRespectWindow() {
        episodeRepository.save(episode("p1", "e1", "sepsis_peds_2024", T, EpisodeStatus.ACTIVE));
        episodeRepository.save(episode("p2", "e2", "sepsis_peds_2024", T, EpisodeStatus.COMPLETE));
        episodeRepository.save(episode("p3", "e3", "sepsis_peds_2024", T, EpisodeStatus.COMPLETE));
        episodeRepository.save(episode("p4", "e4", "sepsis_peds_2024", T.minusSeconds(86400 * 40L), EpisodeStatus.COMPLETE));

        Map<EpisodeStatus, Long> counts = episodeRepository
                .countByStatusForBundleSince("sepsis_peds_2024", T.minusSeconds(86400 * 30L)).stream()
                .collect(Collectors.toMap(EpisodeRepository.EpisodeStatusCount::getStatus,
                        EpisodeRepository.EpisodeStatusCount::getTotal));

        assertEquals(1L, counts.get(EpisodeStatus.ACTIVE));
        assertEquals(2L, counts.get(EpisodeStatus.COMPLETE));
    }

    static Episode episode(String patientId, String encounterId, String bundleId, Instant trigger, EpisodeStatus status) {
        Episode episode = new Episode();
        episode.setPatientId(patientId);
        episode.setEncounterId(encounterId);
        episode.setBundleId(bundleId);
        episode.setTriggerTime(trigger);
        episode.setStatus(status);
        return episode;
    }
}
