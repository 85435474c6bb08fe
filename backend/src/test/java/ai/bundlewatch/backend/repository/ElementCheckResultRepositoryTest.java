package ai.bundlewatch.backend.repository;

import ai.bundlewatch.backend.model.entity.ElementCheckResult;
import ai.bundlewatch.backend.model.entity.ElementStatus;
import ai.bundlewatch.backend.model.entity.Episode;
import ai.bundlewatch.backend.model.entity.EpisodeStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class ElementCheckResultRepositoryTest {

    private static final Instant T = Instant.parse("2024-03-01T10:00:00Z");

    @Autowired
    private EpisodeRepository episodeRepository;

    @Autowired
    private ElementCheckResultRepository resultRepository;

    @Test
    void findByEpisodeId_ShouldReturnDisplayOrder() {
        UUID episodeId = episodeRepository.save(
                EpisodeRepositoryTest.episode("p1", "e1", "sepsis_peds_2024", T, EpisodeStatus.ACTIVE)).getId();
        resultRepository.save(result(episodeId, "sepsis_lactate", 1, ElementStatus.PENDING));
        resultRepository.save(result(episodeId, "sepsis_blood_cx", 0, ElementStatus.MET));

        List<String> ids = resultRepository.findByEpisodeIdOrderByDisplayOrderAsc(episodeId).stream()
                .map(ElementCheckResult::getElementId)
                .collect(Collectors.toList());

        assertEquals(List.of("sepsis_blood_cx", "sepsis_lactate"), ids);
    }

    @Test
    void countByElementAndStatus_ShouldOnlyCountMatchingBundleInWindow() {
        Episode first = episodeRepository.save(
                EpisodeRepositoryTest.episode("p1", "e1", "sepsis_peds_2024", T, EpisodeStatus.ACTIVE));
        Episode second = episodeRepository.save(
                EpisodeRepositoryTest.episode("p2", "e2", "sepsis_peds_2024", T, EpisodeStatus.ACTIVE));
        Episode old = episodeRepository.save(
                EpisodeRepositoryTest.episode("p3", "e3", "sepsis_peds_2024", T.minusSeconds(86400 * 60L), EpisodeStatus.COMPLETE));
        Episode other = episodeRepository.save(
                EpisodeRepositoryTest.episode("p4", "e4", "febrile_infant_2024", T, EpisodeStatus.ACTIVE));

        resultRepository.save(result(first.getId(), "sepsis_lactate", 1, ElementStatus.MET));
        resultRepository.save(result(second.getId(), "sepsis_lactate", 1, ElementStatus.MET));
        resultRepository.save(result(second.getId(), "sepsis_abx_1hr", 2, ElementStatus.NOT_MET));
        resultRepository.save(result(old.getId(), "sepsis_lactate", 1, ElementStatus.NOT_MET));
        resultRepository.save(result(other.getId(), "fi_blood_cx", 0, ElementStatus.MET));

        List<ElementCheckResultRepository.ElementStatusCount> counts =
                resultRepository.countByElementAndStatus("sepsis_peds_2024", T.minusSeconds(86400 * 30L));

        assertEquals(2, counts.size());
        ElementCheckResultRepository.ElementStatusCount lactate = counts.stream()
                .filter(c -> c.getElementId().equals("sepsis_lactate"))
                .findFirst()
                .orElseThrow();
        assertEquals(ElementStatus.MET, lactate.getStatus());
        assertEquals(2L, lactate.getTotal());
    }

    private static ElementCheckResult result(UUID episodeId, String elementId, int order, ElementStatus status) {
        ElementCheckResult result = new ElementCheckResult();
        result.setEpisodeId(episodeId);
        result.setElementId(elementId);
        result.setElementName(elementId);
        result.setRequired(true);
        result.setDisplayOrder(order);
        result.setStatus(status);
        result.setUpdatedAt(T);
        return result;
    }
}
