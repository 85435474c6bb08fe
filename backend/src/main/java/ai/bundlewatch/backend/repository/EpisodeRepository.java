package ai.bundlewatch.backend.repository;

import ai.bundlewatch.backend.model.entity.Episode;
import ai.bundlewatch.backend.model.entity.EpisodeStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Provides CRUD operations for monitored episodes.
 */
@Repository
public interface EpisodeRepository extends JpaRepository<Episode, UUID> {

    /**
     * Looks up an episode by its natural identity.
     *
     * @param patientId   FHIR patient id
     * @param encounterId encounter id
     * @param bundleId    bundle id
     * @return the episode if one was registered
     */
    Optional<Episode> findByPatientIdAndEncounterIdAndBundleId(String patientId, String encounterId, String bundleId);

    /**
     * Returns episodes with the given status, oldest trigger first.
     */
    List<Episode> findByStatusOrderByTriggerTimeAsc(EpisodeStatus status);

    List<Episode> findByStatusAndBundleIdOrderByTriggerTimeAsc(EpisodeStatus status, String bundleId);

    List<Episode> findAllByOrderByTriggerTimeDesc();

    @Query("SELECT e.status AS status, COUNT(e) AS total FROM Episode e "
            + "WHERE e.bundleId = :bundleId AND e.triggerTime >= :since GROUP BY e.status")
    List<EpisodeStatusCount> countByStatusForBundleSince(@Param("bundleId") String bundleId,
                                                        @Param("since") Instant since);

    /**
     * Projection for per-status episode counts.
     */
    interface EpisodeStatusCount {
        EpisodeStatus getStatus();

        Long getTotal();
    }
}
