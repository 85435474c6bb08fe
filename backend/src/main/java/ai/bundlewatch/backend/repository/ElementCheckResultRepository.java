package ai.bundlewatch.backend.repository;

import ai.bundlewatch.backend.model.entity.ElementCheckResult;
import ai.bundlewatch.backend.model.entity.ElementStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Provides CRUD operations for per-element results.
 */
@Repository
public interface ElementCheckResultRepository extends JpaRepository<ElementCheckResult, UUID> {

    /**
     * Returns the results of one episode in bundle display order.
     *
     * @param episodeId the episode id
     * @return results ordered by display order
     */
    List<ElementCheckResult> findByEpisodeIdOrderByDisplayOrderAsc(UUID episodeId);

    /**
     * Aggregates element statuses across every episode of a bundle triggered since the given instant.
     * Used for compliance reporting.
     */
    @Query("SELECT r.elementId AS elementId, r.elementName AS elementName, r.status AS status, "
            + "COUNT(r) AS total FROM ElementCheckResult r, Episode e "
            + "WHERE r.episodeId = e.id AND e.bundleId = :bundleId AND e.triggerTime >= :since "
            + "GROUP BY r.elementId, r.elementName, r.status")
    List<ElementStatusCount> countByElementAndStatus(@Param("bundleId") String bundleId,
                                                     @Param("since") Instant since);

    /**
     * Projection for the compliance aggregate.
     */
    interface ElementStatusCount {
        String getElementId();

        String getElementName();

        ElementStatus getStatus();

        Long getTotal();
    }
}
