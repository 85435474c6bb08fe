package ai.bundlewatch.backend.repository;

import ai.bundlewatch.backend.model.entity.DeviationMarker;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Durable deviation markers, one per (episode, element).
 */
@Repository
public interface DeviationMarkerRepository extends JpaRepository<DeviationMarker, UUID> {

    boolean existsByEpisodeIdAndElementId(UUID episodeId, String elementId);
}
