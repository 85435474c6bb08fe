package ai.bundlewatch.backend.repository;

import ai.bundlewatch.backend.model.entity.AlertStatus;
import ai.bundlewatch.backend.model.entity.AlertType;
import ai.bundlewatch.backend.model.entity.StoredAlert;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Provides CRUD operations for stored alerts.
 */
@Repository
public interface StoredAlertRepository extends JpaRepository<StoredAlert, UUID> {

    /**
     * Whether any alert, in any status, exists for the source.
     */
    boolean existsByAlertTypeAndSourceId(AlertType alertType, String sourceId);

    /**
     * Whether an alert that has not been resolved exists for the source.
     */
    boolean existsByAlertTypeAndSourceIdAndStatusNot(AlertType alertType, String sourceId, AlertStatus status);

    List<StoredAlert> findByStatusOrderByCreatedAtAsc(AlertStatus status);
}
