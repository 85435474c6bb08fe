package ai.bundlewatch.backend.service.deviation;

import ai.bundlewatch.backend.model.entity.DeviationMarker;
import ai.bundlewatch.backend.repository.DeviationMarkerRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Tier 2: durable marker row per (episode, element).
 */
@Component
public class PersistentDeviationLedger implements DeviationLedger {

    private final DeviationMarkerRepository markerRepository;
    private final Clock clock;

    @Autowired
    public PersistentDeviationLedger(DeviationMarkerRepository markerRepository, Clock clock) {
        this.markerRepository = markerRepository;
        this.clock = clock;
    }

    @Override
    public int tier() {
        return 2;
    }

    @Override
    public boolean contains(DeviationKey key) {
        return markerRepository.existsByEpisodeIdAndElementId(key.getEpisodeId(), key.getElementId());
    }

    @Override
    public void record(DeviationKey key, String alertId) {
        if (contains(key)) {
            return;
        }
        DeviationMarker marker = new DeviationMarker();
        marker.setEpisodeId(key.getEpisodeId());
        marker.setElementId(key.getElementId());
        marker.setAlertId(alertId);
        marker.setCreatedAt(clock.instant());
        markerRepository.save(marker);
    }
}
