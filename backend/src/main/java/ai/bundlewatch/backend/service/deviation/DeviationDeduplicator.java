package ai.bundlewatch.backend.service.deviation;

import ai.bundlewatch.backend.model.entity.AlertType;
import ai.bundlewatch.backend.service.alert.AlertSink;
import ai.bundlewatch.backend.service.metrics.AdherenceMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Emits at most one alert per (episode, element) for the lifetime of the system.
 *
 * <p>Ledgers are consulted fastest first. A hit in any tier suppresses the alert and backfills
 * the faster tiers. A miss in the fast tiers always falls through to the authoritative alert sink
 * tier, so a restart that empties the in-memory set cannot produce a duplicate.
 *
 * <p>The fast tiers are written only after a successful alert save or an alert sink hit, so a
 * fast-tier hit always stands for an alert that exists in the sink.
 */
@Service
public class DeviationDeduplicator {

    private static final Logger logger = LoggerFactory.getLogger(DeviationDeduplicator.class);

    private final List<DeviationLedger> ledgers;
    private final AlertSink alertSink;
    private final ObjectProvider<DeviationListener> listeners;
    private final AdherenceMetricsService metricsService;

    @Autowired
    public DeviationDeduplicator(List<DeviationLedger> ledgers,
                                 AlertSink alertSink,
                                 ObjectProvider<DeviationListener> listeners,
                                 AdherenceMetricsService metricsService) {
        this.ledgers = ledgers.stream()
                .sorted(Comparator.comparingInt(DeviationLedger::tier))
                .collect(Collectors.toList());
        this.alertSink = alertSink;
        this.listeners = listeners;
        this.metricsService = metricsService;
        logger.info("Deviation deduplicator using ledger tiers {}",
                this.ledgers.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.toList()));
    }

    /**
     * @return the new alert id, or empty when the deviation was already alerted
     */
    public Optional<String> emitIfNew(Deviation deviation) {
        DeviationKey key = deviation.getKey();

        for (int i = 0; i < ledgers.size(); i++) {
            if (ledgers.get(i).contains(key)) {
                backfill(key, i);
                metricsService.recordDeviationSuppressed();
                logger.debug("Deviation {} already alerted (tier {})", key, ledgers.get(i).tier());
                return Optional.empty();
            }
        }

        String alertId = alertSink.saveAlert(
                AlertType.GUIDELINE_DEVIATION,
                key.asSourceId(),
                deviation.getSeverity().getValue(),
                deviation.getPatientId(),
                deviation.getTitle(),
                deviation.getSummary(),
                deviation.getContent());

        writeThrough(key, alertId, ledgers.size());
        metricsService.recordDeviationEmitted();
        logger.info("Emitted {} deviation alert {} for {}", deviation.getSeverity(), alertId, key);

        listeners.orderedStream().forEach(listener -> notifyListener(listener, deviation, alertId));
        return Optional.of(alertId);
    }

    /**
     * Whether a fast tier already records the key. The authoritative tier is not consulted, so a
     * false answer only means {@link #emitIfNew} has to decide.
     */
    public boolean isRecorded(DeviationKey key) {
        for (int i = 0; i < ledgers.size() - 1; i++) {
            if (ledgers.get(i).contains(key)) {
                return true;
            }
        }
        return false;
    }

    private void backfill(DeviationKey key, int hitIndex) {
        writeThrough(key, null, hitIndex);
    }

    private void writeThrough(DeviationKey key, String alertId, int upToExclusive) {
        for (int i = 0; i < upToExclusive; i++) {
            DeviationLedger ledger = ledgers.get(i);
            try {
                ledger.record(key, alertId);
            } catch (DataAccessException e) {
                metricsService.recordLedgerWriteFailure();
                logger.error("Failed to record deviation {} in ledger tier {}: {}", key, ledger.tier(), e.getMessage());
            }
        }
    }

    private void notifyListener(DeviationListener listener, Deviation deviation, String alertId) {
        try {
            listener.onDeviationEmitted(deviation, alertId);
        } catch (RuntimeException e) {
            logger.error("Deviation listener {} failed for alert {}: {}",
                    listener.getClass().getSimpleName(), alertId, e.getMessage());
        }
    }
}
