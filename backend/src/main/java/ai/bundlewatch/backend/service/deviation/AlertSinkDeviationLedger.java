package ai.bundlewatch.backend.service.deviation;

import ai.bundlewatch.backend.model.entity.AlertType;
import ai.bundlewatch.backend.service.alert.AlertSink;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Tier 3, authoritative: the alert sink's own record, including resolved alerts.
 * Writing is done by saving the alert itself, so {@link #record} has nothing to add.
 */
@Component
public class AlertSinkDeviationLedger implements DeviationLedger {

    private final AlertSink alertSink;

    @Autowired
    public AlertSinkDeviationLedger(AlertSink alertSink) {
        this.alertSink = alertSink;
    }

    @Override
    public int tier() {
        return 3;
    }

    @Override
    public boolean contains(DeviationKey key) {
        return alertSink.checkIfAlerted(AlertType.GUIDELINE_DEVIATION, key.asSourceId(), true);
    }

    @Override
    public void record(DeviationKey key, String alertId) {
        // the alert row is the record
    }
}
