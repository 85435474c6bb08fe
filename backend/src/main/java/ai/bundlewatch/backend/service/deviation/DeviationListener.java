package ai.bundlewatch.backend.service.deviation;

/**
 * Callback for deviations that were just saved to the alert sink.
 */
public interface DeviationListener {

    void onDeviationEmitted(Deviation deviation, String alertId);
}
