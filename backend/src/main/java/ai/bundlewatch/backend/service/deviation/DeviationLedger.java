package ai.bundlewatch.backend.service.deviation;

/**
 * One tier of the deviation dedup record. Tiers are consulted in ascending {@link #tier()} order.
 */
public interface DeviationLedger {

    int tier();

    boolean contains(DeviationKey key);

    /**
     * Records that an alert exists for the key.
     *
     * @param alertId the alert id, or null when backfilling from a slower tier
     */
    void record(DeviationKey key, String alertId);
}
