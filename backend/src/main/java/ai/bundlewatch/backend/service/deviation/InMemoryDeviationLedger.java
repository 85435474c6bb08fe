package ai.bundlewatch.backend.service.deviation;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tier 1: process-local set of emitted keys. Lost on restart.
 */
@Component
public class InMemoryDeviationLedger implements DeviationLedger {

    private final Set<DeviationKey> keys = ConcurrentHashMap.newKeySet();

    @Override
    public int tier() {
        return 1;
    }

    @Override
    public boolean contains(DeviationKey key) {
        return keys.contains(key);
    }

    @Override
    public void record(DeviationKey key, String alertId) {
        keys.add(key);
    }

    public int size() {
        return keys.size();
    }

    /**
     * Test isolation only.
     */
    public void clear() {
        keys.clear();
    }
}
