package ai.bundlewatch.backend.service.deviation;

import lombok.Value;

import java.util.UUID;

/**
 * Identity of a deviation: one per (episode, element) for the lifetime of the system.
 */
@Value
public class DeviationKey {

    UUID episodeId;

    String elementId;

    public static DeviationKey of(UUID episodeId, String elementId) {
        return new DeviationKey(episodeId, elementId);
    }

    /**
     * @return {@code episodeId + "_" + elementId}, used as the alert source id
     */
    public String asSourceId() {
        return episodeId + "_" + elementId;
    }

    @Override
    public String toString() {
        return asSourceId();
    }
}
