package ai.bundlewatch.backend.model.entity;

/**
 * Per-element state. Everything other than PENDING is terminal.
 */
public enum ElementStatus {
    PENDING,
    MET,
    NOT_MET,
    NOT_APPLICABLE;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
