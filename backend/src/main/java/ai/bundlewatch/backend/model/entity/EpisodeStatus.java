package ai.bundlewatch.backend.model.entity;

public enum EpisodeStatus {
    ACTIVE,
    COMPLETE,
    /** Terminal tombstone set by an external signal such as discharge. */
    CLOSED
}
