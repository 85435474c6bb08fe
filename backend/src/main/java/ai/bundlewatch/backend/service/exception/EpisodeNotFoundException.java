package ai.bundlewatch.backend.service.exception;

/**
 * Thrown when an episode id does not resolve to a stored episode.
 */
public class EpisodeNotFoundException extends RuntimeException {

    public EpisodeNotFoundException(String message) {
        super(message);
    }

    public EpisodeNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
