package ai.bundlewatch.backend.service.exception;

/**
 * Thrown when a bundle id is not in the catalog.
 */
public class UnknownBundleException extends RuntimeException {

    public UnknownBundleException(String message) {
        super(message);
    }

    public UnknownBundleException(String message, Throwable cause) {
        super(message, cause);
    }
}
