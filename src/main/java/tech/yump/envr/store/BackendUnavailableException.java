package tech.yump.envr.store;

/**
 * Thrown when a backend cannot be reached or is not configured: missing command-line tool,
 * missing credentials, failed command, unexpected HTTP status.
 */
public class BackendUnavailableException extends SecretStoreException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
