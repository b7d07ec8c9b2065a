package tech.yump.envr.store;

/**
 * Thrown when a store is constructed with a version that is not strict semver, before any backend
 * call is made.
 */
public class InvalidVersionException extends SecretStoreException {

    private final String version;

    public InvalidVersionException(String version, String message) {
        super(message);
        this.version = version;
    }

    public String getVersion() {
        return version;
    }
}
