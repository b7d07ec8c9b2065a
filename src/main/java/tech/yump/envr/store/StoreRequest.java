package tech.yump.envr.store;

/**
 * Fully resolved arguments for opening one adapter.
 *
 * @param scope  project, domain and version (already defaulted)
 * @param prefix explicit list prefix or path; null to use the provider's default prefix
 * @param path   file path, used by the file store only; null for the configured default
 */
public record StoreRequest(KeyScope scope, String prefix, String path) {

    public static StoreRequest of(KeyScope scope) {
        return new StoreRequest(scope, null, null);
    }
}
