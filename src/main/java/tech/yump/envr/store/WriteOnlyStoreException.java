package tech.yump.envr.store;

/**
 * Thrown by {@link SecretStore#get} on backends that cannot read back the values they store.
 * Distinct from a missing key, which is reported as an empty result.
 */
public class WriteOnlyStoreException extends SecretStoreException {

    public WriteOnlyStoreException(String storeName) {
        super("Store '" + storeName + "' is write-only. Values cannot be read back.");
    }
}
