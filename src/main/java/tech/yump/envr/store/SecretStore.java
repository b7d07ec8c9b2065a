package tech.yump.envr.store;

import java.util.List;
import java.util.Optional;
import tech.yump.envr.key.StoreDescriptor;

/**
 * One backend holding secrets for a single project/domain/version scope.
 * Implementations compute physical keys with {@link tech.yump.envr.key.KeyGrammar}, parameterized
 * by their {@link StoreDescriptor}.
 */
public interface SecretStore {

    /**
     * @return the store id this adapter was registered under (e.g. "local", "aws").
     */
    String name();

    StoreDescriptor descriptor();

    /**
     * Reads one secret.
     *
     * @param key a bare secret name, resolved against the adapter's scope, or a full composite key.
     * @return the value, or Optional.empty() if the key does not exist.
     * @throws WriteOnlyStoreException if the backend cannot read values back.
     */
    Optional<String> get(String key);

    /**
     * Creates or overwrites one secret.
     *
     * @param key   a bare secret name or a full composite key.
     * @param value the value to store. Must not be null.
     */
    void set(String key, String value);

    /**
     * Removes one secret. Deleting a key that does not exist is not an error.
     */
    void delete(String key);

    /**
     * @return the keys managed by this adapter, in a form {@link #get} accepts.
     */
    List<String> listKeys();

    /**
     * Removes every key returned by {@link #listKeys()}.
     */
    default void clear() {
        for (String key : listKeys()) {
            delete(key);
        }
    }

    /**
     * @return false for write-only backends.
     */
    default boolean isReadable() {
        return true;
    }
}
