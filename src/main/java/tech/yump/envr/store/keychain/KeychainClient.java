package tech.yump.envr.store.keychain;

import java.util.Optional;

/**
 * Exact-name access to the OS credential manager. There is no listing primitive; enumeration is
 * layered on top by {@link ManifestIndex}.
 */
public interface KeychainClient {

    /**
     * @return the stored password, or Optional.empty() if no entry exists.
     */
    Optional<String> getPassword(String service, String account);

    /**
     * Creates or overwrites an entry.
     */
    void setPassword(String service, String account, String password);

    /**
     * Removes an entry.
     *
     * @return true if an entry was removed, false if none existed.
     */
    boolean deletePassword(String service, String account);
}
