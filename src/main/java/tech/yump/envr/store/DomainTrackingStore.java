package tech.yump.envr.store;

import java.util.List;

/**
 * A store that keeps its own index of domains holding at least one secret, for backends with no
 * native listing primitive.
 *
 * <p>A domain is listed by {@link #listDomains()} exactly when its key list is non-empty, provided
 * every write goes through {@link #setWithDomainTracking}.
 */
public interface DomainTrackingStore extends SecretStore {

    /**
     * Performs {@link #set} and registers the adapter's domain in the project-wide registry.
     */
    void setWithDomainTracking(String key, String value);

    List<String> listDomains();

    /**
     * Removes {@code domain} from the registry, deleting the registry entry when it becomes empty.
     */
    void unregisterDomain(String domain);
}
