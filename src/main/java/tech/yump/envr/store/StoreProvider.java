package tech.yump.envr.store;

import tech.yump.envr.key.KeyGrammar;
import tech.yump.envr.key.StoreDescriptor;

/**
 * Creates adapters for one backend. One Spring bean per backend; {@link SecretStoreFactory}
 * selects among them by {@link #name()}.
 *
 * <p>Two customization points stay separate: {@link #buildDefaultPrefix} controls addressing,
 * {@link #create} resolves connection settings from configuration.
 */
public interface StoreProvider {

    String name();

    String displayName();

    StoreDescriptor descriptor();

    /**
     * Builds the list filter used when the caller supplies no explicit prefix.
     * Defaults to {@code prefix sep domain sep project sep} under this provider's descriptor.
     */
    default String buildDefaultPrefix(String domain, String project) {
        return KeyGrammar.buildScopePrefix(domain, project, descriptor());
    }

    /**
     * Opens an adapter. Validation of the request's version has already happened when its
     * {@link KeyScope} was built; backend clients are resolved here.
     *
     * @throws BackendUnavailableException if the backend is not configured.
     */
    SecretStore create(StoreRequest request);
}
