package tech.yump.envr.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import tech.yump.envr.config.EnvrProperties;
import tech.yump.envr.key.StoreDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Opens the adapter for a named service, filling blank arguments from configuration.
 */
@Slf4j
@Service
public class SecretStoreFactory {

    private final Map<String, StoreProvider> providers;
    private final EnvrProperties properties;

    public SecretStoreFactory(List<StoreProvider> providers, EnvrProperties properties) {
        Map<String, StoreProvider> byName = new TreeMap<>();
        for (StoreProvider provider : providers) {
            StoreProvider previous = byName.put(provider.name(), provider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate store provider name: " + provider.name());
            }
        }
        this.providers = Collections.unmodifiableMap(byName);
        this.properties = properties;
        log.info("SecretStoreFactory initialized with stores: {}", this.providers.keySet());
    }

    /**
     * Opens an adapter.
     *
     * @param service store id; blank for the configured default service
     * @param project blank for the configured default project, then the store's default namespace
     * @param domain  blank for the store's default namespace
     * @param version blank for the configured default version
     * @param prefix  explicit list prefix; blank to use the domain's configured prefix, then the store default
     * @param env     value for {env} in a configured domain prefix
     * @throws UnknownStoreException   if no provider is registered under {@code service}
     * @throws InvalidVersionException if {@code version} is not strict semver
     */
    public SecretStore open(String service, String project, String domain, String version, String prefix, String env) {
        StoreProvider provider = provider(StringUtils.hasText(service) ? service : properties.service());
        StoreDescriptor descriptor = provider.descriptor();

        String resolvedProject = firstText(project, properties.project(), descriptor.defaultNamespace());
        String resolvedDomain = firstText(domain, descriptor.defaultNamespace());
        String resolvedVersion = firstText(version, properties.version());
        KeyScope scope = new KeyScope(resolvedProject, resolvedDomain, resolvedVersion);

        String resolvedPrefix = StringUtils.hasText(prefix)
                ? prefix
                : properties.resolveDomainPrefix(resolvedDomain, env)
                        .orElseGet(() -> provider.buildDefaultPrefix(resolvedDomain, resolvedProject));
        String path = null;
        EnvrProperties.DomainProperties domainProperties = properties.domains().get(resolvedDomain);
        if (domainProperties != null && StringUtils.hasText(domainProperties.envFile())) {
            path = domainProperties.envFile();
        }

        log.debug("Opening store '{}' for project '{}', domain '{}', version '{}', prefix '{}'",
                provider.name(), resolvedProject, resolvedDomain, resolvedVersion, resolvedPrefix);
        return provider.create(new StoreRequest(scope, resolvedPrefix, path));
    }

    public SecretStore open(String service, String project, String domain) {
        return open(service, project, domain, null, null, null);
    }

    public StoreProvider provider(String service) {
        StoreProvider provider = providers.get(service);
        if (provider == null) {
            log.warn("Requested unknown store '{}'", service);
            throw new UnknownStoreException(service, providers.keySet());
        }
        return provider;
    }

    public List<StoreProvider> describe() {
        return new ArrayList<>(providers.values());
    }

    private static String firstText(String... candidates) {
        for (String candidate : candidates) {
            if (StringUtils.hasText(candidate)) {
                return candidate;
            }
        }
        return null;
    }
}
