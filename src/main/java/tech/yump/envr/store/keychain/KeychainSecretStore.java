package tech.yump.envr.store.keychain;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import tech.yump.envr.key.CompositeKey;
import tech.yump.envr.key.KeyGrammar;
import tech.yump.envr.key.StoreDescriptor;
import tech.yump.envr.store.DomainTrackingStore;
import tech.yump.envr.store.KeyScope;
import tech.yump.envr.store.ScopedKeyResolver;

import java.util.List;
import java.util.Optional;

/**
 * Secrets in the OS credential manager, scoped by project and domain.
 *
 * <p>Entries live under the keychain service {@code envr:<project>}; the account of each secret
 * is {@code envr/<domain>/<project>/<name>}. The version is validated but not part of the account,
 * so one manifest per project and domain covers every secret the domain holds. The keychain cannot
 * enumerate, so two index entries are kept in the same service:
 * <ul>
 *   <li>the manifest, account {@code envr/<domain>/<project>/__keys__}: names set in this domain;</li>
 *   <li>the domain registry, account {@code envr/__domains__}: domains with a non-empty manifest.</li>
 * </ul>
 * Both are JSON arrays maintained incrementally by every mutation; {@link #listKeys()} never scans
 * the keychain.
 *
 * <p>A full composite key is accepted only when its domain, project and version are this store's
 * own; anything else is rejected rather than re-addressed.
 */
@Slf4j
public class KeychainSecretStore implements DomainTrackingStore {

    public static final String NAME = "local";
    public static final StoreDescriptor DESCRIPTOR = StoreDescriptor.PATH_STYLE;

    static final String SERVICE_PREFIX = "envr:";
    static final String MANIFEST_ENTRY = "__keys__";
    static final String REGISTRY_ENTRY = "__domains__";

    private final KeychainClient keychainClient;
    private final ScopedKeyResolver resolver;
    private final ManifestIndex index;
    private final String service;
    private final String domain;
    private final String project;
    private final String version;
    private final String manifestAccount;
    private final String registryAccount;

    public KeychainSecretStore(KeychainClient keychainClient, ObjectMapper objectMapper, KeyScope scope) {
        this.keychainClient = keychainClient;
        this.resolver = new ScopedKeyResolver(DESCRIPTOR, scope, null);
        this.service = SERVICE_PREFIX + scope.resolvedProject(DESCRIPTOR);
        this.domain = scope.resolvedDomain(DESCRIPTOR);
        this.project = scope.resolvedProject(DESCRIPTOR);
        this.version = scope.version();
        this.index = new ManifestIndex(keychainClient, objectMapper, service);
        this.manifestAccount = resolver.getListPrefix() + MANIFEST_ENTRY;
        this.registryAccount = DESCRIPTOR.prefix() + DESCRIPTOR.keySeparator() + REGISTRY_ENTRY;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StoreDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public Optional<String> get(String key) {
        return keychainClient.getPassword(service, account(nameOf(key)));
    }

    @Override
    public void set(String key, String value) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null for set operation.");
        }
        String name = nameOf(key);
        keychainClient.setPassword(service, account(name), value);
        index.add(manifestAccount, name);
        log.info("Stored keychain secret '{}' in service '{}', domain '{}'", name, service, domain);
    }

    @Override
    public void delete(String key) {
        String name = nameOf(key);
        boolean removed = keychainClient.deletePassword(service, account(name));
        if (index.read(manifestAccount).contains(name) && index.remove(manifestAccount, name).isEmpty()) {
            unregisterDomain(domain);
        }
        if (removed) {
            log.info("Deleted keychain secret '{}' in service '{}', domain '{}'", name, service, domain);
        } else {
            log.debug("No keychain secret '{}' to delete in service '{}', domain '{}'", name, service, domain);
        }
    }

    @Override
    public List<String> listKeys() {
        return index.read(manifestAccount);
    }

    @Override
    public void clear() {
        List<String> keys = index.read(manifestAccount);
        for (String name : keys) {
            keychainClient.deletePassword(service, account(name));
        }
        index.drop(manifestAccount);
        unregisterDomain(domain);
        log.info("Cleared {} keychain secrets in service '{}', domain '{}'", keys.size(), service, domain);
    }

    @Override
    public void setWithDomainTracking(String key, String value) {
        set(key, value);
        index.add(registryAccount, domain);
    }

    @Override
    public List<String> listDomains() {
        return index.read(registryAccount);
    }

    @Override
    public void unregisterDomain(String domainName) {
        index.remove(registryAccount, domainName);
    }

    // The manifest holds sanitized names; a composite key of this scope is reduced to its name.
    private String nameOf(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Key cannot be null or empty.");
        }
        Optional<CompositeKey> parsed = KeyGrammar.parseKey(key, DESCRIPTOR)
                .filter(composite -> DESCRIPTOR.prefix().equals(composite.prefix()));
        String name;
        if (parsed.isPresent()) {
            CompositeKey composite = parsed.get();
            if (!composite.domain().equals(domain)
                    || !composite.project().equals(project)
                    || !composite.version().equals(version)) {
                throw new IllegalArgumentException("Key '" + key + "' belongs to domain '" + composite.domain()
                        + "', project '" + composite.project() + "', version '" + composite.version()
                        + "', not to this store's domain '" + domain + "', project '" + project
                        + "', version '" + version + "'.");
            }
            name = composite.name();
        } else {
            name = KeyGrammar.sanitizeSegment(key, DESCRIPTOR);
        }
        if (MANIFEST_ENTRY.equals(name)) {
            throw new IllegalArgumentException("'" + MANIFEST_ENTRY + "' is reserved for the key manifest.");
        }
        return name;
    }

    private String account(String name) {
        return resolver.getListPrefix() + name;
    }
}
