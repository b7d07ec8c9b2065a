package tech.yump.envr.store;

import lombok.Getter;
import tech.yump.envr.key.KeyGrammar;
import tech.yump.envr.key.StoreDescriptor;

/**
 * Maps the keys callers hand to an adapter onto composite keys of the adapter's scope.
 *
 * <p>A key that already parses as a composite key is used as is; anything else is treated as a bare
 * secret name and built into a composite key with the scope's project, domain and version.
 */
@Getter
public class ScopedKeyResolver {

    private final StoreDescriptor descriptor;
    private final KeyScope scope;
    private final String listPrefix;

    /**
     * @param listPrefix filter applied by {@link #inScope}; null means the scope's default prefix.
     */
    public ScopedKeyResolver(StoreDescriptor descriptor, KeyScope scope, String listPrefix) {
        this.descriptor = descriptor;
        this.scope = scope.requireCompatible(descriptor);
        this.listPrefix = listPrefix != null
                ? listPrefix
                : KeyGrammar.buildScopePrefix(scope.domain(), scope.project(), descriptor);
    }

    public String compositeKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Key cannot be null or empty.");
        }
        if (KeyGrammar.parseKey(key, descriptor).isPresent()) {
            return key;
        }
        return KeyGrammar.buildKey(scope.keyFor(key), descriptor);
    }

    public boolean inScope(String compositeKey) {
        return compositeKey.startsWith(listPrefix);
    }

    public String exportName(String key) {
        return KeyGrammar.keyToExportName(key, descriptor);
    }
}
