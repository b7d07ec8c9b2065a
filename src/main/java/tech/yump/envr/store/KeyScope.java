package tech.yump.envr.store;

import tech.yump.envr.key.KeyGrammar;
import tech.yump.envr.key.LogicalKey;
import tech.yump.envr.key.StoreDescriptor;

/**
 * The project, domain and version an adapter instance is bound to.
 *
 * <p>Construction validates the version, so an adapter built from a scope never produces a
 * malformed key.
 */
public record KeyScope(String project, String domain, String version) {

    public KeyScope {
        SemanticVersions.requireValid(version);
        project = project == null ? "" : project;
        domain = domain == null ? "" : domain;
    }

    public static KeyScope of(String project, String domain) {
        return new KeyScope(project, domain, LogicalKey.DEFAULT_VERSION);
    }

    /**
     * Checks that the backend form of the version is a single segment under {@code descriptor}.
     *
     * @throws InvalidVersionException if the formatted version contains the key separator
     */
    public KeyScope requireCompatible(StoreDescriptor descriptor) {
        String formatted = KeyGrammar.formatVersion(version, descriptor);
        if (formatted.contains(descriptor.keySeparator())) {
            throw new InvalidVersionException(version, "Version '" + version + "' would contain the key separator '"
                    + descriptor.keySeparator() + "' once formatted as '" + formatted + "'.");
        }
        return this;
    }

    public String resolvedProject(StoreDescriptor descriptor) {
        return KeyGrammar.sanitizeSegment(project, descriptor);
    }

    public String resolvedDomain(StoreDescriptor descriptor) {
        return KeyGrammar.sanitizeSegment(domain, descriptor);
    }

    public LogicalKey keyFor(String name) {
        return new LogicalKey(name, project, domain, version);
    }
}
