package tech.yump.envr.key;

/**
 * The five segments recovered from a physical composite key by {@link KeyGrammar#parseKey}.
 * The version has its dots restored.
 */
public record CompositeKey(String prefix, String domain, String project, String version, String name) {

    public LogicalKey toLogicalKey() {
        return new LogicalKey(name, project, domain, version);
    }
}
