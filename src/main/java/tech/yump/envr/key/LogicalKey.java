package tech.yump.envr.key;

import java.util.Objects;

/**
 * The backend-independent identity of one secret.
 */
public record LogicalKey(String name, String project, String domain, String version) {

    public static final String DEFAULT_VERSION = "1.0.0";

    public LogicalKey {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(project, "project");
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(version, "version");
    }

    public static LogicalKey of(String name, String project, String domain) {
        return new LogicalKey(name, project, domain, DEFAULT_VERSION);
    }
}
