package tech.yump.envr.store;

import java.util.regex.Pattern;

/**
 * Strict semantic version validation: {@code MAJOR.MINOR.PATCH} with optional pre-release and
 * build metadata, no leading zeros in numeric identifiers.
 */
public final class SemanticVersions {

    private static final Pattern SEMVER = Pattern.compile(
            "^(0|[1-9]\\d*)\\.(0|[1-9]\\d*)\\.(0|[1-9]\\d*)"
                    + "(?:-((?:0|[1-9]\\d*|\\d*[a-zA-Z-][0-9a-zA-Z-]*)(?:\\.(?:0|[1-9]\\d*|\\d*[a-zA-Z-][0-9a-zA-Z-]*))*))?"
                    + "(?:\\+([0-9a-zA-Z-]+(?:\\.[0-9a-zA-Z-]+)*))?$");

    private SemanticVersions() {
    }

    public static boolean isValid(String version) {
        return version != null && SEMVER.matcher(version).matches();
    }

    /**
     * @throws InvalidVersionException if {@code version} is not strict semver
     */
    public static String requireValid(String version) {
        if (!isValid(version)) {
            throw new InvalidVersionException(version,
                    "Invalid version '" + version + "': expected MAJOR.MINOR.PATCH[-PRERELEASE][+BUILD].");
        }
        return version;
    }
}
