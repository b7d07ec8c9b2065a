package tech.yump.envr.key;

/**
 * Per-backend parameters of the composite key grammar.
 *
 * <p>The algorithm in {@link KeyGrammar} is the same for every backend; only these four values
 * change. Examples: AWS parameter paths join segments with {@code /}, GCP and Azure secret names
 * forbid {@code /} and use {@code --}, GitHub secret names forbid dots and use {@code __} with
 * {@code _} inside the version.
 *
 * @param keySeparator     joins the path segments of a composite key
 * @param versionSeparator replaces {@code .} inside the version segment
 * @param prefix           fixed leading segment marking keys owned by this tool
 * @param defaultNamespace substituted for a blank project or domain
 */
public record StoreDescriptor(
        String keySeparator,
        String versionSeparator,
        String prefix,
        String defaultNamespace
) {

    public static final String DEFAULT_PREFIX = "envr";
    public static final String DEFAULT_NAMESPACE = "_default_";

    /** Path style descriptor shared by the keychain, file, AWS SSM and Vault backends. */
    public static final StoreDescriptor PATH_STYLE = new StoreDescriptor("/", ".", DEFAULT_PREFIX, DEFAULT_NAMESPACE);

    public StoreDescriptor {
        if (keySeparator == null || keySeparator.isEmpty()) {
            throw new IllegalArgumentException("Key separator cannot be null or empty.");
        }
        if (versionSeparator == null || versionSeparator.isEmpty()) {
            throw new IllegalArgumentException("Version separator cannot be null or empty.");
        }
        if (prefix == null || prefix.isBlank() || prefix.contains(keySeparator)) {
            throw new IllegalArgumentException("Prefix must be non-blank and must not contain the key separator: " + prefix);
        }
        if (defaultNamespace == null || defaultNamespace.isBlank() || defaultNamespace.contains(keySeparator)) {
            throw new IllegalArgumentException("Default namespace must be non-blank and must not contain the key separator: " + defaultNamespace);
        }
    }
}
