package tech.yump.envr.key;

import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Encodes a {@link LogicalKey} into a single backend-safe string and decodes it back.
 *
 * <p>Composite key layout, with {@code sep} the descriptor's key separator:
 * <pre>
 *   prefix sep domain sep project sep version' sep name
 * </pre>
 * where {@code version'} has every {@code .} replaced by the descriptor's version separator.
 * Domain and project come first so that keys of one domain+project pair sort next to each other
 * in backends that list lexicographically.
 *
 * <p>All methods are pure and thread-safe.
 */
public final class KeyGrammar {

    static final int SEGMENT_COUNT = 5;
    private static final String REPLACEMENT = "_";

    private KeyGrammar() {
    }

    /**
     * Makes a free-form value safe to use as one segment of a composite key.
     *
     * <p>Blank values become the descriptor's default namespace. Otherwise every backslash and every
     * occurrence of the key separator is replaced by {@code _} and the result is trimmed. The
     * separator replacement is repeated until none is left, because for separators such as
     * {@code __} the replacement itself can form a new occurrence.
     *
     * @return a non-blank segment that never contains the key separator
     */
    public static String sanitizeSegment(String value, StoreDescriptor descriptor) {
        if (value == null || value.isBlank()) {
            return descriptor.defaultNamespace();
        }
        String separator = descriptor.keySeparator();
        String sanitized = value.replace("\\", REPLACEMENT);
        while (sanitized.contains(separator)) {
            sanitized = sanitized.replace(separator, REPLACEMENT);
        }
        sanitized = sanitized.trim();
        return sanitized.isEmpty() ? descriptor.defaultNamespace() : sanitized;
    }

    /**
     * Builds the physical composite key for one secret.
     */
    public static String buildKey(String name, String project, String domain, String version, StoreDescriptor descriptor) {
        String sep = descriptor.keySeparator();
        return descriptor.prefix()
                + sep + sanitizeSegment(domain, descriptor)
                + sep + sanitizeSegment(project, descriptor)
                + sep + formatVersion(version, descriptor)
                + sep + sanitizeSegment(name, descriptor);
    }

    public static String buildKey(LogicalKey key, StoreDescriptor descriptor) {
        return buildKey(key.name(), key.project(), key.domain(), key.version(), descriptor);
    }

    /**
     * Best-effort inverse of {@link #buildKey}.
     *
     * <p>One leading and one trailing key separator are stripped first. When the key has more than
     * five segments, the last five are used, so keys nested under extra structural path segments
     * still parse. Segments that were sanitized on the way in are returned in sanitized form.
     *
     * @return the parsed segments, or empty when the key has fewer than five segments
     */
    public static Optional<CompositeKey> parseKey(String key, StoreDescriptor descriptor) {
        if (key == null) {
            return Optional.empty();
        }
        String sep = descriptor.keySeparator();
        String body = key;
        if (body.startsWith(sep)) {
            body = body.substring(sep.length());
        }
        if (body.endsWith(sep)) {
            body = body.substring(0, body.length() - sep.length());
        }
        String[] parts = splitLiteral(body, sep);
        if (parts.length < SEGMENT_COUNT) {
            return Optional.empty();
        }
        String[] last = Arrays.copyOfRange(parts, parts.length - SEGMENT_COUNT, parts.length);
        String version = last[3].replace(descriptor.versionSeparator(), ".");
        return Optional.of(new CompositeKey(last[0], last[1], last[2], version, last[4]));
    }

    /**
     * Returns the flat, unscoped name used when a composite key is shown to a human or written to a
     * key-value file: the parsed name when the key parses, else the text after the last separator,
     * else the whole key.
     */
    public static String keyToExportName(String key, StoreDescriptor descriptor) {
        Optional<CompositeKey> parsed = parseKey(key, descriptor);
        if (parsed.isPresent()) {
            return parsed.get().name();
        }
        String sep = descriptor.keySeparator();
        int index = key.lastIndexOf(sep);
        return index < 0 ? key : key.substring(index + sep.length());
    }

    /**
     * Builds the scope prefix {@code prefix sep domain sep project sep}. It is a list filter, not a
     * composite key.
     */
    public static String buildScopePrefix(String domain, String project, StoreDescriptor descriptor) {
        String sep = descriptor.keySeparator();
        return descriptor.prefix()
                + sep + sanitizeSegment(domain, descriptor)
                + sep + sanitizeSegment(project, descriptor)
                + sep;
    }

    /**
     * Replaces the dots of a version with the descriptor's version separator.
     */
    public static String formatVersion(String version, StoreDescriptor descriptor) {
        return version.replace(".", descriptor.versionSeparator());
    }

    // String.split takes a regex; separators are literal text.
    private static String[] splitLiteral(String value, String separator) {
        return value.split(Pattern.quote(separator), -1);
    }
}
