package tech.yump.envr.store.file;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes the {@code KEY=value} text of a .env file.
 *
 * <p>Parsing skips blank lines and {@code #} comments, accepts an optional {@code export} prefix,
 * splits on the first {@code =}, strips one pair of surrounding single or double quotes and drops
 * an inline {@code " #"} comment from unquoted values. Double-quoted values have {@code \\},
 * {@code \"} and {@code \n} unescaped.
 */
public final class EnvFile {

    private static final Pattern LINE = Pattern.compile("^\\s*(?:export\\s+)?([A-Za-z_]\\w*)\\s*=\\s*(.*)$");
    private static final Pattern NEEDS_QUOTES = Pattern.compile("[\\s=\"\\\\#']");

    private EnvFile() {
    }

    public static Map<String, String> parse(List<String> lines) {
        Map<String, String> result = new LinkedHashMap<>();
        for (String line : lines) {
            String stripped = line.strip();
            if (stripped.isEmpty() || stripped.startsWith("#")) {
                continue;
            }
            Matcher m = LINE.matcher(stripped);
            if (!m.matches()) {
                continue;
            }
            result.put(m.group(1), unquote(m.group(2).strip()));
        }
        return result;
    }

    public static Map<String, String> parse(String text) {
        return parse(text.lines().toList());
    }

    /**
     * Renders entries sorted by key, one {@code KEY=value} per line with a trailing newline.
     * An empty map renders as the empty string.
     */
    public static String format(Map<String, String> entries) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : new TreeMap<>(entries).entrySet()) {
            sb.append(entry.getKey()).append('=').append(formatValue(entry.getValue())).append('\n');
        }
        return sb.toString();
    }

    static String formatValue(String value) {
        if (value.isEmpty()) {
            return "\"\"";
        }
        if (!NEEDS_QUOTES.matcher(value).find()) {
            return value;
        }
        String escaped = value
                .replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\r", "")
                .replace("\n", "\\n");
        return '"' + escaped + '"';
    }

    static String unquote(String raw) {
        if (raw.length() >= 2) {
            char first = raw.charAt(0);
            char last = raw.charAt(raw.length() - 1);
            if (first == '"' && last == '"') {
                return unescape(raw.substring(1, raw.length() - 1));
            }
            if (first == '\'' && last == '\'') {
                return raw.substring(1, raw.length() - 1);
            }
        }
        int comment = raw.indexOf(" #");
        if (comment >= 0) {
            raw = raw.substring(0, comment).stripTrailing();
        }
        return raw;
    }

    private static String unescape(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length()) {
                char next = value.charAt(++i);
                switch (next) {
                    case 'n' -> sb.append('\n');
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    default -> sb.append(c).append(next);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
