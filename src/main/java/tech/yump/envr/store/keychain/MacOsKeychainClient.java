package tech.yump.envr.store.keychain;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tech.yump.envr.process.CommandResult;
import tech.yump.envr.process.CommandRunner;
import tech.yump.envr.store.BackendUnavailableException;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * macOS login keychain through the {@code security} command-line tool (generic passwords).
 *
 * <p>Passwords never appear on a command line: writes go through {@code security -i} on stdin with
 * the value hex-encoded ({@code -X}), and reads parse the {@code password:} line that {@code -g}
 * prints, which is hex ({@code 0x...}) whenever the value is not plain printable text.
 */
@Slf4j
@RequiredArgsConstructor
public class MacOsKeychainClient implements KeychainClient {

    static final String SECURITY = "security";
    // errSecItemNotFound
    static final int ITEM_NOT_FOUND = 44;

    private static final Pattern PASSWORD_LINE = Pattern.compile("(?m)^password: ?(.*)$");
    private static final Pattern HEX_PASSWORD = Pattern.compile("^0x([0-9A-Fa-f]*)\\b.*$");

    private final CommandRunner commandRunner;

    @Override
    public Optional<String> getPassword(String service, String account) {
        CommandResult result = commandRunner.run(List.of(
                SECURITY, "find-generic-password", "-s", service, "-a", account, "-g"));
        if (result.exitCode() == ITEM_NOT_FOUND) {
            log.debug("No keychain entry for service '{}', account '{}'", service, account);
            return Optional.empty();
        }
        requireSuccess(result, "read", account);
        return Optional.of(parsePassword(result.stderr(), account));
    }

    @Override
    public void setPassword(String service, String account, String password) {
        // -U updates the entry in place when it already exists
        String command = "add-generic-password -U -s " + quote(service) + " -a " + quote(account)
                + " -X " + HexFormat.of().formatHex(password.getBytes(StandardCharsets.UTF_8)) + "\n";
        CommandResult result = commandRunner.run(List.of(SECURITY, "-i"), command);
        // security -i reports a failed command on stderr and may still exit 0
        if (!result.isSuccess() || !result.stderr().isBlank()) {
            log.error("Keychain write failed for account '{}' (exit {}): {}", account, result.exitCode(), result.stderr().trim());
            throw new BackendUnavailableException("Keychain write failed for account '" + account
                    + "' (exit " + result.exitCode() + "): " + result.stderr().trim());
        }
    }

    @Override
    public boolean deletePassword(String service, String account) {
        CommandResult result = commandRunner.run(List.of(
                SECURITY, "delete-generic-password", "-s", service, "-a", account));
        if (result.exitCode() == ITEM_NOT_FOUND) {
            return false;
        }
        requireSuccess(result, "delete", account);
        return true;
    }

    /**
     * Extracts the value from {@code find-generic-password -g} output: {@code password: "text"} for
     * printable values, {@code password: 0x<hex>  "<escaped>"} otherwise, {@code password: } when empty.
     */
    static String parsePassword(String output, String account) {
        Matcher line = PASSWORD_LINE.matcher(output);
        if (!line.find()) {
            throw new BackendUnavailableException("Keychain read for account '" + account
                    + "' returned no password line.");
        }
        String raw = line.group(1).strip();
        Matcher hex = HEX_PASSWORD.matcher(raw);
        if (hex.matches()) {
            return new String(HexFormat.of().parseHex(hex.group(1)), StandardCharsets.UTF_8);
        }
        if (raw.length() >= 2 && raw.startsWith("\"") && raw.endsWith("\"")) {
            return raw.substring(1, raw.length() - 1);
        }
        return raw;
    }

    // Argument quoting of the security -i command parser.
    static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static void requireSuccess(CommandResult result, String action, String account) {
        if (!result.isSuccess()) {
            log.error("Keychain {} failed for account '{}' (exit {}): {}", action, account, result.exitCode(), result.stderr().trim());
            throw new BackendUnavailableException("Keychain " + action + " failed for account '" + account
                    + "' (exit " + result.exitCode() + "): " + result.stderr().trim());
        }
    }
}
