package tech.yump.envr.store.keychain;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tech.yump.envr.process.CommandResult;
import tech.yump.envr.process.CommandRunner;
import tech.yump.envr.store.BackendUnavailableException;

import java.util.List;
import java.util.Optional;

/**
 * Linux Secret Service (GNOME Keyring, KWallet) through the {@code secret-tool} command-line tool.
 * Entries carry two attributes, {@code service} and {@code account}; the password travels on stdin.
 */
@Slf4j
@RequiredArgsConstructor
public class SecretToolKeychainClient implements KeychainClient {

    static final String SECRET_TOOL = "secret-tool";

    private final CommandRunner commandRunner;

    @Override
    public Optional<String> getPassword(String service, String account) {
        CommandResult result = commandRunner.run(List.of(
                SECRET_TOOL, "lookup", "service", service, "account", account));
        // lookup exits 1 with no output when nothing matches
        if (!result.isSuccess() && result.stdout().isEmpty() && result.stderr().isBlank()) {
            log.debug("No secret-tool entry for service '{}', account '{}'", service, account);
            return Optional.empty();
        }
        requireSuccess(result, "read", account);
        return Optional.of(result.stdout());
    }

    @Override
    public void setPassword(String service, String account, String password) {
        CommandResult result = commandRunner.run(List.of(
                SECRET_TOOL, "store", "--label=" + service + " " + account,
                "service", service, "account", account), password);
        requireSuccess(result, "write", account);
    }

    @Override
    public boolean deletePassword(String service, String account) {
        if (getPassword(service, account).isEmpty()) {
            return false;
        }
        CommandResult result = commandRunner.run(List.of(
                SECRET_TOOL, "clear", "service", service, "account", account));
        requireSuccess(result, "delete", account);
        return true;
    }

    private static void requireSuccess(CommandResult result, String action, String account) {
        if (!result.isSuccess()) {
            log.error("secret-tool {} failed for account '{}' (exit {}): {}", action, account, result.exitCode(), result.stderr().trim());
            throw new BackendUnavailableException("secret-tool " + action + " failed for account '" + account
                    + "' (exit " + result.exitCode() + "): " + result.stderr().trim());
        }
    }
}
