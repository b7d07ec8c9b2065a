package tech.yump.envr.store.github;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import tech.yump.envr.key.StoreDescriptor;
import tech.yump.envr.process.CommandResult;
import tech.yump.envr.process.CommandRunner;
import tech.yump.envr.store.BackendUnavailableException;
import tech.yump.envr.store.KeyScope;
import tech.yump.envr.store.ScopedKeyResolver;
import tech.yump.envr.store.SecretStore;
import tech.yump.envr.store.SecretStoreException;
import tech.yump.envr.store.WriteOnlyStoreException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Pushes secrets to GitHub Actions repository secrets through the {@code gh} CLI.
 *
 * <p>GitHub never returns secret values, so this store is write-only: {@link #get} always throws
 * {@link WriteOnlyStoreException}. Secret names allow only {@code [A-Za-z0-9_]} and GitHub
 * upper-cases them; the composite key is sanitized and upper-cased accordingly. Values reach
 * {@code gh} on stdin, never on the command line. Only gh's HTTP 404 counts as "not found"; every
 * other failure is raised, as {@link BackendUnavailableException} when gh is not authenticated.
 */
@Slf4j
public class GitHubSecretsStore implements SecretStore {

    public static final String NAME = "github";
    public static final StoreDescriptor DESCRIPTOR =
            new StoreDescriptor("__", "_", "ENVR", StoreDescriptor.DEFAULT_NAMESPACE);

    static final String GH = "gh";
    // gh exits with 4 when it needs "gh auth login"
    static final int AUTH_REQUIRED = 4;
    private static final Pattern INVALID_NAME_CHARS = Pattern.compile("[^a-zA-Z0-9_]");

    private final CommandRunner commandRunner;
    private final ObjectMapper objectMapper;
    private final ScopedKeyResolver resolver;
    private final String repo;
    private final String nameFilter;

    /**
     * @param repo       {@code owner/name}; null for the repository of the working directory
     * @param listPrefix secret name prefix to list under; null for {@code ENVR__<domain>__<project>__}
     */
    public GitHubSecretsStore(CommandRunner commandRunner, ObjectMapper objectMapper, String repo,
                              KeyScope scope, String listPrefix) {
        this.resolver = new ScopedKeyResolver(DESCRIPTOR, scope, listPrefix);
        this.commandRunner = commandRunner;
        this.objectMapper = objectMapper;
        this.repo = repo;
        this.nameFilter = toSecretName(resolver.getListPrefix());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StoreDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public boolean isReadable() {
        return false;
    }

    @Override
    public Optional<String> get(String key) {
        throw new WriteOnlyStoreException(NAME);
    }

    @Override
    public void set(String key, String value) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null for set operation.");
        }
        String secretName = secretName(key);
        CommandResult result = commandRunner.run(gh("set", secretName), value);
        if (!result.isSuccess()) {
            throw failure("set", secretName, result);
        }
        log.info("Stored GitHub secret {}", secretName);
    }

    @Override
    public void delete(String key) {
        String secretName = secretName(key);
        CommandResult result = commandRunner.run(gh("delete", secretName));
        if (result.isSuccess()) {
            log.info("Deleted GitHub secret {}", secretName);
        } else if (isNotFound(result)) {
            log.debug("No GitHub secret {} to delete", secretName);
        } else {
            throw failure("delete", secretName, result);
        }
    }

    @Override
    public List<String> listKeys() {
        CommandResult result = commandRunner.run(gh("list", "--json", "name"));
        if (!result.isSuccess()) {
            throw failure("list", nameFilter + "*", result);
        }
        TreeSet<String> names = new TreeSet<>();
        try {
            for (JsonNode secret : objectMapper.readTree(result.stdout())) {
                String secretName = secret.path("name").asText("");
                if (secretName.startsWith(nameFilter)) {
                    names.add(secretName);
                }
            }
        } catch (JsonProcessingException e) {
            log.error("Unreadable output from gh secret list: {}", e.getOriginalMessage());
            throw new SecretStoreException("Unreadable output from gh secret list: " + e.getOriginalMessage(), e);
        }
        return List.copyOf(names);
    }

    /**
     * Keys already in GitHub form (starting with {@code ENVR__}) are used as is: the default
     * namespace {@code _default_} next to a {@code __} separator makes such names ambiguous to split.
     */
    String secretName(String key) {
        if (StringUtils.hasText(key) && key.startsWith(DESCRIPTOR.prefix() + DESCRIPTOR.keySeparator())) {
            return toSecretName(key);
        }
        return toSecretName(resolver.compositeKey(key));
    }

    static String toSecretName(String value) {
        return INVALID_NAME_CHARS.matcher(value).replaceAll("_").toUpperCase(Locale.ROOT);
    }

    static boolean isNotFound(CommandResult result) {
        return result.stderr().contains("HTTP 404");
    }

    private static SecretStoreException failure(String action, String secretName, CommandResult result) {
        String detail = result.stderr().strip();
        log.error("gh secret {} {} failed with exit code {}: {}", action, secretName, result.exitCode(), detail);
        String message = "Failed to " + action + " GitHub secret " + secretName + ": " + detail;
        if (result.exitCode() == AUTH_REQUIRED) {
            return new BackendUnavailableException(message);
        }
        return new SecretStoreException(message);
    }

    private List<String> gh(String... args) {
        List<String> command = new ArrayList<>();
        command.add(GH);
        command.add("secret");
        command.addAll(List.of(args));
        if (StringUtils.hasText(repo)) {
            command.add("--repo");
            command.add(repo);
        }
        return command;
    }
}
