package tech.yump.envr.store.github;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tech.yump.envr.config.EnvrProperties;
import tech.yump.envr.key.StoreDescriptor;
import tech.yump.envr.process.CommandRunner;
import tech.yump.envr.store.SecretStore;
import tech.yump.envr.store.StoreProvider;
import tech.yump.envr.store.StoreRequest;

@Component
@RequiredArgsConstructor
public class GitHubStoreProvider implements StoreProvider {

    private final CommandRunner commandRunner;
    private final ObjectMapper objectMapper;
    private final EnvrProperties properties;

    @Override
    public String name() {
        return GitHubSecretsStore.NAME;
    }

    @Override
    public String displayName() {
        return "GitHub Actions secrets (write-only)";
    }

    @Override
    public StoreDescriptor descriptor() {
        return GitHubSecretsStore.DESCRIPTOR;
    }

    /**
     * The configured {@code envr.github.prefix} when set, else {@code ENVR__<domain>__<project>__}
     * in GitHub's character set.
     */
    @Override
    public String buildDefaultPrefix(String domain, String project) {
        String configured = properties.github().prefix();
        if (StringUtils.hasText(configured)) {
            return configured;
        }
        return GitHubSecretsStore.toSecretName(StoreProvider.super.buildDefaultPrefix(domain, project));
    }

    @Override
    public SecretStore create(StoreRequest request) {
        return new GitHubSecretsStore(commandRunner, objectMapper, properties.github().repo(),
                request.scope(), request.prefix());
    }
}
