package tech.yump.envr.store.azure;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import tech.yump.envr.config.EnvrProperties;
import tech.yump.envr.key.StoreDescriptor;
import tech.yump.envr.store.BackendUnavailableException;
import tech.yump.envr.store.SecretStore;
import tech.yump.envr.store.StoreProvider;
import tech.yump.envr.store.StoreRequest;

@Component
@RequiredArgsConstructor
public class AzureStoreProvider implements StoreProvider {

    private final RestTemplate restTemplate;
    private final EnvrProperties properties;

    @Override
    public String name() {
        return AzureKeyVaultStore.NAME;
    }

    @Override
    public String displayName() {
        return "Azure Key Vault";
    }

    @Override
    public StoreDescriptor descriptor() {
        return AzureKeyVaultStore.DESCRIPTOR;
    }

    @Override
    public String buildDefaultPrefix(String domain, String project) {
        return AzureKeyVaultStore.defaultPrefix(domain, project);
    }

    @Override
    public SecretStore create(StoreRequest request) {
        EnvrProperties.AzureProperties azure = properties.azure();
        if (!azure.isConfigured()) {
            throw new BackendUnavailableException("Azure Key Vault store is not configured. Set envr.azure.vault-url.");
        }
        return new AzureKeyVaultStore(restTemplate, azure.vaultUrl(), azure.accessToken(), azure.apiVersion(),
                request.scope(), request.prefix());
    }
}
