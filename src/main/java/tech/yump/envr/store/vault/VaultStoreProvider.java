package tech.yump.envr.store.vault;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import tech.yump.envr.config.EnvrProperties;
import tech.yump.envr.key.StoreDescriptor;
import tech.yump.envr.store.SecretStore;
import tech.yump.envr.store.StoreProvider;
import tech.yump.envr.store.StoreRequest;

@Component
@RequiredArgsConstructor
public class VaultStoreProvider implements StoreProvider {

    private final RestTemplate restTemplate;
    private final EnvrProperties properties;

    @Override
    public String name() {
        return VaultKvStore.NAME;
    }

    @Override
    public String displayName() {
        return "HashiCorp Vault KV v2";
    }

    @Override
    public StoreDescriptor descriptor() {
        return VaultKvStore.DESCRIPTOR;
    }

    @Override
    public SecretStore create(StoreRequest request) {
        EnvrProperties.VaultProperties vault = properties.vault();
        return new VaultKvStore(restTemplate, vault.url(), vault.token(), vault.mount(),
                request.scope(), request.prefix());
    }
}
