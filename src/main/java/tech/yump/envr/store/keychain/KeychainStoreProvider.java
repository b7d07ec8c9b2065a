package tech.yump.envr.store.keychain;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import tech.yump.envr.key.StoreDescriptor;
import tech.yump.envr.store.SecretStore;
import tech.yump.envr.store.StoreProvider;
import tech.yump.envr.store.StoreRequest;

@Component
@RequiredArgsConstructor
public class KeychainStoreProvider implements StoreProvider {

    private final KeychainClient keychainClient;
    private final ObjectMapper objectMapper;

    @Override
    public String name() {
        return KeychainSecretStore.NAME;
    }

    @Override
    public String displayName() {
        return "OS credential manager";
    }

    @Override
    public StoreDescriptor descriptor() {
        return KeychainSecretStore.DESCRIPTOR;
    }

    @Override
    public SecretStore create(StoreRequest request) {
        return new KeychainSecretStore(keychainClient, objectMapper, request.scope());
    }
}
