package tech.yump.envr.store.gcp;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import tech.yump.envr.config.EnvrProperties;
import tech.yump.envr.key.StoreDescriptor;
import tech.yump.envr.store.BackendUnavailableException;
import tech.yump.envr.store.SecretStore;
import tech.yump.envr.store.StoreProvider;
import tech.yump.envr.store.StoreRequest;
import com.google.cloud.secretmanager.v1.SecretManagerServiceClient;

@Component
@RequiredArgsConstructor
public class GcpStoreProvider implements StoreProvider {

    private final ObjectProvider<SecretManagerServiceClient> secretManagerClient;
    private final EnvrProperties properties;

    @Override
    public String name() {
        return GcpSecretManagerStore.NAME;
    }

    @Override
    public String displayName() {
        return "Google Cloud Secret Manager";
    }

    @Override
    public StoreDescriptor descriptor() {
        return GcpSecretManagerStore.DESCRIPTOR;
    }

    @Override
    public String buildDefaultPrefix(String domain, String project) {
        return GcpSecretManagerStore.toSecretId(StoreProvider.super.buildDefaultPrefix(domain, project));
    }

    @Override
    public SecretStore create(StoreRequest request) {
        SecretManagerServiceClient client = secretManagerClient.getIfAvailable();
        if (client == null) {
            throw new BackendUnavailableException("GCP Secret Manager store is not enabled. Set envr.gcp.enabled=true and envr.gcp.project-id.");
        }
        return new GcpSecretManagerStore(client, properties.gcp().projectId(), request.scope(), request.prefix());
    }
}
