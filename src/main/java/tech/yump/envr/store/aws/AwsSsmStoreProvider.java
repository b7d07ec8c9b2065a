package tech.yump.envr.store.aws;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.ssm.SsmClient;
import tech.yump.envr.config.EnvrProperties;
import tech.yump.envr.key.StoreDescriptor;
import tech.yump.envr.store.BackendUnavailableException;
import tech.yump.envr.store.SecretStore;
import tech.yump.envr.store.StoreProvider;
import tech.yump.envr.store.StoreRequest;

@Component
@RequiredArgsConstructor
public class AwsSsmStoreProvider implements StoreProvider {

    private final ObjectProvider<SsmClient> ssmClient;
    private final EnvrProperties properties;

    @Override
    public String name() {
        return AwsSsmSecretStore.NAME;
    }

    @Override
    public String displayName() {
        return "AWS SSM Parameter Store";
    }

    @Override
    public StoreDescriptor descriptor() {
        return AwsSsmSecretStore.DESCRIPTOR;
    }

    @Override
    public SecretStore create(StoreRequest request) {
        SsmClient client = ssmClient.getIfAvailable();
        if (client == null) {
            throw new BackendUnavailableException("AWS SSM store is not enabled. Set envr.aws.enabled=true.");
        }
        return new AwsSsmSecretStore(client, request.scope(), request.prefix(), properties.aws().secure());
    }
}
