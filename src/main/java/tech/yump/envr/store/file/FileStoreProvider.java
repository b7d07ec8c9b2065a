package tech.yump.envr.store.file;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tech.yump.envr.config.EnvrProperties;
import tech.yump.envr.key.StoreDescriptor;
import tech.yump.envr.store.SecretStore;
import tech.yump.envr.store.StoreProvider;
import tech.yump.envr.store.StoreRequest;

import java.nio.file.Paths;

@Component
@RequiredArgsConstructor
public class FileStoreProvider implements StoreProvider {

    private final EnvrProperties properties;

    @Override
    public String name() {
        return FileSecretStore.NAME;
    }

    @Override
    public String displayName() {
        return "Plain .env file";
    }

    @Override
    public StoreDescriptor descriptor() {
        return FileSecretStore.DESCRIPTOR;
    }

    @Override
    public SecretStore create(StoreRequest request) {
        String path = StringUtils.hasText(request.path()) ? request.path() : properties.file().path();
        return new FileSecretStore(Paths.get(path));
    }
}
