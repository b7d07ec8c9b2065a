package tech.yump.envr.store.gcp;

import com.google.api.gax.rpc.NotFoundException;
import com.google.cloud.secretmanager.v1.AccessSecretVersionResponse;
import com.google.cloud.secretmanager.v1.ProjectName;
import com.google.cloud.secretmanager.v1.Replication;
import com.google.cloud.secretmanager.v1.Secret;
import com.google.cloud.secretmanager.v1.SecretManagerServiceClient;
import com.google.cloud.secretmanager.v1.SecretName;
import com.google.cloud.secretmanager.v1.SecretPayload;
import com.google.cloud.secretmanager.v1.SecretVersionName;
import com.google.protobuf.ByteString;
import lombok.extern.slf4j.Slf4j;
import tech.yump.envr.key.KeyGrammar;
import tech.yump.envr.key.StoreDescriptor;
import tech.yump.envr.store.KeyScope;
import tech.yump.envr.store.ScopedKeyResolver;
import tech.yump.envr.store.SecretStore;

import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Secrets as Google Cloud Secret Manager secrets, one secret per key.
 *
 * <p>Secret ids allow only {@code [A-Za-z0-9_-]}, so segments are joined with {@code --}, the
 * version uses {@code _} for dots, and any other disallowed character is replaced by {@code _}.
 * Writing adds a new secret version; reading accesses {@code latest}.
 */
@Slf4j
public class GcpSecretManagerStore implements SecretStore {

    public static final String NAME = "gcp";
    public static final StoreDescriptor DESCRIPTOR =
            new StoreDescriptor("--", "_", StoreDescriptor.DEFAULT_PREFIX, StoreDescriptor.DEFAULT_NAMESPACE);

    static final String LATEST = "latest";
    private static final Pattern INVALID_ID_CHARS = Pattern.compile("[^a-zA-Z0-9_-]");

    private final SecretManagerServiceClient client;
    private final String projectId;
    private final ScopedKeyResolver resolver;

    /**
     * @param listPrefix secret id prefix to list under; null for {@code envr--<domain>--<project>--}
     */
    public GcpSecretManagerStore(SecretManagerServiceClient client, String projectId, KeyScope scope, String listPrefix) {
        this.resolver = new ScopedKeyResolver(DESCRIPTOR, scope, toSecretId(listPrefix != null
                ? listPrefix
                : KeyGrammar.buildScopePrefix(scope.domain(), scope.project(), DESCRIPTOR)));
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("GCP project id cannot be null or empty.");
        }
        this.client = client;
        this.projectId = projectId;
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
    public Optional<String> get(String key) {
        String secretId = secretId(key);
        log.debug("Accessing GCP secret {} in project {}", secretId, projectId);
        try {
            AccessSecretVersionResponse response = client.accessSecretVersion(SecretVersionName.of(projectId, secretId, LATEST));
            return Optional.of(response.getPayload().getData().toStringUtf8());
        } catch (NotFoundException e) {
            log.debug("GCP secret {} not found", secretId);
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, String value) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null for set operation.");
        }
        String secretId = secretId(key);
        SecretName secretName = SecretName.of(projectId, secretId);
        try {
            client.getSecret(secretName);
        } catch (NotFoundException e) {
            log.debug("Creating GCP secret {} in project {}", secretId, projectId);
            Secret secret = Secret.newBuilder()
                    .setReplication(Replication.newBuilder()
                            .setAutomatic(Replication.Automatic.newBuilder().build())
                            .build())
                    .build();
            client.createSecret(ProjectName.of(projectId), secretId, secret);
        }
        SecretPayload payload = SecretPayload.newBuilder()
                .setData(ByteString.copyFromUtf8(value))
                .build();
        client.addSecretVersion(secretName, payload);
        log.info("Stored GCP secret {} in project {}", secretId, projectId);
    }

    @Override
    public void delete(String key) {
        String secretId = secretId(key);
        try {
            client.deleteSecret(SecretName.of(projectId, secretId));
            log.info("Deleted GCP secret {} in project {}", secretId, projectId);
        } catch (NotFoundException e) {
            log.debug("No GCP secret {} to delete", secretId);
        }
    }

    @Override
    public List<String> listKeys() {
        TreeSet<String> keys = new TreeSet<>();
        for (Secret secret : client.listSecrets(ProjectName.of(projectId)).iterateAll()) {
            // projects/<project>/secrets/<secret id>
            String name = secret.getName();
            String secretId = name.substring(name.lastIndexOf('/') + 1);
            if (resolver.inScope(secretId)) {
                keys.add(secretId);
            }
        }
        log.debug("Listed {} GCP secrets with prefix {}", keys.size(), resolver.getListPrefix());
        return List.copyOf(keys);
    }

    String secretId(String key) {
        return toSecretId(resolver.compositeKey(key));
    }

    static String toSecretId(String value) {
        return INVALID_ID_CHARS.matcher(value).replaceAll("_");
    }
}
