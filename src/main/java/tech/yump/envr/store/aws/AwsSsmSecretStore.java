package tech.yump.envr.store.aws;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.DeleteParameterRequest;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;
import software.amazon.awssdk.services.ssm.model.GetParametersByPathRequest;
import software.amazon.awssdk.services.ssm.model.GetParametersByPathResponse;
import software.amazon.awssdk.services.ssm.model.Parameter;
import software.amazon.awssdk.services.ssm.model.ParameterNotFoundException;
import software.amazon.awssdk.services.ssm.model.ParameterType;
import software.amazon.awssdk.services.ssm.model.PutParameterRequest;
import tech.yump.envr.key.StoreDescriptor;
import tech.yump.envr.store.KeyScope;
import tech.yump.envr.store.ScopedKeyResolver;
import tech.yump.envr.store.SecretStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Secrets as AWS Systems Manager parameters.
 *
 * <p>The parameter name is the composite key with a leading {@code /}, e.g.
 * {@code /envr/prod/billing/1.0.0/DATABASE_URL}, stored as {@code SecureString} unless configured
 * otherwise. Listing walks the parameter hierarchy under the scope prefix.
 */
@Slf4j
public class AwsSsmSecretStore implements SecretStore {

    public static final String NAME = "aws";
    public static final StoreDescriptor DESCRIPTOR = StoreDescriptor.PATH_STYLE;

    private final SsmClient ssmClient;
    private final ScopedKeyResolver resolver;
    private final ParameterType parameterType;

    /**
     * @param listPrefix parameter path to list under; null for {@code /envr/<domain>/<project>/}
     * @throws tech.yump.envr.store.InvalidVersionException before the client is used, if the scope's
     *                                                      version does not fit this backend
     */
    public AwsSsmSecretStore(SsmClient ssmClient, KeyScope scope, String listPrefix, boolean secure) {
        this.resolver = new ScopedKeyResolver(DESCRIPTOR, scope, normalizePath(listPrefix));
        this.ssmClient = ssmClient;
        this.parameterType = secure ? ParameterType.SECURE_STRING : ParameterType.STRING;
    }

    public AwsSsmSecretStore(SsmClient ssmClient, KeyScope scope) {
        this(ssmClient, scope, null, true);
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
        String parameterName = parameterName(key);
        log.debug("Getting SSM parameter {}", parameterName);
        try {
            GetParameterRequest request = GetParameterRequest.builder()
                    .name(parameterName)
                    .withDecryption(true)
                    .build();
            return Optional.of(ssmClient.getParameter(request).parameter().value());
        } catch (ParameterNotFoundException e) {
            log.debug("SSM parameter {} not found", parameterName);
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, String value) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null for set operation.");
        }
        String parameterName = parameterName(key);
        PutParameterRequest request = PutParameterRequest.builder()
                .name(parameterName)
                .value(value)
                .type(parameterType)
                .overwrite(true)
                .build();
        ssmClient.putParameter(request);
        log.info("Stored SSM parameter {}", parameterName);
    }

    @Override
    public void delete(String key) {
        String parameterName = parameterName(key);
        try {
            ssmClient.deleteParameter(DeleteParameterRequest.builder().name(parameterName).build());
            log.info("Deleted SSM parameter {}", parameterName);
        } catch (ParameterNotFoundException e) {
            log.debug("No SSM parameter {} to delete", parameterName);
        }
    }

    @Override
    public List<String> listKeys() {
        String path = stripTrailingSlash(absolute(resolver.getListPrefix()));
        GetParametersByPathRequest request = GetParametersByPathRequest.builder()
                .path(path)
                .recursive(true)
                .withDecryption(false)
                .build();
        List<String> keys = new ArrayList<>();
        for (GetParametersByPathResponse page : ssmClient.getParametersByPathPaginator(request)) {
            for (Parameter parameter : page.parameters()) {
                keys.add(parameter.name());
            }
        }
        keys.sort(null);
        log.debug("Listed {} SSM parameters under {}", keys.size(), path);
        return keys;
    }

    String parameterName(String key) {
        return absolute(resolver.compositeKey(key));
    }

    private static String absolute(String path) {
        return path.startsWith("/") ? path : "/" + path;
    }

    private static String stripTrailingSlash(String path) {
        return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }

    private static String normalizePath(String listPrefix) {
        if (listPrefix == null || listPrefix.isBlank()) {
            return null;
        }
        String path = listPrefix.endsWith("/") ? listPrefix : listPrefix + "/";
        return path.startsWith("/") ? path.substring(1) : path;
    }
}
