package tech.yump.envr.store.vault;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import tech.yump.envr.key.StoreDescriptor;
import tech.yump.envr.store.KeyScope;
import tech.yump.envr.store.ScopedKeyResolver;
import tech.yump.envr.store.SecretStore;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Secrets as the fields of one HashiCorp Vault KV v2 secret.
 *
 * <p>The secret lives at the scope path ({@code envr/<domain>/<project>} unless a prefix is given)
 * under the configured mount, and its data map is keyed by secret name. Composite keys are reduced
 * to their name. KV v2 versions the secret itself, so the scope's version is validated but not part
 * of the address.
 */
@Slf4j
public class VaultKvStore implements SecretStore {

    public static final String NAME = "vault";
    public static final StoreDescriptor DESCRIPTOR = StoreDescriptor.PATH_STYLE;

    private static final String DATA_URL = "/v1/{mount}/data/{path}";
    private static final String TOKEN_HEADER = "X-Vault-Token";

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String token;
    private final String mount;
    private final String path;
    private final ScopedKeyResolver resolver;

    /**
     * @param listPrefix KV path of the secret; null for {@code envr/<domain>/<project>}
     */
    public VaultKvStore(RestTemplate restTemplate, String baseUrl, String token, String mount,
                        KeyScope scope, String listPrefix) {
        this.resolver = new ScopedKeyResolver(DESCRIPTOR, scope, listPrefix);
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.token = token;
        this.mount = mount;
        this.path = trimSlashes(resolver.getListPrefix());
        if (path.isEmpty()) {
            throw new IllegalArgumentException("Vault secret path cannot be empty.");
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StoreDescriptor descriptor() {
        return DESCRIPTOR;
    }

    public String getPath() {
        return path;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(readData().get(fieldName(key)));
    }

    @Override
    public void set(String key, String value) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null for set operation.");
        }
        String field = fieldName(key);
        Map<String, String> data = readData();
        data.put(field, value);
        writeData(data);
        log.info("Stored field '{}' in Vault secret {}/{}", field, mount, path);
    }

    @Override
    public void delete(String key) {
        String field = fieldName(key);
        Map<String, String> data = readData();
        if (data.remove(field) != null) {
            writeData(data);
            log.info("Deleted field '{}' from Vault secret {}/{}", field, mount, path);
        } else {
            log.debug("No field '{}' to delete in Vault secret {}/{}", field, mount, path);
        }
    }

    @Override
    public List<String> listKeys() {
        return List.copyOf(readData().keySet());
    }

    @Override
    public void clear() {
        writeData(Collections.emptyMap());
        log.info("Cleared Vault secret {}/{}", mount, path);
    }

    private String fieldName(String key) {
        if (!StringUtils.hasText(key)) {
            throw new IllegalArgumentException("Key cannot be null or empty.");
        }
        return resolver.exportName(key);
    }

    private Map<String, String> readData() {
        log.debug("Reading Vault secret {}/{}", mount, path);
        JsonNode body;
        try {
            body = restTemplate.exchange(baseUrl + DATA_URL, HttpMethod.GET, new HttpEntity<>(headers()),
                    JsonNode.class, mount, path).getBody();
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Vault secret {}/{} does not exist yet", mount, path);
            return new TreeMap<>();
        }
        Map<String, String> data = new TreeMap<>();
        if (body == null) {
            return data;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = body.path("data").path("data").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            data.put(field.getKey(), field.getValue().asText());
        }
        return data;
    }

    private void writeData(Map<String, String> data) {
        HttpHeaders headers = headers();
        headers.setContentType(MediaType.APPLICATION_JSON);
        restTemplate.exchange(baseUrl + DATA_URL, HttpMethod.POST, new HttpEntity<>(Map.of("data", data), headers),
                JsonNode.class, mount, path);
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (StringUtils.hasText(token)) {
            headers.set(TOKEN_HEADER, token);
        }
        return headers;
    }

    private static String trimSlashes(String value) {
        String result = value;
        while (result.startsWith("/")) {
            result = result.substring(1);
        }
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
