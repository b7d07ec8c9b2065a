package tech.yump.envr.store.azure;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import tech.yump.envr.key.KeyGrammar;
import tech.yump.envr.key.StoreDescriptor;
import tech.yump.envr.store.KeyScope;
import tech.yump.envr.store.ScopedKeyResolver;
import tech.yump.envr.store.SecretStore;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Secrets in Azure Key Vault, one vault secret per key, through the Key Vault REST API.
 *
 * <p>Secret names allow only {@code [A-Za-z0-9-]}: segments are joined with {@code --}, version
 * dots become {@code -}, runs of other characters become a single {@code -} and the result is
 * lower-cased. Azure names are case-insensitive, so {@link #listKeys()} returns lower-case names.
 * Because version dots and hyphens share one character, pre-release versions do not parse back
 * to their original form.
 */
@Slf4j
public class AzureKeyVaultStore implements SecretStore {

    public static final String NAME = "azure";
    public static final StoreDescriptor DESCRIPTOR =
            new StoreDescriptor("--", "-", StoreDescriptor.DEFAULT_PREFIX, "default");

    private static final Pattern INVALID_NAME_CHARS = Pattern.compile("[^a-zA-Z0-9-]+");
    private static final String SECRET_URL = "secrets/{name}?api-version={apiVersion}";
    private static final String LIST_URL = "secrets?api-version={apiVersion}";

    private final RestTemplate restTemplate;
    private final String vaultUrl;
    private final String accessToken;
    private final String apiVersion;
    private final ScopedKeyResolver resolver;
    private final String nameFilter;

    /**
     * @param vaultUrl   full vault URL, or a bare vault name expanded to {@code https://<name>.vault.azure.net/}
     * @param listPrefix secret name prefix to list under; null for {@code envr--<domain>--<project>--}
     */
    public AzureKeyVaultStore(RestTemplate restTemplate, String vaultUrl, String accessToken, String apiVersion,
                              KeyScope scope, String listPrefix) {
        this.resolver = new ScopedKeyResolver(DESCRIPTOR, scope, listPrefix);
        if (!StringUtils.hasText(vaultUrl)) {
            throw new IllegalArgumentException("Azure vault URL cannot be null or empty.");
        }
        this.restTemplate = restTemplate;
        this.vaultUrl = normalizeVaultUrl(vaultUrl);
        this.accessToken = accessToken;
        this.apiVersion = apiVersion;
        this.nameFilter = toSecretName(stripTrailing(resolver.getListPrefix(), "-"));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StoreDescriptor descriptor() {
        return DESCRIPTOR;
    }

    public String getVaultUrl() {
        return vaultUrl;
    }

    @Override
    public Optional<String> get(String key) {
        String secretName = secretName(key);
        log.debug("Getting Azure secret {} from {}", secretName, vaultUrl);
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(vaultUrl + SECRET_URL, HttpMethod.GET,
                    new HttpEntity<>(headers()), JsonNode.class, secretName, apiVersion);
            JsonNode body = response.getBody();
            if (body == null || !body.hasNonNull("value")) {
                return Optional.empty();
            }
            return Optional.of(body.get("value").asText());
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Azure secret {} not found", secretName);
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, String value) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null for set operation.");
        }
        String secretName = secretName(key);
        HttpHeaders headers = headers();
        headers.setContentType(MediaType.APPLICATION_JSON);
        restTemplate.exchange(vaultUrl + SECRET_URL, HttpMethod.PUT, new HttpEntity<>(Map.of("value", value), headers),
                JsonNode.class, secretName, apiVersion);
        log.info("Stored Azure secret {} in {}", secretName, vaultUrl);
    }

    @Override
    public void delete(String key) {
        String secretName = secretName(key);
        try {
            restTemplate.exchange(vaultUrl + SECRET_URL, HttpMethod.DELETE, new HttpEntity<>(headers()),
                    JsonNode.class, secretName, apiVersion);
            log.info("Deleted Azure secret {} in {}", secretName, vaultUrl);
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("No Azure secret {} to delete", secretName);
        }
    }

    @Override
    public List<String> listKeys() {
        TreeSet<String> keys = new TreeSet<>();
        JsonNode page = restTemplate.exchange(vaultUrl + LIST_URL, HttpMethod.GET, new HttpEntity<>(headers()),
                JsonNode.class, apiVersion).getBody();
        while (page != null) {
            for (JsonNode item : page.path("value")) {
                // id is <vault>/secrets/<name>
                String id = item.path("id").asText("");
                String secretName = id.substring(id.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);
                if (secretName.startsWith(nameFilter)) {
                    keys.add(secretName);
                }
            }
            String nextLink = page.path("nextLink").asText(null);
            page = StringUtils.hasText(nextLink)
                    ? restTemplate.exchange(URI.create(nextLink), HttpMethod.GET,
                            new HttpEntity<>(headers()), JsonNode.class).getBody()
                    : null;
        }
        log.debug("Listed {} Azure secrets with prefix {}", keys.size(), nameFilter);
        return List.copyOf(keys);
    }

    String secretName(String key) {
        return toSecretName(resolver.compositeKey(key));
    }

    static String toSecretName(String value) {
        String name = stripTrailing(stripLeading(INVALID_NAME_CHARS.matcher(value).replaceAll("-"), "-"), "-");
        return name.isEmpty() ? "key" : name.toLowerCase(Locale.ROOT);
    }

    static String defaultPrefix(String domain, String project) {
        return KeyGrammar.buildScopePrefix(domain, project, DESCRIPTOR).toLowerCase(Locale.ROOT);
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (StringUtils.hasText(accessToken)) {
            headers.setBearerAuth(accessToken);
        }
        return headers;
    }

    private static String normalizeVaultUrl(String vaultUrl) {
        String url = vaultUrl.startsWith("https://") ? vaultUrl : "https://" + vaultUrl + ".vault.azure.net/";
        return url.endsWith("/") ? url : url + "/";
    }

    private static String stripLeading(String value, String ch) {
        String result = value;
        while (result.startsWith(ch)) {
            result = result.substring(ch.length());
        }
        return result;
    }

    private static String stripTrailing(String value, String ch) {
        String result = value;
        while (result.endsWith(ch)) {
            result = result.substring(0, result.length() - ch.length());
        }
        return result;
    }
}
