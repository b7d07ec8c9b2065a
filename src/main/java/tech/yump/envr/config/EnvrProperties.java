package tech.yump.envr.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import tech.yump.envr.key.LogicalKey;
import tech.yump.envr.store.SemanticVersions;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration properties for the envr application under the 'envr' prefix.
 * Read once at startup; nothing in the store layer mutates them.
 */
@ConfigurationProperties(prefix = "envr")
@Validated
public record EnvrProperties(

        @NotBlank(message = "Default project (envr.project) must not be blank.")
        @DefaultValue("_default_")
        String project,

        @NotBlank(message = "Default service (envr.service) must not be blank.")
        @DefaultValue("local")
        String service,

        @DefaultValue(LogicalKey.DEFAULT_VERSION)
        String version,

        @Valid
        Map<String, DomainProperties> domains,

        @Valid
        @DefaultValue
        AwsProperties aws,

        @Valid
        @DefaultValue
        GcpProperties gcp,

        @Valid
        @DefaultValue
        AzureProperties azure,

        @Valid
        @DefaultValue
        VaultProperties vault,

        @Valid
        @DefaultValue
        GitHubProperties github,

        @Valid
        @DefaultValue
        KeychainProperties keychain,

        @Valid
        @DefaultValue
        FileProperties file
) {

    static final String ENV_PLACEHOLDER = "{env}";
    static final String DEFAULT_ENV = "test";

    public EnvrProperties {
        if (domains == null) {
            domains = Collections.emptyMap();
        }
    }

    @AssertTrue(message = "Default version (envr.version) must be a strict semantic version, e.g. 1.0.0.")
    public boolean isVersionValid() {
        return SemanticVersions.isValid(version);
    }

    /**
     * Returns the configured prefix for {@code domain} with {@code {env}} expanded.
     *
     * @param env environment name; "test" when null.
     * @return the prefix, or empty if the domain has none configured.
     */
    public Optional<String> resolveDomainPrefix(String domain, String env) {
        DomainProperties domainProperties = domains.get(domain);
        if (domainProperties == null || !StringUtils.hasText(domainProperties.prefix())) {
            return Optional.empty();
        }
        String prefix = domainProperties.prefix();
        if (prefix.contains(ENV_PLACEHOLDER)) {
            prefix = prefix.replace(ENV_PLACEHOLDER, StringUtils.hasText(env) ? env : DEFAULT_ENV);
        }
        return Optional.of(prefix);
    }

    /**
     * Per-domain settings.
     *
     * @param envFile default .env file for the domain (file store)
     * @param prefix  explicit list prefix / path for cloud stores; may contain {env}
     */
    public record DomainProperties(String envFile, String prefix) {}

    public record AwsProperties(
            @DefaultValue("false") boolean enabled,
            String profile,
            String region,
            @DefaultValue("true") boolean secure
    ) {}

    public record GcpProperties(
            @DefaultValue("false") boolean enabled,
            String projectId
    ) {
        @AssertTrue(message = "GCP project id (envr.gcp.project-id) must be provided when the gcp store is enabled.")
        public boolean isProjectIdValid() {
            return !enabled || StringUtils.hasText(projectId);
        }
    }

    public record AzureProperties(
            String vaultUrl,
            String accessToken,
            @DefaultValue("7.4") String apiVersion
    ) {
        public boolean isConfigured() {
            return StringUtils.hasText(vaultUrl);
        }

        @Override
        public String toString() {
            return "AzureProperties[vaultUrl=" + vaultUrl + ", accessToken=******, apiVersion=" + apiVersion + "]";
        }
    }

    public record VaultProperties(
            @DefaultValue("http://127.0.0.1:8200") String url,
            String token,
            @DefaultValue("secret") String mount
    ) {
        @Override
        public String toString() {
            return "VaultProperties[url=" + url + ", token=******, mount=" + mount + "]";
        }
    }

    public record GitHubProperties(
            String repo,
            String prefix
    ) {}

    /**
     * @param tool "security" (macOS), "secret-tool" (Linux) or "auto" to pick by operating system
     */
    public record KeychainProperties(
            @DefaultValue("auto") String tool
    ) {}

    public record FileProperties(
            @DefaultValue(".env") String path
    ) {}
}
