package tech.yump.envr.config;

import com.google.cloud.secretmanager.v1.SecretManagerServiceClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.SsmClientBuilder;
import tech.yump.envr.process.CommandRunner;
import tech.yump.envr.store.keychain.KeychainClient;
import tech.yump.envr.store.keychain.MacOsKeychainClient;
import tech.yump.envr.store.keychain.SecretToolKeychainClient;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;

/**
 * Backend clients. Cloud SDK clients are only created when their store is enabled; the matching
 * providers report the store as unavailable otherwise.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class StoreClientConfiguration {

    static final String TOOL_SECURITY = "security";
    static final String TOOL_SECRET_TOOL = "secret-tool";

    private final EnvrProperties properties;

    @Bean
    @ConditionalOnProperty(name = "envr.aws.enabled", havingValue = "true")
    public SsmClient ssmClient() {
        EnvrProperties.AwsProperties aws = properties.aws();
        AwsCredentialsProvider credentials = StringUtils.hasText(aws.profile())
                ? ProfileCredentialsProvider.create(aws.profile())
                : DefaultCredentialsProvider.create();
        SsmClientBuilder builder = SsmClient.builder().credentialsProvider(credentials);
        if (StringUtils.hasText(aws.region())) {
            builder.region(Region.of(aws.region()));
        }
        log.info("Configuring AWS SSM client (profile: {}, region: {})",
                StringUtils.hasText(aws.profile()) ? aws.profile() : "default chain",
                StringUtils.hasText(aws.region()) ? aws.region() : "default chain");
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(name = "envr.gcp.enabled", havingValue = "true")
    public SecretManagerServiceClient secretManagerServiceClient() throws IOException {
        log.info("Configuring GCP Secret Manager client for project {}", properties.gcp().projectId());
        return SecretManagerServiceClient.create();
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(30))
                .build();
    }

    @Bean
    public KeychainClient keychainClient(CommandRunner commandRunner) {
        String tool = resolveKeychainTool(properties.keychain().tool(), System.getProperty("os.name", ""));
        log.info("Using '{}' for the local keychain store", tool);
        return TOOL_SECURITY.equals(tool)
                ? new MacOsKeychainClient(commandRunner)
                : new SecretToolKeychainClient(commandRunner);
    }

    /**
     * @param tool   configured tool: "security", "secret-tool" or "auto"
     * @param osName value of the {@code os.name} system property
     */
    static String resolveKeychainTool(String tool, String osName) {
        if (TOOL_SECURITY.equals(tool) || TOOL_SECRET_TOOL.equals(tool)) {
            return tool;
        }
        if (StringUtils.hasText(tool) && !"auto".equals(tool)) {
            throw new IllegalStateException("Unknown keychain tool '" + tool
                    + "' (envr.keychain.tool). Use security, secret-tool or auto.");
        }
        return osName.toLowerCase(Locale.ROOT).contains("mac") ? TOOL_SECURITY : TOOL_SECRET_TOOL;
    }
}
