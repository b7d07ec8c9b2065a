package tech.yump.envr;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import tech.yump.envr.store.keychain.InMemoryKeychainClient;
import tech.yump.envr.store.keychain.KeychainClient;

/**
 * Replaces the OS keychain with an in-memory one for tests that boot the application.
 */
@TestConfiguration
public class TestKeychainConfiguration {

    @Bean
    @Primary
    public KeychainClient inMemoryKeychainClient() {
        return new InMemoryKeychainClient();
    }
}
