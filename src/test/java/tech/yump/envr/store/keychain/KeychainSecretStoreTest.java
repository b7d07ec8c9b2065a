package tech.yump.envr.store.keychain;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.envr.store.InvalidVersionException;
import tech.yump.envr.store.KeyScope;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeychainSecretStoreTest {

    private static final String SERVICE = "envr:billing";
    private static final String MANIFEST = "envr/prod/billing/__keys__";
    private static final String REGISTRY = "envr/__domains__";

    private InMemoryKeychainClient keychain;
    private ObjectMapper objectMapper;
    private KeychainSecretStore prod;

    @BeforeEach
    void setUp() {
        keychain = new InMemoryKeychainClient();
        objectMapper = new ObjectMapper();
        prod = store("prod");
    }

    private KeychainSecretStore store(String domain) {
        return store(domain, "1.0.0");
    }

    private KeychainSecretStore store(String domain, String version) {
        return new KeychainSecretStore(keychain, objectMapper, new KeyScope("billing", domain, version));
    }

    @Test
    @DisplayName("Set stores the secret under envr/<domain>/<project>/<name> and records the name in the manifest")
    void setWritesSecretAndManifest() {
        prod.set("API_KEY", "s3cr3t");

        assertThat(keychain.getPassword(SERVICE, "envr/prod/billing/API_KEY")).contains("s3cr3t");
        assertThat(keychain.getPassword(SERVICE, MANIFEST)).contains("[\"API_KEY\"]");
        assertThat(prod.get("API_KEY")).contains("s3cr3t");
        assertThat(prod.listKeys()).containsExactly("API_KEY");
    }

    @Test
    @DisplayName("Manifest follows sets and deletes; the domain leaves the registry with its last key")
    void manifestLifecycle() {
        prod.setWithDomainTracking("A", "1");
        prod.setWithDomainTracking("B", "2");
        assertThat(prod.listDomains()).containsExactly("prod");

        prod.delete("A");
        assertThat(prod.listKeys()).containsExactly("B");
        assertThat(prod.listDomains()).containsExactly("prod");

        prod.delete("B");
        assertThat(prod.listKeys()).isEmpty();
        assertThat(prod.listDomains()).isEmpty();
        assertThat(keychain.contains(SERVICE, MANIFEST)).isFalse();
        assertThat(keychain.contains(SERVICE, REGISTRY)).isFalse();
    }

    @Test
    @DisplayName("Listed keys are sorted and unique")
    void sortedUnique() {
        prod.set("ZED", "1");
        prod.set("ALPHA", "2");
        prod.set("ZED", "3");

        assertThat(prod.listKeys()).containsExactly("ALPHA", "ZED");
        assertThat(prod.get("ZED")).contains("3");
    }

    @Test
    @DisplayName("Deleting an absent key twice is not an error and leaves the manifest unchanged")
    void idempotentDelete() {
        prod.set("KEEP", "1");

        prod.delete("MISSING");
        prod.delete("MISSING");

        assertThat(prod.listKeys()).containsExactly("KEEP");
    }

    @Test
    @DisplayName("A composite key addresses the same secret as its name")
    void compositeKeyAccess() {
        prod.set("envr/prod/billing/1.0.0/TOKEN", "t");

        assertThat(prod.get("TOKEN")).contains("t");
        assertThat(prod.listKeys()).containsExactly("TOKEN");
    }

    @Test
    @DisplayName("Stores opened at another version see and manage the same secrets")
    void otherVersionSharesManifest() {
        KeychainSecretStore v1 = store("prod", "1.0.0");
        KeychainSecretStore v2 = store("prod", "2.0.0");
        v1.setWithDomainTracking("A", "1");

        assertThat(v2.listKeys()).containsExactly("A");
        assertThat(v2.get("A")).contains("1");

        v2.clear();

        assertThat(v1.listKeys()).isEmpty();
        assertThat(v1.get("A")).isEmpty();
        assertThat(v1.listDomains()).isEmpty();
        assertThat(keychain.size(SERVICE)).isZero();
    }

    @Test
    @DisplayName("A composite key of another domain, project or version is rejected and nothing changes")
    void foreignCompositeKeyRejected() {
        prod.setWithDomainTracking("A", "1");

        assertThatThrownBy(() -> prod.delete("envr/staging/billing/1.0.0/A"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("staging");
        assertThatThrownBy(() -> prod.get("envr/prod/payroll/1.0.0/A"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> prod.set("envr/prod/billing/2.0.0/A", "2"))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(prod.get("A")).contains("1");
        assertThat(prod.listKeys()).containsExactly("A");
        assertThat(prod.listDomains()).containsExactly("prod");
    }

    @Test
    @DisplayName("A bare name with several slashes stays one sanitized name")
    void slashedBareName() {
        prod.set("a/b/c/d/e", "v");

        assertThat(prod.listKeys()).containsExactly("a_b_c_d_e");
        assertThat(prod.get("a/b/c/d/e")).contains("v");
        assertThat(keychain.contains(SERVICE, "envr/prod/billing/a_b_c_d_e")).isTrue();
    }

    @Test
    @DisplayName("The manifest account name cannot be used as a secret name")
    void reservedName() {
        assertThatThrownBy(() -> prod.set("__keys__", "[]"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(keychain.size(SERVICE)).isZero();
    }

    @Test
    @DisplayName("Clear removes every secret, the manifest and the domain registration")
    void clear() {
        KeychainSecretStore dev = store("dev");
        prod.setWithDomainTracking("A", "1");
        prod.setWithDomainTracking("B", "2");
        dev.setWithDomainTracking("C", "3");

        prod.clear();

        assertThat(prod.listKeys()).isEmpty();
        assertThat(prod.get("A")).isEmpty();
        assertThat(prod.listDomains()).containsExactly("dev");
        assertThat(dev.listKeys()).containsExactly("C");
        // dev secret, dev manifest, registry
        assertThat(keychain.size(SERVICE)).isEqualTo(3);
    }

    @Test
    @DisplayName("A corrupt manifest reads as empty and is rewritten by the next set")
    void corruptManifest() {
        keychain.setPassword(SERVICE, MANIFEST, "not json");

        assertThat(prod.listKeys()).isEmpty();
        prod.set("A", "1");
        assertThat(prod.listKeys()).containsExactly("A");
    }

    @Test
    @DisplayName("Domains are listed exactly when their manifest is non-empty, over random operation sequences")
    void registryMatchesManifests() {
        List<String> domains = List.of("prod", "dev", "qa");
        List<String> names = List.of("A", "B", "C");
        Random random = new Random(42);

        for (int i = 0; i < 500; i++) {
            KeychainSecretStore store = store(domains.get(random.nextInt(domains.size())));
            String name = names.get(random.nextInt(names.size()));
            if (random.nextBoolean()) {
                store.setWithDomainTracking(name, "v" + i);
            } else {
                store.delete(name);
            }

            for (String domain : domains) {
                boolean hasKeys = !store(domain).listKeys().isEmpty();
                assertThat(prod.listDomains().contains(domain))
                        .as("domain %s after step %d", domain, i)
                        .isEqualTo(hasKeys);
            }
        }
    }

    @Test
    @DisplayName("An invalid version is rejected before the keychain is touched")
    void invalidVersion() {
        assertThatThrownBy(() -> new KeychainSecretStore(keychain, objectMapper, new KeyScope("billing", "prod", "1.0")))
                .isInstanceOf(InvalidVersionException.class);
        assertThat(keychain.size(SERVICE)).isZero();
    }
}
