package tech.yump.envr.api.v1;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import tech.yump.envr.TestKeychainConfiguration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestKeychainConfiguration.class)
class SecretsControllerIntegrationTest {

    @TempDir
    static Path tempDir;

    @DynamicPropertySource
    static void overrideProperties(DynamicPropertyRegistry registry) {
        registry.add("envr.file.path", () -> tempDir.resolve(".env").toAbsolutePath().toString());
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    // The keychain bean lives as long as the cached context; each test gets its own project.
    private String project;

    @BeforeEach
    void setUp() throws Exception {
        project = "proj-" + UUID.randomUUID();
        Files.deleteIfExists(tempDir.resolve(".env"));
    }

    @Test
    @DisplayName("GET /v1/stores: lists every backend with its key grammar")
    void listStores() throws Exception {
        mockMvc.perform(get("/v1/stores"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].id", hasItems("aws", "azure", "file", "gcp", "github", "local", "vault")))
                .andExpect(jsonPath("$[?(@.id == 'gcp')].keySeparator", hasItems("--")))
                .andExpect(jsonPath("$[?(@.id == 'github')].prefix", hasItems("ENVR")));
    }

    @Test
    @DisplayName("Keychain: write, read, list, list domains, delete")
    void keychainLifecycle() throws Exception {
        mockMvc.perform(put("/v1/stores/local/secrets/API_KEY")
                        .param("project", project).param("domain", "prod")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("value", "s3cr3t"))))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/v1/stores/local/secrets/API_KEY").param("project", project).param("domain", "prod"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.key", is("API_KEY")))
                .andExpect(jsonPath("$.value", is("s3cr3t")));

        mockMvc.perform(get("/v1/stores/local/secrets").param("project", project).param("domain", "prod"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.store", is("local")))
                .andExpect(jsonPath("$.keys", hasSize(1)))
                .andExpect(jsonPath("$.keys[0]", is("API_KEY")));

        mockMvc.perform(get("/v1/stores/local/domains").param("project", project))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.domains", hasSize(1)))
                .andExpect(jsonPath("$.domains[0]", is("prod")));

        mockMvc.perform(delete("/v1/stores/local/secrets/API_KEY").param("project", project).param("domain", "prod"))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/v1/stores/local/secrets").param("project", project).param("domain", "prod"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.keys", hasSize(0)));
        mockMvc.perform(get("/v1/stores/local/domains").param("project", project))
                .andExpect(jsonPath("$.domains", hasSize(0)));
    }

    @Test
    @DisplayName("Composite keys with slashes are accepted in the path")
    void compositeKeyInPath() throws Exception {
        mockMvc.perform(put("/v1/stores/local/secrets/envr/prod/" + project + "/1.0.0/DB_URL")
                        .param("project", project).param("domain", "prod")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\": \"postgres://db\"}"))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/v1/stores/local/secrets/DB_URL").param("project", project).param("domain", "prod"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.value", is("postgres://db")));
    }

    @Test
    @DisplayName("Clearing a scope empties its key list")
    void clearScope() throws Exception {
        for (String name : new String[]{"A", "B"}) {
            mockMvc.perform(put("/v1/stores/local/secrets/" + name)
                            .param("project", project).param("domain", "dev")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"value\": \"v\"}"))
                    .andExpect(status().isNoContent());
        }

        mockMvc.perform(delete("/v1/stores/local/secrets").param("project", project).param("domain", "dev"))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/v1/stores/local/secrets").param("project", project).param("domain", "dev"))
                .andExpect(jsonPath("$.keys", hasSize(0)));
    }

    @Test
    @DisplayName("GET missing secret: 404")
    void readMissing() throws Exception {
        mockMvc.perform(get("/v1/stores/local/secrets/NOPE").param("project", project))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Unknown store: 404 problem listing the available stores")
    void unknownStore() throws Exception {
        mockMvc.perform(get("/v1/stores/nope/secrets"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title", is("Unknown Store")))
                .andExpect(jsonPath("$.detail", containsString("local")));
    }

    @Test
    @DisplayName("Invalid version: 400 problem carrying the version")
    void invalidVersion() throws Exception {
        mockMvc.perform(get("/v1/stores/local/secrets").param("version", "v1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title", is("Invalid Version")))
                .andExpect(jsonPath("$.version", is("v1")));
    }

    @Test
    @DisplayName("Disabled cloud backend: 503")
    void backendUnavailable() throws Exception {
        mockMvc.perform(get("/v1/stores/aws/secrets"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.title", is("Backend Unavailable")));
    }

    @Test
    @DisplayName("Reading from a write-only store: 405")
    void writeOnlyStore() throws Exception {
        mockMvc.perform(get("/v1/stores/github/secrets/API_KEY"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.title", is("Write-Only Store")));
    }

    @Test
    @DisplayName("Stores without a domain registry: 404 Domains Not Tracked")
    void domainsNotTracked() throws Exception {
        mockMvc.perform(get("/v1/stores/file/domains"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title", is("Domains Not Tracked")));
    }

    @Test
    @DisplayName("PUT without a value or with malformed JSON: 400")
    void badBodies() throws Exception {
        mockMvc.perform(put("/v1/stores/local/secrets/API_KEY")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(put("/v1/stores/local/secrets/API_KEY")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail", is("Malformed request body. Please check the JSON format.")));
    }

    @Test
    @DisplayName("Export renders the file store as shell or JSON")
    void export() throws Exception {
        Files.writeString(tempDir.resolve(".env"), "B=two words\nA=1\n");

        mockMvc.perform(get("/v1/stores/file/export").param("format", "shell"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                .andExpect(content().string("export A=1\nexport B='two words'\n"));

        mockMvc.perform(get("/v1/stores/file/export").param("format", "json"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.A", is("1")))
                .andExpect(jsonPath("$.B", is("two words")));

        mockMvc.perform(get("/v1/stores/file/export").param("format", "yaml"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail", containsString("Unknown export format")));
    }

    @Test
    @DisplayName("Import a domain-nested JSON document into the keychain, then unexport it")
    void importThenUnexport() throws Exception {
        mockMvc.perform(post("/v1/stores/local/import")
                        .param("format", "json").param("project", project).param("domain", "prod")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prod\": {\"DB_URL\": \"postgres://db\", \"API_KEY\": \"k\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.store", is("local")))
                .andExpect(jsonPath("$.imported", is(2)));

        mockMvc.perform(get("/v1/stores/local/secrets/API_KEY").param("project", project).param("domain", "prod"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.value", is("k")));
        mockMvc.perform(get("/v1/stores/local/domains").param("project", project))
                .andExpect(jsonPath("$.domains", hasItems("prod")));

        mockMvc.perform(get("/v1/stores/local/unexport").param("project", project))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                .andExpect(content().string("unset API_KEY\nunset DB_URL\n"));
        mockMvc.perform(get("/v1/stores/local/unexport").param("project", project).param("domain", "prod")
                        .param("format", "win"))
                .andExpect(content().string("Remove-Item Env:API_KEY -ErrorAction SilentlyContinue\n"
                        + "Remove-Item Env:DB_URL -ErrorAction SilentlyContinue\n"));
    }

    @Test
    @DisplayName("Import rejects unknown formats and documents that are not objects")
    void importRejectsBadDocuments() throws Exception {
        mockMvc.perform(post("/v1/stores/local/import").param("format", "yaml").param("project", project)
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("- a\n- b\n"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail", containsString("must contain an object, not a list")));

        mockMvc.perform(post("/v1/stores/local/import").param("format", "toml").param("project", project)
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("A = 1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail", containsString("Unknown import format")));
    }

    @Test
    @DisplayName("CodeBuild env block uses the domain's configured prefix")
    void codebuildEnv() throws Exception {
        mockMvc.perform(post("/v1/stores/local/import").param("project", project).param("domain", "staging")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("TOKEN=t\nDB_URL=postgres://db\n"))
                .andExpect(jsonPath("$.imported", is(2)));

        mockMvc.perform(get("/v1/generate/codebuild-env").param("project", project).param("domain", "staging")
                        .param("env", "ci"))
                .andExpect(status().isOk())
                .andExpect(content().string("env:\n  parameter-store:\n"
                        + "    DB_URL: /acme/ci/staging/DB_URL\n"
                        + "    TOKEN: /acme/ci/staging/TOKEN\n"));

        mockMvc.perform(get("/v1/generate/codebuild-env").param("project", project).param("domain", "empty"))
                .andExpect(status().isOk())
                .andExpect(content().string(""));
    }
}
