package tech.yump.envr.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.envr.api.ApiError;
import tech.yump.envr.api.dto.DomainListResponse;
import tech.yump.envr.api.dto.ImportResponse;
import tech.yump.envr.api.dto.KeyListResponse;
import tech.yump.envr.api.dto.SecretValueRequest;
import tech.yump.envr.api.dto.SecretValueResponse;
import tech.yump.envr.api.dto.StoreInfo;
import tech.yump.envr.service.ExportFormat;
import tech.yump.envr.service.ImportFormat;
import tech.yump.envr.service.SecretTransferService;
import tech.yump.envr.service.UnexportFormat;
import tech.yump.envr.store.DomainTrackingStore;
import tech.yump.envr.store.SecretStore;
import tech.yump.envr.store.SecretStoreFactory;

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/v1/stores")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Secrets", description = "Read, write, list and export secrets in a named store")
public class SecretsController {

    private final SecretStoreFactory storeFactory;
    private final SecretTransferService transferService;

    @GetMapping
    @Operation(summary = "List stores", description = "Lists the available store backends and their key grammar.")
    public List<StoreInfo> listStores() {
        return storeFactory.describe().stream().map(StoreInfo::from).toList();
    }

    @GetMapping("/{store}/secrets")
    @Operation(
            summary = "List keys",
            description = "Lists the keys of the given scope. Keychain-backed stores return names from their manifest; "
                    + "cloud stores return composite keys under the scope prefix."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Keys listed."),
            @ApiResponse(responseCode = "400", description = "Invalid version.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "404", description = "Unknown store.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "503", description = "Store backend not configured or not reachable.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public KeyListResponse listKeys(
            @Parameter(description = "Store id.", example = "local") @PathVariable String store,
            @Parameter(description = "Project; blank for the configured default.") @RequestParam(required = false) String project,
            @Parameter(description = "Domain; blank for the store's default namespace.") @RequestParam(required = false) String domain,
            @Parameter(description = "Semantic version; blank for the configured default.") @RequestParam(required = false) String version,
            @Parameter(description = "Explicit list prefix, overriding the domain's configured prefix.") @RequestParam(required = false) String prefix,
            @Parameter(description = "Environment substituted for {env} in a configured prefix.") @RequestParam(required = false) String env
    ) {
        SecretStore secretStore = storeFactory.open(store, project, domain, version, prefix, env);
        List<String> keys = secretStore.listKeys();
        log.info("Listed {} key(s) in store '{}'", keys.size(), secretStore.name());
        return new KeyListResponse(secretStore.name(), keys);
    }

    @GetMapping("/{store}/secrets/{*key}")
    @Operation(summary = "Read secret", description = "Reads one secret by bare name or full composite key.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Secret found."),
            @ApiResponse(responseCode = "404", description = "Unknown store or no secret under the key.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "405", description = "The store is write-only.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<SecretValueResponse> readSecret(
            @Parameter(description = "Store id.", example = "local") @PathVariable String store,
            @Parameter(description = "Bare secret name or composite key.", example = "DATABASE_URL") @PathVariable String key,
            @RequestParam(required = false) String project,
            @RequestParam(required = false) String domain,
            @RequestParam(required = false) String version
    ) {
        String secretKey = stripLeadingSlash(key);
        SecretStore secretStore = storeFactory.open(store, project, domain, version, null, null);
        Optional<String> value = secretStore.get(secretKey);
        if (value.isEmpty()) {
            log.info("No secret '{}' in store '{}'", secretKey, secretStore.name());
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(new SecretValueResponse(secretKey, value.get()));
    }

    @PutMapping("/{store}/secrets/{*key}")
    @Operation(
            summary = "Write secret",
            description = "Creates or overwrites one secret. Keychain-backed stores also register the domain."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "204", description = "Secret written."),
            @ApiResponse(responseCode = "400", description = "Invalid body or version.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "404", description = "Unknown store.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<Void> writeSecret(
            @PathVariable String store,
            @PathVariable String key,
            @RequestParam(required = false) String project,
            @RequestParam(required = false) String domain,
            @RequestParam(required = false) String version,
            @Valid @RequestBody SecretValueRequest request
    ) {
        String secretKey = stripLeadingSlash(key);
        SecretStore secretStore = storeFactory.open(store, project, domain, version, null, null);
        if (secretStore instanceof DomainTrackingStore tracking) {
            tracking.setWithDomainTracking(secretKey, request.value());
        } else {
            secretStore.set(secretKey, request.value());
        }
        log.info("Wrote secret '{}' to store '{}'", secretKey, secretStore.name());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{store}/secrets/{*key}")
    @Operation(summary = "Delete secret", description = "Deletes one secret. Deleting a missing key succeeds.")
    @ApiResponse(responseCode = "204", description = "Secret deleted or already absent.")
    public ResponseEntity<Void> deleteSecret(
            @PathVariable String store,
            @PathVariable String key,
            @RequestParam(required = false) String project,
            @RequestParam(required = false) String domain,
            @RequestParam(required = false) String version
    ) {
        String secretKey = stripLeadingSlash(key);
        SecretStore secretStore = storeFactory.open(store, project, domain, version, null, null);
        secretStore.delete(secretKey);
        log.info("Processed delete of secret '{}' in store '{}'", secretKey, secretStore.name());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{store}/secrets")
    @Operation(summary = "Clear scope", description = "Deletes every secret of the given scope.")
    @ApiResponse(responseCode = "204", description = "Scope cleared.")
    public ResponseEntity<Void> clearSecrets(
            @PathVariable String store,
            @RequestParam(required = false) String project,
            @RequestParam(required = false) String domain,
            @RequestParam(required = false) String version,
            @RequestParam(required = false) String prefix,
            @RequestParam(required = false) String env
    ) {
        SecretStore secretStore = storeFactory.open(store, project, domain, version, prefix, env);
        secretStore.clear();
        log.info("Cleared store '{}' for project '{}', domain '{}'", secretStore.name(), project, domain);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{store}/domains")
    @Operation(summary = "List domains", description = "Lists the domains of a project that hold at least one secret. Only keychain-backed stores track domains.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Domains listed."),
            @ApiResponse(responseCode = "404", description = "Unknown store, or the store does not track domains.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<?> listDomains(
            @PathVariable String store,
            @RequestParam(required = false) String project
    ) {
        SecretStore secretStore = storeFactory.open(store, project, null);
        if (!(secretStore instanceof DomainTrackingStore tracking)) {
            ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND,
                    "Store '" + secretStore.name() + "' does not track domains.");
            problemDetail.setTitle("Domains Not Tracked");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problemDetail);
        }
        return ResponseEntity.ok(new DomainListResponse(secretStore.name(), project, tracking.listDomains()));
    }

    @GetMapping("/{store}/export")
    @Operation(summary = "Export secrets", description = "Renders every secret of the scope as dotenv, shell, json or powershell text.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Secrets rendered."),
            @ApiResponse(responseCode = "400", description = "Unknown format or invalid version.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "405", description = "The store is write-only.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<String> export(
            @PathVariable String store,
            @Parameter(description = "dotenv, shell, json or powershell.", example = "dotenv") @RequestParam(required = false) String format,
            @RequestParam(required = false) String project,
            @RequestParam(required = false) String domain,
            @RequestParam(required = false) String version
    ) {
        ExportFormat exportFormat = ExportFormat.fromId(format);
        String body = transferService.export(store, project, domain, version, exportFormat);
        MediaType contentType = exportFormat == ExportFormat.JSON ? MediaType.APPLICATION_JSON : MediaType.TEXT_PLAIN;
        return ResponseEntity.ok().contentType(contentType).body(body);
    }

    @GetMapping("/{store}/unexport")
    @Operation(summary = "Unexport secrets", description = "Renders the shell commands that unset every variable the export of the same scope sets. "
            + "Without a domain, a keychain-backed store covers every tracked domain.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Commands rendered."),
            @ApiResponse(responseCode = "400", description = "Unknown format or invalid version.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<String> unexport(
            @PathVariable String store,
            @Parameter(description = "unix (unset) or win (Remove-Item Env:).", example = "unix") @RequestParam(required = false) String format,
            @RequestParam(required = false) String project,
            @RequestParam(required = false) String domain,
            @RequestParam(required = false) String version
    ) {
        String body = transferService.unexport(store, project, domain, version, UnexportFormat.fromId(format));
        return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(body);
    }

    @PostMapping(value = "/{store}/import", consumes = {MediaType.TEXT_PLAIN_VALUE, MediaType.APPLICATION_JSON_VALUE, "application/yaml"})
    @Operation(summary = "Import secrets", description = "Writes every variable of an env, json or yaml document into the scope. "
            + "JSON and YAML may be nested by domain, or by domain and project.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Variables imported."),
            @ApiResponse(responseCode = "400", description = "Unknown format, unreadable document or invalid version.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ImportResponse importSecrets(
            @PathVariable String store,
            @Parameter(description = "env, json or yaml.", example = "env") @RequestParam(required = false) String format,
            @RequestParam(required = false) String project,
            @RequestParam(required = false) String domain,
            @RequestParam(required = false) String version,
            @RequestBody String content
    ) {
        int imported = transferService.importInto(store, project, domain, version, ImportFormat.fromId(format), content);
        log.info("Imported {} variable(s) into store '{}'", imported, store);
        return new ImportResponse(store, imported);
    }

    private static String stripLeadingSlash(String key) {
        return key != null && key.startsWith("/") ? key.substring(1) : key;
    }
}
