package tech.yump.envr.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.envr.api.dto.BuildKeyRequest;
import tech.yump.envr.api.dto.BuildKeyResponse;
import tech.yump.envr.api.dto.ParsedKeyResponse;
import tech.yump.envr.key.KeyGrammar;
import tech.yump.envr.key.LogicalKey;
import tech.yump.envr.key.StoreDescriptor;
import tech.yump.envr.store.KeyScope;
import tech.yump.envr.store.SecretStoreFactory;

/**
 * Encodes and decodes composite keys without touching any backend.
 */
@RestController
@RequestMapping("/v1/keys")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Keys", description = "Composite key grammar of each store")
public class KeysController {

    private final SecretStoreFactory storeFactory;

    @PostMapping("/build")
    @Operation(summary = "Build key", description = "Encodes a secret name, project, domain and version with a store's key grammar.")
    public BuildKeyResponse build(@Valid @RequestBody BuildKeyRequest request) {
        StoreDescriptor descriptor = storeFactory.provider(request.store()).descriptor();
        String version = StringUtils.hasText(request.version()) ? request.version() : LogicalKey.DEFAULT_VERSION;
        KeyScope scope = new KeyScope(request.project(), request.domain(), version).requireCompatible(descriptor);
        String key = KeyGrammar.buildKey(scope.keyFor(request.name()), descriptor);
        log.debug("Built key '{}' for store '{}'", key, request.store());
        return new BuildKeyResponse(key);
    }

    @GetMapping("/parse")
    @Operation(summary = "Parse key", description = "Decodes a composite key with a store's key grammar. Keys with fewer than five segments are reported as not parsed.")
    public ParsedKeyResponse parse(
            @Parameter(description = "Store id whose grammar is used.", example = "aws") @RequestParam String store,
            @Parameter(description = "Key to decode.", example = "envr/prod/billing/1.0.0/DATABASE_URL") @RequestParam String key
    ) {
        StoreDescriptor descriptor = storeFactory.provider(store).descriptor();
        return ParsedKeyResponse.of(key,
                KeyGrammar.parseKey(key, descriptor).orElse(null),
                KeyGrammar.keyToExportName(key, descriptor));
    }
}
