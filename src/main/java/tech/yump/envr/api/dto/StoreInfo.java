package tech.yump.envr.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import tech.yump.envr.store.StoreProvider;

@Schema(description = "A secret store backend and its key grammar")
public record StoreInfo(
        @Schema(description = "Store id used in request paths.", example = "aws")
        String id,
        @Schema(description = "Human readable backend name.", example = "AWS Systems Manager Parameter Store")
        String displayName,
        @Schema(description = "Separator between composite key segments.", example = "/")
        String keySeparator,
        @Schema(description = "Replacement for the dots of a version.", example = ".")
        String versionSeparator,
        @Schema(description = "First segment of every composite key.", example = "envr")
        String prefix,
        @Schema(description = "Segment used for a blank project or domain.", example = "_default_")
        String defaultNamespace
) {
    public static StoreInfo from(StoreProvider provider) {
        return new StoreInfo(
                provider.name(),
                provider.displayName(),
                provider.descriptor().keySeparator(),
                provider.descriptor().versionSeparator(),
                provider.descriptor().prefix(),
                provider.descriptor().defaultNamespace());
    }
}
