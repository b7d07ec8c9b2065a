package tech.yump.envr.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "Logical key to encode with a store's grammar")
public record BuildKeyRequest(
        @NotBlank(message = "store must not be blank")
        @Schema(description = "Store id whose grammar is used.", example = "gcp", requiredMode = Schema.RequiredMode.REQUIRED)
        String store,
        @NotBlank(message = "name must not be blank")
        @Schema(description = "Secret name.", example = "DATABASE_URL", requiredMode = Schema.RequiredMode.REQUIRED)
        String name,
        @Schema(description = "Project; blank for the store's default namespace.", example = "billing")
        String project,
        @Schema(description = "Domain; blank for the store's default namespace.", example = "prod")
        String domain,
        @Schema(description = "Semantic version; blank for 1.0.0.", example = "2.1.0")
        String version
) {
}
