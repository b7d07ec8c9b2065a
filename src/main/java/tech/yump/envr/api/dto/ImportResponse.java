package tech.yump.envr.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Result of an import")
public record ImportResponse(
        @Schema(description = "Store the variables were written to.", example = "local")
        String store,
        @Schema(description = "Number of variables imported.", example = "5")
        int imported
) {
}
