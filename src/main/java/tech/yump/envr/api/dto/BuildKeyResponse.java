package tech.yump.envr.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

public record BuildKeyResponse(
        @Schema(description = "Composite key in the store's grammar.", example = "envr--prod--billing--2_1_0--DATABASE_URL")
        String key
) {
}
