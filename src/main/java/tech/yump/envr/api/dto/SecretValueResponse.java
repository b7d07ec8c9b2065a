package tech.yump.envr.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "A secret read from a store")
public record SecretValueResponse(
        @Schema(description = "Key as requested.", example = "DATABASE_URL")
        String key,
        @Schema(description = "Secret value.", example = "postgres://db:5432/billing")
        String value
) {
}
