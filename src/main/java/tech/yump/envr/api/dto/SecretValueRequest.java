package tech.yump.envr.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

@Schema(description = "Value to store for a secret")
public record SecretValueRequest(
        @NotNull(message = "value must not be null")
        @Schema(description = "Secret value.", example = "postgres://db:5432/billing", requiredMode = Schema.RequiredMode.REQUIRED)
        String value
) {
}
