package tech.yump.envr.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "Copy every secret of one store into another")
public record TransferRequest(
        @NotBlank(message = "from must not be blank")
        @Schema(description = "Source store id.", example = "local", requiredMode = Schema.RequiredMode.REQUIRED)
        String from,
        @NotBlank(message = "to must not be blank")
        @Schema(description = "Target store id.", example = "aws", requiredMode = Schema.RequiredMode.REQUIRED)
        String to,
        @Schema(description = "Project; blank for the configured default.", example = "billing")
        String project,
        @Schema(description = "Domain; blank for the store's default namespace.", example = "prod")
        String domain,
        @Schema(description = "Semantic version; blank for the configured default.", example = "1.0.0")
        String version
) {
}
