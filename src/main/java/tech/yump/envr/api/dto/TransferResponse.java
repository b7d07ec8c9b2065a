package tech.yump.envr.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Result of a transfer")
public record TransferResponse(
        @Schema(description = "Number of secrets written to the target store.", example = "12")
        int count
) {
}
