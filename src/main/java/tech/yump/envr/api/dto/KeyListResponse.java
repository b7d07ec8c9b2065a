package tech.yump.envr.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Keys listed from a store, sorted")
public record KeyListResponse(
        @Schema(description = "Store id.", example = "local")
        String store,
        @Schema(description = "Keys accepted by the store's read endpoint.", example = "[\"API_KEY\", \"DATABASE_URL\"]")
        List<String> keys
) {
}
