package tech.yump.envr.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import tech.yump.envr.key.CompositeKey;

@Schema(description = "A composite key decoded with a store's grammar")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParsedKeyResponse(
        @Schema(description = "Key as given.")
        String key,
        @Schema(description = "Whether the key has the five segments of a composite key.")
        boolean parsed,
        String prefix,
        String domain,
        String project,
        String version,
        String name,
        @Schema(description = "Flat name used when exporting the key.", example = "DATABASE_URL")
        String exportName
) {
    public static ParsedKeyResponse of(String key, CompositeKey composite, String exportName) {
        if (composite == null) {
            return new ParsedKeyResponse(key, false, null, null, null, null, null, exportName);
        }
        return new ParsedKeyResponse(key, true, composite.prefix(), composite.domain(), composite.project(),
                composite.version(), composite.name(), exportName);
    }
}
