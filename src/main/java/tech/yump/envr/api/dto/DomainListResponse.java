package tech.yump.envr.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Domains holding at least one secret in a project")
public record DomainListResponse(
        @Schema(description = "Store id.", example = "local")
        String store,
        @Schema(description = "Project the domains belong to.", example = "billing")
        String project,
        @Schema(description = "Registered domains, sorted.", example = "[\"dev\", \"prod\"]")
        List<String> domains
) {
}
