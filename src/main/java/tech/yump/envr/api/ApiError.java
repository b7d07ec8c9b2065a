package tech.yump.envr.api;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "RFC 7807 problem response returned for failed requests")
public record ApiError(
        @Schema(description = "Short summary of the problem type.", example = "Invalid Version", requiredMode = Schema.RequiredMode.REQUIRED)
        String title,
        @Schema(description = "HTTP status code.", example = "400", requiredMode = Schema.RequiredMode.REQUIRED)
        int status,
        @Schema(description = "Detailed error message.", example = "Version '1.0' is not a valid semantic version.")
        String detail,
        @Schema(description = "Request path that produced the error.", example = "/v1/stores/aws/secrets")
        String instance
) {
}
