package tech.yump.envr.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.envr.api.ApiError;
import tech.yump.envr.api.dto.TransferRequest;
import tech.yump.envr.api.dto.TransferResponse;
import tech.yump.envr.service.SecretTransferService;

@RestController
@RequestMapping("/v1/transfers")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Transfers", description = "Copy secrets between stores")
public class TransfersController {

    private final SecretTransferService transferService;

    @PostMapping
    @Operation(
            summary = "Transfer secrets",
            description = "Copies every readable secret of the source store into the target store under the same project, domain and version."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Secrets copied."),
            @ApiResponse(responseCode = "400", description = "Invalid request or version.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "404", description = "Unknown store.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "405", description = "The source store is write-only.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public TransferResponse transfer(@Valid @RequestBody TransferRequest request) {
        log.info("Received transfer request from '{}' to '{}'", request.from(), request.to());
        int count = transferService.push(request.from(), request.to(), request.project(), request.domain(), request.version());
        return new TransferResponse(count);
    }
}
