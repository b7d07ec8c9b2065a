package tech.yump.envr.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.envr.service.SecretTransferService;

@RestController
@RequestMapping("/v1/generate")
@RequiredArgsConstructor
@Tag(name = "Generate", description = "Configuration snippets built from the keychain manifest")
public class GenerateController {

    private final SecretTransferService transferService;

    @GetMapping("/codebuild-env")
    @Operation(
            summary = "CodeBuild parameter-store env",
            description = "Renders an AWS CodeBuild buildspec env.parameter-store block for every keychain name of the scope. "
                    + "Empty when the keychain holds no names."
    )
    public ResponseEntity<String> codebuildEnv(
            @RequestParam(required = false) String project,
            @RequestParam(required = false) String domain,
            @Parameter(description = "SSM path prefix; defaults to the domain's configured prefix, then /envr/.", example = "/acme/test/")
            @RequestParam(required = false) String prefix,
            @Parameter(description = "Value for {env} in a configured domain prefix.", example = "test")
            @RequestParam(required = false) String env
    ) {
        String body = transferService.generateCodebuildEnv(project, domain, prefix, env);
        return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(body);
    }
}
