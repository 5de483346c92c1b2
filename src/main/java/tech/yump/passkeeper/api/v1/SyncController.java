package tech.yump.passkeeper.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.passkeeper.api.ApiError;
import tech.yump.passkeeper.api.dto.SyncResponse;
import tech.yump.passkeeper.auth.AccessControlFilter;
import tech.yump.passkeeper.config.OpenApiConfig;
import tech.yump.passkeeper.sync.SyncTracker;

@RestController
@RequestMapping("/v1/sync")
@RequiredArgsConstructor
@Tag(name = "Sync", description = "Change marker for client caches")
@SecurityRequirement(name = OpenApiConfig.SECURITY_SCHEME_NAME)
public class SyncController {

    private final SyncTracker syncTracker;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get sync timestamp", description = "Time of the caller's last add or remove. Clients refresh their cache when it is newer than their last sync.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Timestamp returned."),
            @ApiResponse(responseCode = "400", description = "The caller has not stored anything yet.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Missing, invalid or expired token.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<SyncResponse> get(
            @Parameter(hidden = true) @RequestAttribute(AccessControlFilter.OWNER_ID_ATTRIBUTE) String ownerId) {
        return ResponseEntity.ok(new SyncResponse(syncTracker.get(ownerId)));
    }
}
