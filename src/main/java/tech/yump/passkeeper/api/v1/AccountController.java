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
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.passkeeper.api.ApiError;
import tech.yump.passkeeper.api.dto.AccountRequest;
import tech.yump.passkeeper.api.dto.ReceiptResponse;
import tech.yump.passkeeper.api.dto.SearchResponse;
import tech.yump.passkeeper.auth.AccessControlFilter;
import tech.yump.passkeeper.config.OpenApiConfig;
import tech.yump.passkeeper.secrets.SearchQuery;
import tech.yump.passkeeper.secrets.account.AccountItem;
import tech.yump.passkeeper.secrets.account.AccountSecret;
import tech.yump.passkeeper.secrets.account.AccountService;

@RestController
@RequestMapping("/v1/accounts")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Accounts", description = "Login/password accounts")
@SecurityRequirement(name = OpenApiConfig.SECURITY_SCHEME_NAME)
@ApiResponses(value = {
        @ApiResponse(responseCode = "401", description = "Missing, invalid or expired token.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
        @ApiResponse(responseCode = "403", description = "Role not allowed for this operation.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
        @ApiResponse(responseCode = "500", description = "Internal server error.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
})
public class AccountController {

    private final AccountService accountService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Add account", description = "Stores an account. Password and meta are encrypted at rest; login and server stay searchable.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Account stored."),
            @ApiResponse(responseCode = "400", description = "Invalid account data.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ReceiptResponse> add(
            @Parameter(hidden = true) @RequestAttribute(AccessControlFilter.OWNER_ID_ATTRIBUTE) String ownerId,
            @RequestBody AccountRequest request) {
        log.debug("Received add account request for owner '{}'", ownerId);
        return ResponseEntity.status(HttpStatus.CREATED).body(ReceiptResponse.from(accountService.add(ownerId, request.toInput())));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Search accounts", description = "Matches login and server, ordered by server then login.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Matching page returned."),
            @ApiResponse(responseCode = "400", description = "Zero or negative limit, or negative offset.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<SearchResponse<AccountItem>> search(
            @Parameter(hidden = true) @RequestAttribute(AccessControlFilter.OWNER_ID_ATTRIBUTE) String ownerId,
            @Parameter(description = "Case-insensitive substring. Empty matches everything.", example = "mail")
            @RequestParam(defaultValue = "") String substring,
            @Parameter(description = "Number of matches to skip.", example = "0")
            @RequestParam(defaultValue = "0") int offset,
            @Parameter(description = "Maximum number of items to return. Must be positive.", example = "20")
            @RequestParam(defaultValue = "0") int limit) {
        log.debug("Received account search request for owner '{}' (offset {}, limit {})", ownerId, offset, limit);
        return ResponseEntity.ok(SearchResponse.from(accountService.search(ownerId, new SearchQuery(substring, offset, limit))));
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get account secret", description = "Returns the account with password and meta decrypted.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Decrypted account returned."),
            @ApiResponse(responseCode = "400", description = "Account not found for the caller.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<AccountSecret> getSecret(
            @Parameter(hidden = true) @RequestAttribute(AccessControlFilter.OWNER_ID_ATTRIBUTE) String ownerId,
            @Parameter(description = "Account id.", required = true) @PathVariable String id) {
        log.debug("Received get account request for owner '{}', id {}", ownerId, id);
        return ResponseEntity.ok(accountService.getSecret(ownerId, id));
    }

    @DeleteMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Remove account", description = "Deletes one of the caller's accounts.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Account removed."),
            @ApiResponse(responseCode = "400", description = "Account not found for the caller.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ReceiptResponse> remove(
            @Parameter(hidden = true) @RequestAttribute(AccessControlFilter.OWNER_ID_ATTRIBUTE) String ownerId,
            @Parameter(description = "Account id.", required = true) @PathVariable String id) {
        log.debug("Received remove account request for owner '{}', id {}", ownerId, id);
        return ResponseEntity.ok(ReceiptResponse.from(accountService.remove(ownerId, id)));
    }
}
