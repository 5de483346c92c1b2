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
import tech.yump.passkeeper.api.dto.NoteRequest;
import tech.yump.passkeeper.api.dto.ReceiptResponse;
import tech.yump.passkeeper.api.dto.SearchResponse;
import tech.yump.passkeeper.auth.AccessControlFilter;
import tech.yump.passkeeper.config.OpenApiConfig;
import tech.yump.passkeeper.secrets.SearchQuery;
import tech.yump.passkeeper.secrets.note.NoteItem;
import tech.yump.passkeeper.secrets.note.NoteSecret;
import tech.yump.passkeeper.secrets.note.NoteService;

@RestController
@RequestMapping("/v1/notes")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Notes", description = "Free-text notes")
@SecurityRequirement(name = OpenApiConfig.SECURITY_SCHEME_NAME)
@ApiResponses(value = {
        @ApiResponse(responseCode = "401", description = "Missing, invalid or expired token.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
        @ApiResponse(responseCode = "403", description = "Role not allowed for this operation.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
        @ApiResponse(responseCode = "500", description = "Internal server error.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
})
public class NoteController {

    private final NoteService noteService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Add note", description = "Stores a note. Content and meta are encrypted at rest; the name stays searchable.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Note stored."),
            @ApiResponse(responseCode = "400", description = "Invalid note data.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ReceiptResponse> add(
            @Parameter(hidden = true) @RequestAttribute(AccessControlFilter.OWNER_ID_ATTRIBUTE) String ownerId,
            @RequestBody NoteRequest request) {
        log.debug("Received add note request for owner '{}'", ownerId);
        return ResponseEntity.status(HttpStatus.CREATED).body(ReceiptResponse.from(noteService.add(ownerId, request.toInput())));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Search notes", description = "Matches the note name, ordered by name.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Matching page returned."),
            @ApiResponse(responseCode = "400", description = "Zero or negative limit, or negative offset.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<SearchResponse<NoteItem>> search(
            @Parameter(hidden = true) @RequestAttribute(AccessControlFilter.OWNER_ID_ATTRIBUTE) String ownerId,
            @Parameter(description = "Case-insensitive substring. Empty matches everything.", example = "wifi")
            @RequestParam(defaultValue = "") String substring,
            @Parameter(description = "Number of matches to skip.", example = "0")
            @RequestParam(defaultValue = "0") int offset,
            @Parameter(description = "Maximum number of items to return. Must be positive.", example = "20")
            @RequestParam(defaultValue = "0") int limit) {
        log.debug("Received note search request for owner '{}' (offset {}, limit {})", ownerId, offset, limit);
        return ResponseEntity.ok(SearchResponse.from(noteService.search(ownerId, new SearchQuery(substring, offset, limit))));
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get note secret", description = "Returns the note with content and meta decrypted.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Decrypted note returned."),
            @ApiResponse(responseCode = "400", description = "Note not found for the caller.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<NoteSecret> getSecret(
            @Parameter(hidden = true) @RequestAttribute(AccessControlFilter.OWNER_ID_ATTRIBUTE) String ownerId,
            @Parameter(description = "Note id.", required = true) @PathVariable String id) {
        log.debug("Received get note request for owner '{}', id {}", ownerId, id);
        return ResponseEntity.ok(noteService.getSecret(ownerId, id));
    }

    @DeleteMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Remove note", description = "Deletes one of the caller's notes.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Note removed."),
            @ApiResponse(responseCode = "400", description = "Note not found for the caller.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ReceiptResponse> remove(
            @Parameter(hidden = true) @RequestAttribute(AccessControlFilter.OWNER_ID_ATTRIBUTE) String ownerId,
            @Parameter(description = "Note id.", required = true) @PathVariable String id) {
        log.debug("Received remove note request for owner '{}', id {}", ownerId, id);
        return ResponseEntity.ok(ReceiptResponse.from(noteService.remove(ownerId, id)));
    }
}
