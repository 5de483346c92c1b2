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
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import tech.yump.passkeeper.api.ApiError;
import tech.yump.passkeeper.api.dto.ReceiptResponse;
import tech.yump.passkeeper.api.dto.SearchResponse;
import tech.yump.passkeeper.auth.AccessControlFilter;
import tech.yump.passkeeper.config.OpenApiConfig;
import tech.yump.passkeeper.core.ValidationException;
import tech.yump.passkeeper.secrets.SearchQuery;
import tech.yump.passkeeper.secrets.file.FileInput;
import tech.yump.passkeeper.secrets.file.FileItem;
import tech.yump.passkeeper.secrets.file.FileSecret;
import tech.yump.passkeeper.secrets.file.FileService;

import java.io.IOException;

/**
 * Binary files. Uploads are multipart; downloads return the content base64 encoded in JSON.
 */
@RestController
@RequestMapping("/v1/files")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Files", description = "Binary files, content encrypted in the blob store")
@SecurityRequirement(name = OpenApiConfig.SECURITY_SCHEME_NAME)
@ApiResponses(value = {
        @ApiResponse(responseCode = "401", description = "Missing, invalid or expired token.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
        @ApiResponse(responseCode = "403", description = "Role not allowed for this operation.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
        @ApiResponse(responseCode = "500", description = "Internal server error, including blob store failures.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
})
public class FileController {

    private final FileService fileService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Upload file", description = "Encrypts the content into the blob store and records the file. Names are unique per user and must not contain path separators.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "File stored."),
            @ApiResponse(responseCode = "400", description = "Invalid name, missing content or name already used.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ReceiptResponse> add(
            @Parameter(hidden = true) @RequestAttribute(AccessControlFilter.OWNER_ID_ATTRIBUTE) String ownerId,
            @Parameter(description = "File name, a single path segment.", required = true, example = "passport.pdf")
            @RequestParam("name") String name,
            @Parameter(description = "Free-form metadata. Stored encrypted.")
            @RequestParam(value = "meta", required = false) String meta,
            @Parameter(description = "File content.", required = true)
            @RequestPart("content") MultipartFile content) {
        log.debug("Received upload of '{}' ({} bytes) for owner '{}'", name, content.getSize(), ownerId);
        byte[] bytes;
        try {
            bytes = content.getBytes();
        } catch (IOException e) {
            log.warn("Failed to read uploaded content for '{}': {}", name, e.getMessage());
            throw new ValidationException("content could not be read");
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(ReceiptResponse.from(fileService.add(ownerId, new FileInput(name, meta, bytes))));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Search files", description = "Matches the file name, ordered by name.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Matching page returned."),
            @ApiResponse(responseCode = "400", description = "Zero or negative limit, or negative offset.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<SearchResponse<FileItem>> search(
            @Parameter(hidden = true) @RequestAttribute(AccessControlFilter.OWNER_ID_ATTRIBUTE) String ownerId,
            @RequestParam(defaultValue = "") String substring,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "0") int limit) {
        return ResponseEntity.ok(SearchResponse.from(fileService.search(ownerId, new SearchQuery(substring, offset, limit))));
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Download file", description = "Returns meta decrypted and the decrypted content as base64.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "File returned."),
            @ApiResponse(responseCode = "400", description = "File not found for the caller.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<FileSecret> getSecret(
            @Parameter(hidden = true) @RequestAttribute(AccessControlFilter.OWNER_ID_ATTRIBUTE) String ownerId,
            @PathVariable String id) {
        log.debug("Received download request for file {} of owner '{}'", id, ownerId);
        return ResponseEntity.ok(fileService.getSecret(ownerId, id));
    }

    @DeleteMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Remove file", description = "Deletes the stored content, then the file record.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "File removed."),
            @ApiResponse(responseCode = "400", description = "File not found for the caller.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ReceiptResponse> remove(
            @Parameter(hidden = true) @RequestAttribute(AccessControlFilter.OWNER_ID_ATTRIBUTE) String ownerId,
            @PathVariable String id) {
        return ResponseEntity.ok(ReceiptResponse.from(fileService.remove(ownerId, id)));
    }
}
