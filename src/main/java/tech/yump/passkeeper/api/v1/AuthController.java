package tech.yump.passkeeper.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.passkeeper.api.dto.CredentialsRequest;
import tech.yump.passkeeper.api.dto.LoginResponse;
import tech.yump.passkeeper.api.dto.RegisterResponse;
import tech.yump.passkeeper.auth.AuthService;

@RestController
@RequestMapping("/v1/auth")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Auth", description = "User registration and login")
public class AuthController {

    private final AuthService authService;

    @PostMapping(value = "/register", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Register user", description = "Creates a user with a unique login. The returned id owns every secret the user stores.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "User registered."),
            @ApiResponse(responseCode = "400", description = "Login or password missing.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Login already taken.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<RegisterResponse> register(@RequestBody CredentialsRequest request) {
        log.info("Received registration request for login '{}'", request.login());
        String userId = authService.register(request.login(), request.password());
        return ResponseEntity.status(HttpStatus.CREATED).body(new RegisterResponse(userId));
    }

    @PostMapping(value = "/login", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Log in", description = "Exchanges login and password for a bearer token.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Token issued."),
            @ApiResponse(responseCode = "400", description = "Invalid login or password.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<LoginResponse> login(@RequestBody CredentialsRequest request) {
        log.info("Received login request for '{}'", request.login());
        return ResponseEntity.ok(new LoginResponse(authService.login(request.login(), request.password())));
    }
}
