package tech.yump.passkeeper.auth;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import tech.yump.passkeeper.auth.token.TokenService;
import tech.yump.passkeeper.core.ValidationException;
import tech.yump.passkeeper.user.UserAlreadyExistsException;
import tech.yump.passkeeper.user.UserCredentials;
import tech.yump.passkeeper.user.UserStorage;

import java.nio.charset.StandardCharsets;

/**
 * Registers users and exchanges credentials for access tokens.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    public static final String USER_ROLE = "user";

    // BCrypt only hashes the first 72 bytes and the encoder rejects anything longer
    private static final int MAX_PASSWORD_BYTES = 72;

    private final UserStorage userStorage;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokenService;

    /**
     * @return the new user's id
     * @throws ValidationException        if login or password is missing, or the password exceeds 72 bytes
     * @throws UserAlreadyExistsException if the login is taken
     */
    public String register(String login, String password) {
        requireCredentials(login, password);
        String userId = userStorage.saveUser(login, passwordEncoder.encode(password));
        log.info("Registered user '{}' with id {}", login, userId);
        return userId;
    }

    /**
     * @return an access token carrying the user id and role {@value #USER_ROLE}
     * @throws InvalidCredentialsException if the login is unknown or the password does not match
     */
    public String login(String login, String password) {
        requireCredentials(login, password);
        UserCredentials user = userStorage.findByLogin(login)
                .filter(found -> passwordEncoder.matches(password, found.passwordHash()))
                .orElseThrow(() -> {
                    log.warn("Failed login attempt for '{}'", login);
                    return new InvalidCredentialsException();
                });
        log.info("User '{}' logged in", login);
        return tokenService.generate(user.userId(), USER_ROLE);
    }

    private static void requireCredentials(String login, String password) {
        if (!StringUtils.hasText(login)) {
            throw new ValidationException("login is required");
        }
        if (!StringUtils.hasText(password)) {
            throw new ValidationException("password is required");
        }
        if (password.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES) {
            throw new ValidationException("password must not be longer than " + MAX_PASSWORD_BYTES + " bytes");
        }
    }
}
