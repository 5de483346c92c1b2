package tech.yump.passkeeper.auth.token;

/**
 * Base class for failures verifying an access token.
 */
public class TokenException extends RuntimeException {

    public TokenException(String message) {
        super(message);
    }

    public TokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
