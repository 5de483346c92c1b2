package tech.yump.passkeeper.auth.token;

/**
 * The token is malformed, its signature does not verify or its claims are incomplete.
 */
public class TokenInvalidException extends TokenException {

    public TokenInvalidException(String message) {
        super(message);
    }

    public TokenInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
