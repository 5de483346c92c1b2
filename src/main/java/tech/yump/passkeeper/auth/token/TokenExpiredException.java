package tech.yump.passkeeper.auth.token;

/**
 * The token signature is valid but its expiration time has passed.
 */
public class TokenExpiredException extends TokenException {

    public TokenExpiredException(String message, Throwable cause) {
        super(message, cause);
    }
}
