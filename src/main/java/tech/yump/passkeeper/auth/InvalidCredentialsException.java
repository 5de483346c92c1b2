package tech.yump.passkeeper.auth;

/**
 * Unknown login or wrong password. The message does not say which.
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException() {
        super("invalid login or password");
    }
}
