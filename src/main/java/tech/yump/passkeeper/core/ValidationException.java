package tech.yump.passkeeper.core;

/**
 * Malformed or missing client input. Reported to the caller as an invalid argument.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
