package tech.yump.passkeeper.core;

/**
 * Custom runtime exception for failures of the relational storage backend.
 */
public class BackendException extends RuntimeException {

    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
