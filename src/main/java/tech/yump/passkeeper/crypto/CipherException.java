package tech.yump.passkeeper.crypto;

/**
 * Custom runtime exception for field and blob encryption/decryption errors.
 */
public class CipherException extends RuntimeException {

    public CipherException(String message) {
        super(message);
    }

    public CipherException(String message, Throwable cause) {
        super(message, cause);
    }
}
