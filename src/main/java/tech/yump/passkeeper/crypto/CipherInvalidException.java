package tech.yump.passkeeper.crypto;

/**
 * Ciphertext is malformed, forged or corrupted: its integrity tag did not verify.
 */
public class CipherInvalidException extends CipherException {

    public CipherInvalidException(String message) {
        super(message);
    }

    public CipherInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
