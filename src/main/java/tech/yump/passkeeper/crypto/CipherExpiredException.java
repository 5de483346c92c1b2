package tech.yump.passkeeper.crypto;

/**
 * An authentic field token is older than the accepted maximum age.
 */
public class CipherExpiredException extends CipherException {

    public CipherExpiredException(String message) {
        super(message);
    }
}
