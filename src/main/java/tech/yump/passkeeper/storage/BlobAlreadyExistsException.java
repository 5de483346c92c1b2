package tech.yump.passkeeper.storage;

/**
 * Thrown when a blob is written under a key that is already taken.
 */
public class BlobAlreadyExistsException extends BlobStoreException {

  public BlobAlreadyExistsException(String message) {
    super(message);
  }

  public BlobAlreadyExistsException(String message, Throwable cause) {
    super(message, cause);
  }
}
