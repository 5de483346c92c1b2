package tech.yump.passkeeper.storage;

/**
 * Custom runtime exception for errors occurring within a BlobStore implementation.
 */
public class BlobStoreException extends RuntimeException {

  public BlobStoreException(String message) {
    super(message);
  }

  public BlobStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
