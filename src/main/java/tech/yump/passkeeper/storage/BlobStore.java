package tech.yump.passkeeper.storage;

/**
 * Object storage for encrypted file content, keyed by {@code ownerId/name}.
 */
public interface BlobStore {

    /**
     * Stores the content under a key that must not be taken yet. Existing objects are never replaced.
     *
     * @throws BlobAlreadyExistsException if an object already exists under the key
     * @throws BlobStoreException if the write fails
     */
    void putObject(String key, byte[] content) throws BlobStoreException;

    /**
     * @throws BlobStoreException if the object does not exist or cannot be read
     */
    byte[] getObject(String key) throws BlobStoreException;

    /**
     * Removes the object. Removing a missing object is not an error.
     *
     * @throws BlobStoreException if the delete fails
     */
    void removeObject(String key) throws BlobStoreException;

    static String objectKey(String ownerId, String name) {
        return ownerId + "/" + name;
    }
}
