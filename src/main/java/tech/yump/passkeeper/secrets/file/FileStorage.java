package tech.yump.passkeeper.secrets.file;

import tech.yump.passkeeper.secrets.SecretStorage;

public interface FileStorage extends SecretStorage<StoredFile, FileItem> {

    /**
     * @return {@code true} if the owner already has a file with this name
     */
    boolean existsByName(String ownerId, String name);
}
