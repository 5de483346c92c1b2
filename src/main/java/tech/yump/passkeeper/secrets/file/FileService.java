package tech.yump.passkeeper.secrets.file;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.passkeeper.core.ValidationException;
import tech.yump.passkeeper.crypto.BlobCipher;
import tech.yump.passkeeper.crypto.FieldCipher;
import tech.yump.passkeeper.secrets.AbstractSecretService;
import tech.yump.passkeeper.storage.BlobAlreadyExistsException;
import tech.yump.passkeeper.storage.BlobStore;
import tech.yump.passkeeper.sync.SyncTracker;

/**
 * Binary files. The row keeps the name and encrypted meta; the content is AES-GCM encrypted
 * and written to the blob store under {@code ownerId/name}.
 * <p>
 * The blob is written before the row on add and removed before the row on remove. Blob writes are
 * create-only, so a concurrent add of the same name fails instead of replacing stored content.
 * Neither step is compensated, so a failure in between leaves an orphaned blob or a row without content.
 */
@Slf4j
@Service
public class FileService extends AbstractSecretService<FileInput, StoredFile, FileSecret, FileItem> {

    private final FileStorage fileStorage;
    private final BlobStore blobStore;
    private final BlobCipher blobCipher;

    public FileService(FileStorage fileStorage,
                       BlobStore blobStore,
                       BlobCipher blobCipher,
                       FieldCipher fieldCipher,
                       SyncTracker syncTracker) {
        super("File", fileStorage, fieldCipher, syncTracker);
        this.fileStorage = fileStorage;
        this.blobStore = blobStore;
        this.blobCipher = blobCipher;
    }

    @Override
    protected FileInput validate(FileInput input) {
        requireText(input.name(), "name");
        String name = input.name();
        if (name.contains("/") || name.contains("\\") || name.contains("..")) {
            throw new ValidationException("name must not contain path separators");
        }
        if (input.content() == null) {
            throw new ValidationException("content is required");
        }
        return input;
    }

    @Override
    protected StoredFile seal(String ownerId, FileInput input) {
        if (fileStorage.existsByName(ownerId, input.name())) {
            throw new ValidationException("file with name " + input.name() + " already exists");
        }
        String key = BlobStore.objectKey(ownerId, input.name());
        try {
            blobStore.putObject(key, blobCipher.encrypt(input.content()));
        } catch (BlobAlreadyExistsException e) {
            throw new ValidationException("file with name " + input.name() + " already exists");
        }
        log.debug("Stored encrypted content for file '{}' of owner '{}'", input.name(), ownerId);
        return new StoredFile(null, input.name(), encryptField(input.meta()));
    }

    @Override
    protected void onAddFailure(String ownerId, StoredFile record, RuntimeException cause) {
        // seal has already written the blob by the time the row insert runs
        log.error("File row for owner '{}' was not stored, blob '{}' is orphaned: {}",
                ownerId, BlobStore.objectKey(ownerId, record.name()), cause.getMessage());
    }

    @Override
    protected FileSecret unseal(String ownerId, StoredFile record) {
        byte[] content = blobCipher.decrypt(blobStore.getObject(BlobStore.objectKey(ownerId, record.name())));
        return new FileSecret(record.id(), record.name(), decryptField(record.meta()), content);
    }

    @Override
    protected void beforeRemove(String ownerId, String id) {
        fileStorage.find(ownerId, id).ifPresent(file -> {
            String key = BlobStore.objectKey(ownerId, file.name());
            blobStore.removeObject(key);
            log.debug("Removed blob '{}' before deleting file row {}", key, id);
        });
    }
}
