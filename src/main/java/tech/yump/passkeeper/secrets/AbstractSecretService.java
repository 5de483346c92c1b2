package tech.yump.passkeeper.secrets;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import tech.yump.passkeeper.core.ValidationException;
import tech.yump.passkeeper.crypto.CipherException;
import tech.yump.passkeeper.crypto.FieldCipher;
import tech.yump.passkeeper.sync.SyncTracker;

import java.util.Locale;

/**
 * Lifecycle shared by every secret kind: validate, encrypt, persist and signal the sync tracker on the way in;
 * fetch and decrypt on the way out. Subclasses supply the kind's validation and field layout.
 *
 * @param <I> client input
 * @param <R> stored record, sensitive fields encrypted
 * @param <S> decrypted secret returned to the owner
 * @param <T> search result item
 */
@Slf4j
public abstract class AbstractSecretService<I, R, S, T> {

    private final String kind;
    private final SecretStorage<R, T> storage;
    private final SyncTracker syncTracker;
    private final FieldCipher fieldCipher;

    protected AbstractSecretService(String kind, SecretStorage<R, T> storage, FieldCipher fieldCipher, SyncTracker syncTracker) {
        this.kind = kind;
        this.storage = storage;
        this.fieldCipher = fieldCipher;
        this.syncTracker = syncTracker;
    }

    /**
     * Validates and stores a new secret for the owner.
     *
     * @throws ValidationException on bad input
     * @throws tech.yump.passkeeper.core.BackendException on persistence failure
     */
    public SecretReceipt add(String ownerId, I input) {
        requireOwner(ownerId);
        if (input == null) {
            throw new ValidationException(kindLower() + " is required");
        }
        I validInput = validate(input);

        R record = seal(ownerId, validInput);
        String id;
        try {
            id = storage.add(ownerId, record);
        } catch (RuntimeException e) {
            onAddFailure(ownerId, record, e);
            throw e;
        }
        log.info("{} added for owner '{}': id {}", kind, ownerId, id);

        signalSync(ownerId);
        return new SecretReceipt(true, kind + " added: " + kindLower() + " id - " + id, id);
    }

    /**
     * Fetches and decrypts a secret owned by the caller.
     *
     * @throws SecretNotFoundException if the owner has no secret with this id
     * @throws CipherException if stored ciphertext fails to decrypt
     */
    public S getSecret(String ownerId, String id) {
        requireOwner(ownerId);
        requireId(id);
        R record = storage.find(ownerId, id)
                .orElseThrow(() -> {
                    log.debug("{} '{}' not found for owner '{}'", kind, id, ownerId);
                    return new SecretNotFoundException(kind);
                });
        try {
            S secret = unseal(ownerId, record);
            log.debug("{} '{}' decrypted for owner '{}'", kind, id, ownerId);
            return secret;
        } catch (CipherException e) {
            log.error("Failed to decrypt stored {} '{}' for owner '{}': {}", kindLower(), id, ownerId, e.getMessage(), e);
            throw e;
        }
    }

    /**
     * Searches the owner's secrets by display fields. Never decrypts.
     *
     * @throws ValidationException if the limit is zero or offset/limit are negative
     */
    public SearchPage<T> search(String ownerId, SearchQuery query) {
        requireOwner(ownerId);
        if (query == null) {
            throw new ValidationException("search query is required");
        }
        if (query.limit() == 0) {
            throw new ValidationException("limit can't be 0");
        }
        if (query.limit() < 0 || query.offset() < 0) {
            throw new ValidationException("offset and limit must not be negative");
        }
        SearchPage<T> page = storage.search(ownerId, query);
        log.debug("{} search for owner '{}' returned {} of {} matches", kind, ownerId, page.items().size(), page.count());
        return page;
    }

    /**
     * Deletes a secret owned by the caller.
     *
     * @throws SecretNotFoundException if the owner has no secret with this id
     */
    public SecretReceipt remove(String ownerId, String id) {
        requireOwner(ownerId);
        requireId(id);
        beforeRemove(ownerId, id);
        if (!storage.remove(ownerId, id)) {
            log.debug("{} '{}' not found for owner '{}' on remove", kind, id, ownerId);
            throw new SecretNotFoundException(kind);
        }
        log.info("{} removed for owner '{}': id {}", kind, ownerId, id);

        signalSync(ownerId);
        return new SecretReceipt(true, kind + " removed: " + kindLower() + " id - " + id, id);
    }

    /**
     * Kind-specific input checks.
     *
     * @return the input, normalized where the kind requires it
     * @throws ValidationException describing the first invalid field
     */
    protected abstract I validate(I input);

    /**
     * Encrypts the sensitive fields of a validated input into a storable record.
     */
    protected abstract R seal(String ownerId, I input);

    /**
     * Decrypts a stored record.
     */
    protected abstract S unseal(String ownerId, R record);

    /**
     * Runs before the row is deleted. The record may not exist.
     */
    protected void beforeRemove(String ownerId, String id) {
    }

    /**
     * Runs when a sealed record could not be stored. The exception is rethrown afterwards.
     */
    protected void onAddFailure(String ownerId, R record, RuntimeException cause) {
    }

    protected String encryptField(String value) {
        return fieldCipher.encryptText(value == null ? "" : value);
    }

    protected String decryptField(String token) {
        return fieldCipher.decryptText(token);
    }

    protected static void requireText(String value, String field) {
        if (!StringUtils.hasText(value)) {
            throw new ValidationException(field + " is required");
        }
    }

    private void signalSync(String ownerId) {
        try {
            syncTracker.set(ownerId);
        } catch (RuntimeException e) {
            // The mutation is committed; the marker only hints that something changed
            log.error("Failed to update sync marker for owner '{}' after {} mutation: {}", ownerId, kindLower(), e.getMessage(), e);
        }
    }

    private void requireOwner(String ownerId) {
        if (!StringUtils.hasText(ownerId)) {
            throw new ValidationException("owner id is required");
        }
    }

    private void requireId(String id) {
        if (!StringUtils.hasText(id)) {
            throw new ValidationException("secret_id is required");
        }
    }

    private String kindLower() {
        return kind.toLowerCase(Locale.ROOT);
    }
}
