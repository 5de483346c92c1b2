package tech.yump.passkeeper.secrets.note;

import org.springframework.stereotype.Service;
import tech.yump.passkeeper.core.ValidationException;
import tech.yump.passkeeper.crypto.FieldCipher;
import tech.yump.passkeeper.secrets.AbstractSecretService;
import tech.yump.passkeeper.sync.SyncTracker;

@Service
public class NoteService extends AbstractSecretService<NoteInput, StoredNote, NoteSecret, NoteItem> {

    public NoteService(NoteStorage noteStorage, FieldCipher fieldCipher, SyncTracker syncTracker) {
        super("Note", noteStorage, fieldCipher, syncTracker);
    }

    @Override
    protected NoteInput validate(NoteInput input) {
        requireText(input.name(), "name");
        if (input.content() == null || input.content().isEmpty()) {
            throw new ValidationException("content is required");
        }
        return input;
    }

    @Override
    protected StoredNote seal(String ownerId, NoteInput input) {
        return new StoredNote(null, input.name(), encryptField(input.content()), encryptField(input.meta()));
    }

    @Override
    protected NoteSecret unseal(String ownerId, StoredNote record) {
        return new NoteSecret(record.id(), record.name(), decryptField(record.content()), decryptField(record.meta()));
    }
}
