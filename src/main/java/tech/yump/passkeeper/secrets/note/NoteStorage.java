package tech.yump.passkeeper.secrets.note;

import tech.yump.passkeeper.secrets.SecretStorage;

public interface NoteStorage extends SecretStorage<StoredNote, NoteItem> {
}
