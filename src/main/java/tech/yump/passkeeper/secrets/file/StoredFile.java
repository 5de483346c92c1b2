package tech.yump.passkeeper.secrets.file;

/**
 * File row as persisted: {@code meta} holds a field token. Content lives in the blob store.
 */
public record StoredFile(
        String id,
        String name,
        String meta
) {
}
