package tech.yump.passkeeper.secrets.note;

/**
 * Note row as persisted: {@code content} and {@code meta} hold field tokens.
 */
public record StoredNote(
        String id,
        String name,
        String content,
        String meta
) {
}
