package tech.yump.passkeeper.secrets.note;

public record NoteItem(
        String id,
        String name
) {
}
