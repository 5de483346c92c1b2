package tech.yump.passkeeper.secrets.note;

public record NoteInput(
        String name,
        String content,
        String meta
) {
}
