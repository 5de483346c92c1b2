package tech.yump.passkeeper.secrets.note;

public record NoteSecret(
        String id,
        String name,
        String content,
        String meta
) {
    @Override
    public String toString() {
        return "NoteSecret[id=" + id + ", name=" + name + ", content=******, meta=******]";
    }
}
