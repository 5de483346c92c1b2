package tech.yump.passkeeper.secrets.file;

public record FileSecret(
        String id,
        String name,
        String meta,
        byte[] content
) {
    @Override
    public String toString() {
        return "FileSecret[id=" + id + ", name=" + name + ", meta=******, content=******]";
    }
}
