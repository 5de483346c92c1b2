package tech.yump.passkeeper.secrets.file;

public record FileInput(
        String name,
        String meta,
        byte[] content
) {
    @Override
    public String toString() {
        return "FileInput[name=" + name + ", meta=******, content=" + (content == null ? "null" : content.length + " bytes") + "]";
    }
}
