package tech.yump.passkeeper.secrets.file;

public record FileItem(
        String id,
        String name
) {
}
