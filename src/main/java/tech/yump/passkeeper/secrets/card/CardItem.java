package tech.yump.passkeeper.secrets.card;

public record CardItem(
        String id,
        String name,
        String mask
) {
}
