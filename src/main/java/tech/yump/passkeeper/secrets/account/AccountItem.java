package tech.yump.passkeeper.secrets.account;

public record AccountItem(
        String id,
        String login,
        String server
) {
}
