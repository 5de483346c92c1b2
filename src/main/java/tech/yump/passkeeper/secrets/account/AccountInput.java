package tech.yump.passkeeper.secrets.account;

public record AccountInput(
        String login,
        String server,
        String password,
        String meta
) {
}
