package tech.yump.passkeeper.secrets.account;

/**
 * Account row as persisted: {@code password} and {@code meta} hold field tokens.
 */
public record StoredAccount(
        String id,
        String login,
        String server,
        String password,
        String meta
) {
}
