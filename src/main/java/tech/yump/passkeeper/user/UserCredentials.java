package tech.yump.passkeeper.user;

/**
 * Stored user record: the owner id and the bcrypt hash of the password.
 */
public record UserCredentials(
        String userId,
        String login,
        String passwordHash
) {
    @Override
    public String toString() {
        return "UserCredentials[userId=" + userId + ", login=" + login + ", passwordHash=******]";
    }
}
