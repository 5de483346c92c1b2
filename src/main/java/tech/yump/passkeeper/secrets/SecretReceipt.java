package tech.yump.passkeeper.secrets;

/**
 * Confirmation returned by mutating secret operations.
 */
public record SecretReceipt(
        boolean status,
        String msg,
        String id
) {
}
