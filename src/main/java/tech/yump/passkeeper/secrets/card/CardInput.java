package tech.yump.passkeeper.secrets.card;

/**
 * Card details as submitted by the client.
 */
public record CardInput(
        String name,
        String number,
        int month,
        int year,
        String cvc,
        String pin
) {
}
