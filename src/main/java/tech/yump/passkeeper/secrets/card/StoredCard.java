package tech.yump.passkeeper.secrets.card;

/**
 * Card row as persisted: {@code number}, {@code cvc} and {@code pin} hold field tokens.
 */
public record StoredCard(
        String id,
        String name,
        String number,
        String mask,
        int month,
        int year,
        String cvc,
        String pin
) {
}
