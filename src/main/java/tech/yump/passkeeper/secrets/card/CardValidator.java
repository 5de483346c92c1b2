package tech.yump.passkeeper.secrets.card;

import tech.yump.passkeeper.core.ValidationException;

/**
 * Normalization, range checks, Luhn checksum and display mask for payment cards.
 */
public final class CardValidator {

    private static final int MIN_MONTH = 1;
    private static final int MAX_MONTH = 12;
    private static final int MIN_YEAR = 1970;
    private static final int MIN_CVC_LENGTH = 3;
    private static final int MAX_CVC_LENGTH = 4;
    private static final int MIN_PIN_LENGTH = 4;
    private static final int MAX_PIN_LENGTH = 6;
    private static final int MIN_NUMBER_LENGTH = 13;
    private static final int MAX_NUMBER_LENGTH = 19;
    private static final int VISIBLE_DIGITS = 4;

    private CardValidator() {
    }

    /**
     * Strips whitespace from number, CVC and PIN, then validates every field.
     *
     * @return the normalized card
     * @throws ValidationException naming the first invalid field
     */
    public static CardInput validate(CardInput card) {
        if (card == null) {
            throw new ValidationException("card is required");
        }
        CardInput normalized = new CardInput(
                card.name(),
                stripWhitespace(card.number()),
                card.month(),
                card.year(),
                stripWhitespace(card.cvc()),
                stripWhitespace(card.pin()));

        if (normalized.name() == null || normalized.name().isBlank()) {
            throw new ValidationException("name is required");
        }
        if (normalized.month() < MIN_MONTH || normalized.month() > MAX_MONTH) {
            throw new ValidationException("invalid month value");
        }
        if (normalized.year() < MIN_YEAR) {
            throw new ValidationException("invalid year value");
        }
        if (!isDigits(normalized.cvc(), MIN_CVC_LENGTH, MAX_CVC_LENGTH)) {
            throw new ValidationException("invalid cvc value");
        }
        if (!isDigits(normalized.pin(), MIN_PIN_LENGTH, MAX_PIN_LENGTH)) {
            throw new ValidationException("invalid pin value");
        }
        if (!isDigits(normalized.number(), MIN_NUMBER_LENGTH, MAX_NUMBER_LENGTH) || !passesLuhn(normalized.number())) {
            throw new ValidationException("invalid number value");
        }
        return normalized;
    }

    /**
     * Luhn checksum: double every second digit from the right, subtract 9 from results above 9,
     * valid when the digit sum is a multiple of 10.
     */
    public static boolean passesLuhn(String number) {
        if (number == null || number.isEmpty()) {
            return false;
        }
        int sum = 0;
        boolean alternate = false;
        for (int i = number.length() - 1; i >= 0; i--) {
            int digit = Character.digit(number.charAt(i), 10);
            if (digit < 0) {
                return false;
            }
            if (alternate) {
                digit *= 2;
                if (digit > 9) {
                    digit -= 9;
                }
            }
            sum += digit;
            alternate = !alternate;
        }
        return sum % 10 == 0;
    }

    /**
     * Replaces every digit but the last four with '*', a space after each group of four.
     * {@code 4242424242424242} becomes {@code **** **** **** 4242}.
     */
    public static String mask(String number) {
        if (number == null || number.length() < VISIBLE_DIGITS) {
            throw new ValidationException("invalid number value");
        }
        int hidden = number.length() - VISIBLE_DIGITS;
        StringBuilder mask = new StringBuilder();
        for (int i = 0; i < hidden; i++) {
            mask.append('*');
            if (i % 4 == 3) {
                mask.append(' ');
            }
        }
        return mask.append(number, hidden, number.length()).toString();
    }

    private static String stripWhitespace(String value) {
        return value == null ? null : value.replaceAll("\\s+", "");
    }

    private static boolean isDigits(String value, int minLength, int maxLength) {
        if (value == null || value.length() < minLength || value.length() > maxLength) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
