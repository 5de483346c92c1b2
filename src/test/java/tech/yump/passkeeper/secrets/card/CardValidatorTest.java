package tech.yump.passkeeper.secrets.card;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import tech.yump.passkeeper.core.ValidationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CardValidatorTest {

    private static CardInput card(String number, int month, int year, String cvc, String pin) {
        return new CardInput("Personal Visa", number, month, year, cvc, pin);
    }

    @Test
    @DisplayName("Valid card should be returned with whitespace stripped")
    void validate_WhenValid_ReturnsNormalizedCard() {
        CardInput normalized = CardValidator.validate(card("4242 4242 4242 4242", 12, 2030, " 123 ", "12 34"));

        assertThat(normalized.number()).isEqualTo("4242424242424242");
        assertThat(normalized.cvc()).isEqualTo("123");
        assertThat(normalized.pin()).isEqualTo("1234");
        assertThat(normalized.name()).isEqualTo("Personal Visa");
    }

    @ParameterizedTest
    @ValueSource(strings = {"4242424242424242", "4111111111111111", "5555555555554444", "378282246310005", "4222222222222"})
    @DisplayName("Known good card numbers should pass the Luhn check")
    void passesLuhn_WhenChecksumValid_ReturnsTrue(String number) {
        assertThat(CardValidator.passesLuhn(number)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"4242424242424241", "1234567812345678", "", "42424242x4242424"})
    @DisplayName("Bad checksums and non-digits should fail the Luhn check")
    void passesLuhn_WhenChecksumInvalid_ReturnsFalse(String number) {
        assertThat(CardValidator.passesLuhn(number)).isFalse();
    }

    @ParameterizedTest
    @CsvSource({
            "4242424242424242, 0, 2030, 123, 1234, invalid month value",
            "4242424242424242, 13, 2030, 123, 1234, invalid month value",
            "4242424242424242, 12, 1969, 123, 1234, invalid year value",
            "4242424242424242, 12, 2030, 12, 1234, invalid cvc value",
            "4242424242424242, 12, 2030, 12345, 1234, invalid cvc value",
            "4242424242424242, 12, 2030, 12a, 1234, invalid cvc value",
            "4242424242424242, 12, 2030, 123, 123, invalid pin value",
            "4242424242424242, 12, 2030, 123, 1234567, invalid pin value",
            "4242424242424241, 12, 2030, 123, 1234, invalid number value",
            "424242424242, 12, 2030, 123, 1234, invalid number value",
            "42424242424242424242, 12, 2030, 123, 1234, invalid number value"
    })
    @DisplayName("Out of range or malformed fields should be rejected with a message naming the field")
    void validate_WhenFieldInvalid_ThrowsValidationException(String number, int month, int year, String cvc, String pin, String message) {
        assertThatThrownBy(() -> CardValidator.validate(card(number, month, year, cvc, pin)))
                .isInstanceOf(ValidationException.class)
                .hasMessage(message);
    }

    @Test
    @DisplayName("Missing name should be rejected")
    void validate_WhenNameMissing_ThrowsValidationException() {
        CardInput noName = new CardInput(" ", "4242424242424242", 12, 2030, "123", "1234");

        assertThatThrownBy(() -> CardValidator.validate(noName))
                .isInstanceOf(ValidationException.class)
                .hasMessage("name is required");
    }

    @Test
    @DisplayName("Mask should hide all but the last four digits in groups of four")
    void mask_ReturnsGroupedMask() {
        assertThat(CardValidator.mask("4242424242424242")).isEqualTo("**** **** **** 4242");
        assertThat(CardValidator.mask("378282246310005")).isEqualTo("**** **** ***0005");
        assertThat(CardValidator.mask("4222222222222")).isEqualTo("**** **** *2222");
    }
}
