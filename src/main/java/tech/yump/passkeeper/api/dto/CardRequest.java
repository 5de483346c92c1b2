package tech.yump.passkeeper.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import tech.yump.passkeeper.secrets.card.CardInput;

@Schema(description = "Payment card to store.")
public record CardRequest(
        @Schema(description = "Card name. Searchable.", example = "Personal Visa", requiredMode = Schema.RequiredMode.REQUIRED)
        String name,

        @Schema(description = "Card number, 13 to 19 digits, whitespace ignored. Stored encrypted.", example = "4242 4242 4242 4242", requiredMode = Schema.RequiredMode.REQUIRED)
        String number,

        @Schema(description = "Expiry month, 1 to 12.", example = "12", requiredMode = Schema.RequiredMode.REQUIRED)
        Integer month,

        @Schema(description = "Expiry year.", example = "2030", requiredMode = Schema.RequiredMode.REQUIRED)
        Integer year,

        @Schema(description = "Card verification code, 3 or 4 digits. Stored encrypted.", example = "123", requiredMode = Schema.RequiredMode.REQUIRED)
        String cvc,

        @Schema(description = "PIN, 4 to 6 digits. Stored encrypted.", example = "1234", requiredMode = Schema.RequiredMode.REQUIRED)
        String pin
) {
    public CardInput toInput() {
        return new CardInput(name, number, month == null ? 0 : month, year == null ? 0 : year, cvc, pin);
    }

    @Override
    public String toString() {
        return "CardRequest[name=" + name + ", number=******, month=" + month + ", year=" + year + ", cvc=***, pin=****]";
    }
}
