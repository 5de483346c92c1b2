package tech.yump.passkeeper.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import tech.yump.passkeeper.secrets.SecretReceipt;

@Schema(description = "Result of adding or removing a secret.")
public record ReceiptResponse(
        @Schema(description = "Whether the operation succeeded.", example = "true", requiredMode = Schema.RequiredMode.REQUIRED)
        boolean status,

        @Schema(description = "Human readable summary.", example = "Account added: account id - 3f2a9c1e-8d4b-4e21-9a57-1c0d2e3f4a5b", requiredMode = Schema.RequiredMode.REQUIRED)
        String msg,

        @Schema(description = "Id of the affected secret.", example = "3f2a9c1e-8d4b-4e21-9a57-1c0d2e3f4a5b", requiredMode = Schema.RequiredMode.REQUIRED)
        String id
) {
    public static ReceiptResponse from(SecretReceipt receipt) {
        return new ReceiptResponse(receipt.status(), receipt.msg(), receipt.id());
    }
}
