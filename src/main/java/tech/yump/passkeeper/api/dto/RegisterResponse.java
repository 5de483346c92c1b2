package tech.yump.passkeeper.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Identifier of the newly registered user.")
public record RegisterResponse(
        @Schema(description = "User id, also the owner id of every secret the user stores.", example = "3f2a9c1e-8d4b-4e21-9a57-1c0d2e3f4a5b", requiredMode = Schema.RequiredMode.REQUIRED)
        String userId
) {
}
