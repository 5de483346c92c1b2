package tech.yump.passkeeper.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Access token issued on successful login.")
public record LoginResponse(
        @Schema(description = "Signed access token, sent back as 'Authorization: Bearer <token>'.", requiredMode = Schema.RequiredMode.REQUIRED)
        String token
) {
}
