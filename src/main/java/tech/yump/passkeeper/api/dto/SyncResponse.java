package tech.yump.passkeeper.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(description = "Time of the caller's last mutation.")
public record SyncResponse(
        @Schema(description = "Last mutation timestamp (UTC).", example = "2024-11-07T10:15:30Z", requiredMode = Schema.RequiredMode.REQUIRED)
        Instant timestamp
) {
}
