package tech.yump.passkeeper.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Login and password used to register or log in.")
public record CredentialsRequest(
        @Schema(description = "Unique user login.", example = "alice", requiredMode = Schema.RequiredMode.REQUIRED)
        String login,

        @Schema(description = "User password.", example = "correct horse battery staple", requiredMode = Schema.RequiredMode.REQUIRED)
        String password
) {
    @Override
    public String toString() {
        return "CredentialsRequest[login=" + login + ", password=******]";
    }
}
