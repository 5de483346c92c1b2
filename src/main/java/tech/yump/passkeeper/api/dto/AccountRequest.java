package tech.yump.passkeeper.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import tech.yump.passkeeper.secrets.account.AccountInput;

@Schema(description = "Login/password account to store.")
public record AccountRequest(
        @Schema(description = "Account login. Searchable.", example = "alice@example.com", requiredMode = Schema.RequiredMode.REQUIRED)
        String login,

        @Schema(description = "Server or site the account belongs to. Searchable.", example = "mail.example.com", requiredMode = Schema.RequiredMode.REQUIRED)
        String server,

        @Schema(description = "Account password. Stored encrypted.", example = "S3cr3t!")
        String password,

        @Schema(description = "Free-form metadata. Stored encrypted.", example = "recovery codes in the safe")
        String meta
) {
    public AccountInput toInput() {
        return new AccountInput(login, server, password, meta);
    }

    @Override
    public String toString() {
        return "AccountRequest[login=" + login + ", server=" + server + ", password=******, meta=******]";
    }
}
