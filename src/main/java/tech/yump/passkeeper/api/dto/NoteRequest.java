package tech.yump.passkeeper.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import tech.yump.passkeeper.secrets.note.NoteInput;

@Schema(description = "Free-text note to store.")
public record NoteRequest(
        @Schema(description = "Note name. Searchable.", example = "wifi", requiredMode = Schema.RequiredMode.REQUIRED)
        String name,

        @Schema(description = "Note text. Stored encrypted.", example = "ssid: home, key: hunter2", requiredMode = Schema.RequiredMode.REQUIRED)
        String content,

        @Schema(description = "Free-form metadata. Stored encrypted.")
        String meta
) {
    public NoteInput toInput() {
        return new NoteInput(name, content, meta);
    }
}
