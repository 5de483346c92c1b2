package tech.yump.passkeeper.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import tech.yump.passkeeper.secrets.SearchPage;

import java.util.List;

@Schema(description = "One page of search results. Items carry display fields only.")
public record SearchResponse<T>(
        @Schema(description = "Matching items in this page.", requiredMode = Schema.RequiredMode.REQUIRED)
        List<T> items,

        @Schema(description = "Total number of matches regardless of offset and limit.", example = "42", requiredMode = Schema.RequiredMode.REQUIRED)
        long count
) {
    public static <T> SearchResponse<T> from(SearchPage<T> page) {
        return new SearchResponse<>(page.items(), page.count());
    }
}
