package tech.yump.passkeeper.secrets;

/**
 * Case-insensitive substring search over a kind's display fields, paginated by offset and limit.
 */
public record SearchQuery(
        String substring,
        int offset,
        int limit
) {
    public SearchQuery {
        if (substring == null) {
            substring = "";
        }
    }
}
