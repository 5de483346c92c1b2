package tech.yump.passkeeper.secrets;

import java.util.List;

/**
 * One page of search results plus the total number of matches regardless of pagination.
 */
public record SearchPage<T>(
        List<T> items,
        long count
) {
    public SearchPage {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
