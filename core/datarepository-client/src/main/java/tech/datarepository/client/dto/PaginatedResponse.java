package tech.datarepository.client.dto;

import java.util.List;

/**
 * One page of items with an optional continuation cursor.
 *
 * @param items   the items of this page, in the order returned by the data source
 * @param cursor  cursor for the next page, or {@code null} when there is none
 * @param hasMore whether more items are available after this page
 */
public record PaginatedResponse<T>(
    List<T> items,
    String cursor,
    boolean hasMore
) {
    public static <T> PaginatedResponse<T> empty() {
        return new PaginatedResponse<>(List.of(), null, false);
    }
}
