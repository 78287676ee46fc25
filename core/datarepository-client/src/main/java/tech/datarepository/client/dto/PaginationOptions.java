package tech.datarepository.client.dto;

/**
 * Cursor-based pagination request.
 *
 * @param cursor cursor returned by a previous page, or {@code null} for the first page
 * @param limit  maximum number of items per page, or {@code null} for the data source default
 */
public record PaginationOptions(
    String cursor,
    Integer limit
) {
    public static PaginationOptions firstPage(int limit) {
        return new PaginationOptions(null, limit);
    }

    /**
     * Options for the page following the one that returned {@code cursor}, keeping the same limit.
     */
    public PaginationOptions next(String cursor) {
        return new PaginationOptions(cursor, limit);
    }
}
