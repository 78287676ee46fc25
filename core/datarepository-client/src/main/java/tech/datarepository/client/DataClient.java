package tech.datarepository.client;

import io.smallrye.mutiny.Uni;
import tech.datarepository.client.dto.PaginatedResponse;
import tech.datarepository.client.dto.PaginationOptions;
import tech.datarepository.client.dto.SortOption;
import tech.datarepository.client.dto.SuccessApiResponse;

import java.util.List;
import java.util.Map;

/**
 * Low-level access to a data source holding items of type {@code T}.
 *
 * <p>Every operation is asynchronous and returns a lazy {@link Uni}. Optional parameters
 * are nullable; {@code null} means the parameter is absent. Successful results are wrapped
 * in a {@link SuccessApiResponse}. Failures are reported as
 * {@link tech.datarepository.client.exception.HttpException} (transport family) or
 * {@link tech.datarepository.client.exception.DataFormatException} (format family).
 *
 * @param <T> the item type
 */
public interface DataClient<T> {

    /**
     * Create a new item.
     *
     * @param item   the item to create
     * @param userId scope of the item, or {@code null} for global items
     */
    Uni<SuccessApiResponse<T>> create(T item, String userId);

    /**
     * Read a single item by id.
     */
    Uni<SuccessApiResponse<T>> read(String id, String userId);

    /**
     * Read a page of items.
     *
     * @param userId     scope, or {@code null}
     * @param filter     field name to match criteria, or {@code null} for no filtering
     * @param pagination cursor and page size, or {@code null} for the first page with the default size
     * @param sort       ordered sort keys, or {@code null} for the data source default order
     */
    Uni<SuccessApiResponse<PaginatedResponse<T>>> readAll(
        String userId,
        Map<String, Object> filter,
        PaginationOptions pagination,
        List<SortOption> sort
    );

    /**
     * Replace the item identified by {@code id}.
     */
    Uni<SuccessApiResponse<T>> update(String id, T item, String userId);

    /**
     * Delete the item identified by {@code id}.
     */
    Uni<Void> delete(String id, String userId);

    /**
     * Count the items matching {@code filter}.
     */
    Uni<SuccessApiResponse<Integer>> count(String userId, Map<String, Object> filter);

    /**
     * Run an aggregation pipeline. Stages are passed to the data source in order.
     */
    Uni<SuccessApiResponse<List<Map<String, Object>>>> aggregate(List<Map<String, Object>> pipeline, String userId);
}
