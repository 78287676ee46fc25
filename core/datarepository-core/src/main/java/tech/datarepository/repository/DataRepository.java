package tech.datarepository.repository;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import tech.datarepository.client.DataClient;
import tech.datarepository.client.dto.PaginatedResponse;
import tech.datarepository.client.dto.PaginationOptions;
import tech.datarepository.client.dto.SortOption;
import tech.datarepository.client.dto.SuccessApiResponse;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Generic repository over a {@link DataClient} for items of type {@code T}.
 *
 * <p>Each operation delegates to the matching client operation and unwraps the
 * {@link SuccessApiResponse} envelope. Errors raised by the client
 * ({@link tech.datarepository.client.exception.HttpException},
 * {@link tech.datarepository.client.exception.DataFormatException}) reach the caller
 * unchanged, including errors the client throws before returning its {@link Uni}.
 *
 * <p>After a create, update or delete completes successfully, the item type is published on
 * {@link #entityUpdated()}. Reads, counts and aggregations never publish.
 *
 * <p>Example usage:
 * <pre>{@code
 * var headlines = new DataRepository<>(headlineClient, Headline.class);
 *
 * headlines.entityUpdated()
 *     .subscribe().with(type -> refreshHeadlines());
 *
 * Headline created = headlines.create(headline).await().indefinitely();
 * }</pre>
 *
 * <p>Call {@link #dispose()} when the repository is no longer needed.
 *
 * @param <T> the item type
 */
public class DataRepository<T> implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(DataRepository.class);

    private final DataClient<T> dataClient;
    private final Class<T> itemType;
    private final EntityUpdateBroadcaster<T> entityUpdated;

    public DataRepository(DataClient<T> dataClient, Class<T> itemType) {
        this.dataClient = Objects.requireNonNull(dataClient, "dataClient");
        this.itemType = Objects.requireNonNull(itemType, "itemType");
        this.entityUpdated = new EntityUpdateBroadcaster<>(itemType);
    }

    /**
     * Stream of item types, emitted once per successful create, update or delete.
     *
     * <p>The stream is hot: subscribers only see changes made while they are subscribed.
     * It completes when the repository is disposed.
     *
     * <pre>{@code
     * repository.entityUpdated()
     *     .subscribe().with(type -> LOG.infof("%s changed", type.getSimpleName()));
     * }</pre>
     */
    public Multi<Class<T>> entityUpdated() {
        return entityUpdated.stream();
    }

    public Class<T> getItemType() {
        return itemType;
    }

    /**
     * Complete the {@link #entityUpdated()} stream. Later mutations no longer publish.
     */
    public void dispose() {
        entityUpdated.close();
    }

    public boolean isDisposed() {
        return entityUpdated.isClosed();
    }

    @Override
    public void close() {
        dispose();
    }

    // Create

    public Uni<T> create(T item) {
        return create(item, null);
    }

    /**
     * Create a new item.
     *
     * @return the item as stored by the data source
     */
    public Uni<T> create(T item, String userId) {
        return call("create", () -> dataClient.create(item, userId))
            .onItem().invoke(entityUpdated::emit)
            .map(SuccessApiResponse::data);
    }

    // Read

    public Uni<T> read(String id) {
        return read(id, null);
    }

    /**
     * Read a single item.
     *
     * <p>Fails with {@link tech.datarepository.client.exception.NotFoundException} when the
     * client reports that the item does not exist.
     */
    public Uni<T> read(String id, String userId) {
        return call("read", () -> dataClient.read(id, userId))
            .map(SuccessApiResponse::data);
    }

    public Uni<PaginatedResponse<T>> readAll() {
        return readAll(null, null, null, null);
    }

    public Uni<PaginatedResponse<T>> readAll(String userId) {
        return readAll(userId, null, null, null);
    }

    /**
     * Read a page of items. Filter, pagination and sort are handed to the client as given.
     */
    public Uni<PaginatedResponse<T>> readAll(
        String userId,
        Map<String, Object> filter,
        PaginationOptions pagination,
        List<SortOption> sort
    ) {
        return call("readAll", () -> dataClient.readAll(userId, filter, pagination, sort))
            .map(SuccessApiResponse::data);
    }

    // Update

    public Uni<T> update(String id, T item) {
        return update(id, item, null);
    }

    /**
     * Replace an existing item.
     *
     * @return the item as stored by the data source
     */
    public Uni<T> update(String id, T item, String userId) {
        return call("update", () -> dataClient.update(id, item, userId))
            .onItem().invoke(entityUpdated::emit)
            .map(SuccessApiResponse::data);
    }

    // Delete

    public Uni<Void> delete(String id) {
        return delete(id, null);
    }

    public Uni<Void> delete(String id, String userId) {
        return call("delete", () -> dataClient.delete(id, userId))
            .onItem().invoke(entityUpdated::emit);
    }

    // Count / aggregate

    public Uni<Integer> count() {
        return count(null, null);
    }

    public Uni<Integer> count(String userId) {
        return count(userId, null);
    }

    public Uni<Integer> count(String userId, Map<String, Object> filter) {
        return call("count", () -> dataClient.count(userId, filter))
            .map(SuccessApiResponse::data);
    }

    public Uni<List<Map<String, Object>>> aggregate(List<Map<String, Object>> pipeline) {
        return aggregate(pipeline, null);
    }

    /**
     * Run an aggregation pipeline on the data source. Stages are passed through unmodified.
     */
    public Uni<List<Map<String, Object>>> aggregate(List<Map<String, Object>> pipeline, String userId) {
        return call("aggregate", () -> dataClient.aggregate(pipeline, userId))
            .map(SuccessApiResponse::data);
    }

    /**
     * Defers the client call to subscription time so that a client throwing instead of
     * returning a failed {@link Uni} still yields a failed {@link Uni}. The failure itself
     * is passed on as is.
     */
    private <R> Uni<R> call(String operation, Supplier<Uni<R>> clientCall) {
        return Uni.createFrom().<R>deferred(clientCall::get)
            .onFailure().invoke(failure -> LOG.debugf(failure, "%s %s failed: %s",
                itemType.getSimpleName(), operation, failure.getMessage()));
    }
}
