package tech.datarepository.client.dto;

/**
 * Envelope wrapping the payload of a successful data API response.
 *
 * @param <D> the payload type (an item, a page of items, a count, ...)
 */
public record SuccessApiResponse<D>(
    D data,
    ResponseMetadata metadata
) {
    public static <D> SuccessApiResponse<D> of(D data, ResponseMetadata metadata) {
        return new SuccessApiResponse<>(data, metadata);
    }
}
