package tech.datarepository.client.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transport-level error: the data source rejected or failed to serve a request.
 *
 * <p>Use {@link #fromStatus(int, String, Map)} to obtain the subclass matching an HTTP status.
 */
public class HttpException extends DataClientException {

    private final int statusCode;
    private final Map<String, Object> context;

    public HttpException(String message, int statusCode) {
        this(message, statusCode, null, Map.of());
    }

    public HttpException(String message, int statusCode, Throwable cause, Map<String, Object> context) {
        super(message, cause);
        this.statusCode = statusCode;
        this.context = context != null ? Collections.unmodifiableMap(new LinkedHashMap<>(context)) : Map.of();
    }

    @Override
    public ErrorFamily getFamily() {
        return ErrorFamily.TRANSPORT;
    }

    /**
     * HTTP status returned by the data source, or 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Read-only copy of the error body returned by the data source, empty when there was none.
     */
    public Map<String, Object> getContext() {
        return context;
    }

    public static HttpException fromStatus(int status, String message, Map<String, Object> context) {
        return switch (status) {
            case 400 -> new BadRequestException(message, context);
            case 401 -> new UnauthorizedException(message, context);
            case 403 -> new ForbiddenException(message, context);
            case 404 -> new NotFoundException(message, context);
            case 409 -> new ConflictException(message, context);
            case 422 -> new InvalidInputException(message, context);
            default -> status >= 500
                ? new ServerException(message, status, context)
                : new UnknownException(message, status, context);
        };
    }
}
