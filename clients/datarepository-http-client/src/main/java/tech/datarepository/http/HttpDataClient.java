package tech.datarepository.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.TypeFactory;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import tech.datarepository.client.DataClient;
import tech.datarepository.client.dto.PaginatedResponse;
import tech.datarepository.client.dto.PaginationOptions;
import tech.datarepository.client.dto.SortOption;
import tech.datarepository.client.dto.SuccessApiResponse;
import tech.datarepository.client.exception.DataClientException;
import tech.datarepository.client.exception.DataFormatException;
import tech.datarepository.client.exception.HttpException;
import tech.datarepository.client.exception.NetworkException;
import tech.datarepository.client.exception.ServerException;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * {@link DataClient} for one resource of a JSON data API.
 *
 * <p>Successful responses are expected as {@code {"data": ..., "metadata": {...}}}. Error
 * statuses are mapped with {@link HttpException#fromStatus(int, String, Map)}; bodies that
 * cannot be decoded raise {@link DataFormatException}. Server and network errors of GET, PUT
 * and DELETE requests are retried with back-off; every other failure, including any failure
 * of a POST, is reported immediately.
 *
 * <p>Obtain instances from {@link HttpDataClients#forResource(String, Class)}.
 */
public class HttpDataClient<T> implements DataClient<T> {

    private static final Logger LOG = Logger.getLogger(HttpDataClient.class);

    private static final TypeReference<Map<String, Object>> ERROR_BODY_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Map<String, Object>>> DOCUMENTS_TYPE = new TypeReference<>() {};

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final HttpDataClientConfig config;
    private final String resourceUrl;

    private final JavaType itemResponseType;
    private final JavaType pageResponseType;
    private final JavaType countResponseType;
    private final JavaType documentsResponseType;

    HttpDataClient(HttpClient httpClient, ObjectMapper objectMapper, HttpDataClientConfig config,
                   String resource, Class<T> itemType) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.config = config;
        this.resourceUrl = config.baseUrl().replaceAll("/$", "") + "/" + resource;

        TypeFactory types = objectMapper.getTypeFactory();
        this.itemResponseType = types.constructParametricType(SuccessApiResponse.class, itemType);
        this.pageResponseType = types.constructParametricType(SuccessApiResponse.class,
            types.constructParametricType(PaginatedResponse.class, itemType));
        this.countResponseType = types.constructParametricType(SuccessApiResponse.class, Integer.class);
        this.documentsResponseType = types.constructParametricType(SuccessApiResponse.class,
            types.constructType(DOCUMENTS_TYPE));
    }

    @Override
    public Uni<SuccessApiResponse<T>> create(T item, String userId) {
        return request("POST", "", scope(userId), item, itemResponseType);
    }

    @Override
    public Uni<SuccessApiResponse<T>> read(String id, String userId) {
        return request("GET", "/" + encode(id), scope(userId), null, itemResponseType);
    }

    @Override
    public Uni<SuccessApiResponse<PaginatedResponse<T>>> readAll(
        String userId,
        Map<String, Object> filter,
        PaginationOptions pagination,
        List<SortOption> sort
    ) {
        return Uni.createFrom().deferred(() -> {
            Map<String, String> query = scope(userId);
            if (filter != null) {
                query.put("filter", toJson(filter));
            }
            if (sort != null && !sort.isEmpty()) {
                query.put("sort", sort.stream()
                    .map(option -> option.field() + ":" + option.order().name().toLowerCase(Locale.ROOT))
                    .collect(Collectors.joining(",")));
            }
            if (pagination != null) {
                if (pagination.cursor() != null) {
                    query.put("cursor", pagination.cursor());
                }
                if (pagination.limit() != null) {
                    query.put("limit", String.valueOf(pagination.limit()));
                }
            }
            return request("GET", "", query, null, pageResponseType);
        });
    }

    @Override
    public Uni<SuccessApiResponse<T>> update(String id, T item, String userId) {
        return request("PUT", "/" + encode(id), scope(userId), item, itemResponseType);
    }

    @Override
    public Uni<Void> delete(String id, String userId) {
        return this.<Object>request("DELETE", "/" + encode(id), scope(userId), null, null)
            .replaceWithVoid();
    }

    @Override
    public Uni<SuccessApiResponse<Integer>> count(String userId, Map<String, Object> filter) {
        return Uni.createFrom().deferred(() -> {
            Map<String, String> query = scope(userId);
            if (filter != null) {
                query.put("filter", toJson(filter));
            }
            return request("GET", "/count", query, null, countResponseType);
        });
    }

    @Override
    public Uni<SuccessApiResponse<List<Map<String, Object>>>> aggregate(List<Map<String, Object>> pipeline, String userId) {
        return request("POST", "/aggregate", scope(userId), pipeline, documentsResponseType);
    }

    /**
     * Send a request, decoding the body as {@code responseType}, or ignoring it when
     * {@code responseType} is null.
     */
    private <R> Uni<R> request(String method, String path, Map<String, String> query, Object body, JavaType responseType) {
        var http = config.request();
        Uni<R> attempt = Uni.createFrom()
            .completionStage(() -> httpClient.sendAsync(buildRequest(method, path, query, body),
                HttpResponse.BodyHandlers.ofString()))
            .map(response -> this.<R>handleResponse(method, response, responseType))
            .onFailure().transform(this::toClientException);

        // POST is not idempotent
        if (http.retryAttempts() <= 1 || "POST".equals(method)) {
            return attempt;
        }
        return attempt
            .onFailure(this::isRetryable).invoke(failure ->
                LOG.debugf("%s %s%s attempt failed: %s", method, resourceUrl, path, failure.getMessage()))
            .onFailure(this::isRetryable).retry()
            .withBackOff(Duration.ofMillis(Math.max(1, http.retryDelay())))
            .atMost(http.retryAttempts() - 1)
            .onFailure(this::isRetryable).invoke(failure ->
                LOG.warnf("%s %s%s failed after %d attempts: %s",
                    method, resourceUrl, path, http.retryAttempts(), failure.getMessage()));
    }

    private HttpRequest buildRequest(String method, String path, Map<String, String> query, Object body) {
        String url = resourceUrl + path + queryString(query);
        LOG.debugf("%s %s", method, url);

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("Accept", "application/json")
            .timeout(Duration.ofSeconds(config.request().timeout()));
        config.accessToken().ifPresent(token -> builder.header("Authorization", "Bearer " + token));

        if (body != null) {
            builder.header("Content-Type", "application/json")
                .method(method, HttpRequest.BodyPublishers.ofString(toJson(body)));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }
        return builder.build();
    }

    private <R> R handleResponse(String method, HttpResponse<String> response, JavaType responseType) {
        int status = response.statusCode();
        String body = response.body();

        if (status < 200 || status >= 300) {
            Map<String, Object> error = parseErrorBody(body);
            throw HttpException.fromStatus(status, errorMessage(status, error), error);
        }

        if (responseType == null) {
            return null;
        }
        if (body == null || body.isBlank()) {
            throw new DataFormatException("Empty response body for " + method + " " + response.uri());
        }

        SuccessApiResponse<?> envelope;
        try {
            envelope = objectMapper.readValue(body, responseType);
        } catch (JsonProcessingException e) {
            throw new DataFormatException("Failed to parse response: " + e.getOriginalMessage(), e);
        }
        if (envelope == null || envelope.data() == null) {
            throw new DataFormatException("Response envelope has no data for " + method + " " + response.uri());
        }
        @SuppressWarnings("unchecked")
        R result = (R) envelope;
        return result;
    }

    private Map<String, Object> parseErrorBody(String body) {
        if (body == null || body.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> error = objectMapper.readValue(body, ERROR_BODY_TYPE);
            return error != null ? error : Map.of();
        } catch (JsonProcessingException e) {
            LOG.debugf("Error body is not JSON: %s", e.getOriginalMessage());
            return Map.of("body", body);
        }
    }

    private static String errorMessage(int status, Map<String, Object> error) {
        Object message = error.getOrDefault("error", error.get("message"));
        if (message instanceof String text && !text.isBlank()) {
            return text;
        }
        return switch (status) {
            case 401 -> "Access token expired or invalid";
            case 403 -> "Access forbidden";
            case 404 -> "Resource not found";
            default -> status >= 500 ? "Server error: " + status : "Client error: " + status;
        };
    }

    private Throwable toClientException(Throwable failure) {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
            ? failure.getCause()
            : failure;
        if (cause instanceof DataClientException) {
            return cause;
        }
        return new NetworkException("Request failed: " + cause.getMessage(), cause);
    }

    private boolean isRetryable(Throwable failure) {
        return failure instanceof ServerException || failure instanceof NetworkException;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new DataFormatException("Failed to serialize request: " + e.getOriginalMessage(), e);
        }
    }

    private static Map<String, String> scope(String userId) {
        Map<String, String> query = new LinkedHashMap<>();
        if (userId != null) {
            query.put("userId", userId);
        }
        return query;
    }

    private static String queryString(Map<String, String> query) {
        if (query.isEmpty()) {
            return "";
        }
        return query.entrySet().stream()
            .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
            .collect(Collectors.joining("&", "?", ""));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
