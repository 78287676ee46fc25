package tech.datarepository.http;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Entry point for HTTP-backed data clients.
 *
 * <p>All clients created here share one {@link HttpClient} and one {@link ObjectMapper}.
 *
 * <p>Example usage:
 * <pre>{@code
 * @Inject
 * HttpDataClients clients;
 *
 * var headlines = new DataRepository<>(clients.forResource("headlines", Headline.class), Headline.class);
 * }</pre>
 */
@ApplicationScoped
public class HttpDataClients {

    private final HttpDataClientConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Inject
    public HttpDataClients(HttpDataClientConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(config.request().timeout()))
            .build();
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * Client for the items under {@code {base-url}/{resource}}.
     *
     * @param resource path segment of the resource, e.g. {@code "headlines"}
     * @param itemType class the items are (de)serialized as
     */
    public <T> HttpDataClient<T> forResource(String resource, Class<T> itemType) {
        return new HttpDataClient<>(httpClient, objectMapper, config, resource, itemType);
    }
}
