package tech.datarepository.http;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

/**
 * Configuration for {@link HttpDataClient}.
 *
 * <p>Configure in application.properties:
 * <pre>
 * datarepository.http.base-url=https://data.example.com/api/v1/data
 * datarepository.http.access-token=your_token
 * datarepository.http.request.timeout=10
 * </pre>
 */
@ConfigMapping(prefix = "datarepository.http")
public interface HttpDataClientConfig {

    /**
     * Base URL of the data API. Resource paths are appended to it.
     */
    @WithName("base-url")
    @WithDefault("http://localhost:8080/api/v1/data")
    String baseUrl();

    /**
     * Bearer token sent with every request, if set.
     */
    @WithName("access-token")
    Optional<String> accessToken();

    /**
     * Request configuration.
     */
    RequestConfig request();

    interface RequestConfig {
        /**
         * Connect and request timeout in seconds.
         */
        @WithDefault("30")
        int timeout();

        /**
         * Total number of attempts for requests failing with a server or network error.
         */
        @WithName("retry-attempts")
        @WithDefault("3")
        int retryAttempts();

        /**
         * Initial delay between attempts in milliseconds.
         */
        @WithName("retry-delay")
        @WithDefault("100")
        int retryDelay();
    }
}
