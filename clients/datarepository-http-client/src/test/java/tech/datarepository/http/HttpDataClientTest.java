package tech.datarepository.http;

import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.datarepository.client.dto.PaginatedResponse;
import tech.datarepository.client.dto.PaginationOptions;
import tech.datarepository.client.dto.SortOption;
import tech.datarepository.client.dto.SuccessApiResponse;
import tech.datarepository.client.exception.DataFormatException;
import tech.datarepository.client.exception.ForbiddenException;
import tech.datarepository.client.exception.NetworkException;
import tech.datarepository.client.exception.NotFoundException;
import tech.datarepository.client.exception.ServerException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static com.github.tomakehurst.wiremock.stubbing.Scenario.STARTED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests HttpDataClient against a WireMock data API.
 */
class HttpDataClientTest {

    record Headline(String id, String title) {}

    private static final String RESOURCE_PATH = "/api/v1/data/headlines";
    private static final String METADATA_JSON = "\"metadata\":{\"requestId\":\"req-1\",\"timestamp\":\"2026-01-01T00:00:00Z\"}";
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private WireMockServer wireMockServer;
    private HttpDataClient<Headline> client;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(options().dynamicPort());
        wireMockServer.start();
        configureFor("localhost", wireMockServer.port());

        client = new HttpDataClients(config(wireMockServer.baseUrl() + "/api/v1/data/"))
            .forResource("headlines", Headline.class);
    }

    @AfterEach
    void tearDown() {
        wireMockServer.stop();
    }

    private static HttpDataClientConfig config(String baseUrl) {
        HttpDataClientConfig config = mock(HttpDataClientConfig.class);
        HttpDataClientConfig.RequestConfig request = mock(HttpDataClientConfig.RequestConfig.class);
        when(config.baseUrl()).thenReturn(baseUrl);
        when(config.accessToken()).thenReturn(Optional.of("token-123"));
        when(config.request()).thenReturn(request);
        when(request.timeout()).thenReturn(5);
        when(request.retryAttempts()).thenReturn(3);
        when(request.retryDelay()).thenReturn(1);
        return config;
    }

    private static String envelope(String data) {
        return "{\"data\":" + data + "," + METADATA_JSON + "}";
    }

    @Test
    void create_postsItemAndDecodesEnvelope() {
        stubFor(post(urlEqualTo(RESOURCE_PATH))
            .willReturn(okJson(envelope("{\"id\":\"x\",\"title\":\"v\"}"))));

        SuccessApiResponse<Headline> response = client.create(new Headline("x", "v"), null)
            .await().atMost(TIMEOUT);

        assertEquals(new Headline("x", "v"), response.data());
        assertEquals("req-1", response.metadata().requestId());
        assertEquals(Instant.parse("2026-01-01T00:00:00Z"), response.metadata().timestamp());
        verify(postRequestedFor(urlEqualTo(RESOURCE_PATH))
            .withRequestBody(equalToJson("{\"id\":\"x\",\"title\":\"v\"}"))
            .withHeader("Authorization", equalTo("Bearer token-123"))
            .withHeader("Content-Type", equalTo("application/json")));
    }

    @Test
    void read_sendsUserIdAsQueryParameter() {
        stubFor(get(urlPathEqualTo(RESOURCE_PATH + "/x"))
            .willReturn(okJson(envelope("{\"id\":\"x\",\"title\":\"v\"}"))));

        Headline headline = client.read("x", "user-1").await().atMost(TIMEOUT).data();

        assertEquals("v", headline.title());
        verify(getRequestedFor(urlPathEqualTo(RESOURCE_PATH + "/x"))
            .withQueryParam("userId", equalTo("user-1")));
    }

    @Test
    void readAll_encodesFilterSortAndPagination() {
        stubFor(get(urlPathEqualTo(RESOURCE_PATH))
            .willReturn(okJson(envelope(
                "{\"items\":[{\"id\":\"a\",\"title\":\"A\"},{\"id\":\"b\",\"title\":\"B\"}],\"cursor\":\"c2\",\"hasMore\":true}"))));

        PaginatedResponse<Headline> page = client.readAll(
                "user-1",
                Map.of("category", "tech"),
                new PaginationOptions("c1", 10),
                List.of(SortOption.desc("publishedAt"), SortOption.asc("title")))
            .await().atMost(TIMEOUT).data();

        assertThat(page.items()).containsExactly(new Headline("a", "A"), new Headline("b", "B"));
        assertEquals("c2", page.cursor());
        assertTrue(page.hasMore());
        verify(getRequestedFor(urlPathEqualTo(RESOURCE_PATH))
            .withQueryParam("userId", equalTo("user-1"))
            .withQueryParam("filter", equalToJson("{\"category\":\"tech\"}"))
            .withQueryParam("sort", equalTo("publishedAt:desc,title:asc"))
            .withQueryParam("cursor", equalTo("c1"))
            .withQueryParam("limit", equalTo("10")));
    }

    @Test
    void readAll_omitsAbsentParameters() {
        stubFor(get(urlPathEqualTo(RESOURCE_PATH))
            .willReturn(okJson(envelope("{\"items\":[],\"cursor\":null,\"hasMore\":false}"))));

        PaginatedResponse<Headline> page = client.readAll(null, null, null, null).await().atMost(TIMEOUT).data();

        assertTrue(page.items().isEmpty());
        verify(getRequestedFor(urlEqualTo(RESOURCE_PATH)));
    }

    @Test
    void update_putsItem() {
        stubFor(put(urlEqualTo(RESOURCE_PATH + "/x"))
            .willReturn(okJson(envelope("{\"id\":\"x\",\"title\":\"updated\"}"))));

        Headline headline = client.update("x", new Headline("x", "updated"), null).await().atMost(TIMEOUT).data();

        assertEquals("updated", headline.title());
        verify(putRequestedFor(urlEqualTo(RESOURCE_PATH + "/x"))
            .withRequestBody(equalToJson("{\"id\":\"x\",\"title\":\"updated\"}")));
    }

    @Test
    void delete_acceptsNoContent() {
        stubFor(delete(urlEqualTo(RESOURCE_PATH + "/x")).willReturn(noContent()));

        assertNull(client.delete("x", null).await().atMost(TIMEOUT));
        verify(deleteRequestedFor(urlEqualTo(RESOURCE_PATH + "/x")));
    }

    @Test
    void count_decodesInteger() {
        stubFor(get(urlPathEqualTo(RESOURCE_PATH + "/count"))
            .willReturn(okJson(envelope("42"))));

        Integer count = client.count(null, Map.of("status", "active")).await().atMost(TIMEOUT).data();

        assertEquals(42, count);
        verify(getRequestedFor(urlPathEqualTo(RESOURCE_PATH + "/count"))
            .withQueryParam("filter", equalToJson("{\"status\":\"active\"}")));
    }

    @Test
    void aggregate_postsPipelineInOrder() {
        stubFor(post(urlEqualTo(RESOURCE_PATH + "/aggregate"))
            .willReturn(okJson(envelope("[{\"_id\":\"A\",\"count\":5}]"))));
        List<Map<String, Object>> pipeline = List.of(
            Map.of("$match", Map.of("status", "active")),
            Map.of("$group", Map.of("_id", "$category")));

        List<Map<String, Object>> documents = client.aggregate(pipeline, null).await().atMost(TIMEOUT).data();

        assertEquals(List.of(Map.of("_id", "A", "count", 5)), documents);
        verify(postRequestedFor(urlEqualTo(RESOURCE_PATH + "/aggregate"))
            .withRequestBody(equalToJson(
                "[{\"$match\":{\"status\":\"active\"}},{\"$group\":{\"_id\":\"$category\"}}]")));
    }

    @Test
    void notFound_isMappedWithServerMessageAndNotRetried() {
        stubFor(get(urlEqualTo(RESOURCE_PATH + "/missing"))
            .willReturn(aResponse().withStatus(404)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"error\":\"Headline not found\"}")));

        var error = assertThrows(NotFoundException.class,
            () -> client.read("missing", null).await().atMost(TIMEOUT));

        assertEquals("Headline not found", error.getMessage());
        assertEquals(404, error.getStatusCode());
        assertEquals("Headline not found", error.getContext().get("error"));
        verify(1, getRequestedFor(urlEqualTo(RESOURCE_PATH + "/missing")));
    }

    @Test
    void forbiddenWithoutBody_usesDefaultMessage() {
        stubFor(get(urlEqualTo(RESOURCE_PATH + "/x")).willReturn(forbidden()));

        var error = assertThrows(ForbiddenException.class,
            () -> client.read("x", null).await().atMost(TIMEOUT));

        assertEquals("Access forbidden", error.getMessage());
    }

    @Test
    void serverError_isRetriedUntilSuccess() {
        stubFor(get(urlEqualTo(RESOURCE_PATH + "/x")).inScenario("flaky")
            .whenScenarioStateIs(STARTED)
            .willReturn(serverError())
            .willSetStateTo("recovered"));
        stubFor(get(urlEqualTo(RESOURCE_PATH + "/x")).inScenario("flaky")
            .whenScenarioStateIs("recovered")
            .willReturn(okJson(envelope("{\"id\":\"x\",\"title\":\"v\"}"))));

        Headline headline = client.read("x", null).await().atMost(TIMEOUT).data();

        assertEquals("x", headline.id());
        verify(2, getRequestedFor(urlEqualTo(RESOURCE_PATH + "/x")));
    }

    @Test
    void serverError_failsAfterConfiguredAttempts() {
        stubFor(get(urlEqualTo(RESOURCE_PATH + "/x"))
            .willReturn(aResponse().withStatus(503)));

        var error = assertThrows(ServerException.class,
            () -> client.read("x", null).await().atMost(TIMEOUT));

        assertEquals(503, error.getStatusCode());
        verify(3, getRequestedFor(urlEqualTo(RESOURCE_PATH + "/x")));
    }

    @Test
    void serverErrorOnCreate_isNotRetried() {
        stubFor(post(urlEqualTo(RESOURCE_PATH)).willReturn(aResponse().withStatus(503)));

        var error = assertThrows(ServerException.class,
            () -> client.create(new Headline("x", "v"), null).await().atMost(TIMEOUT));

        assertEquals(503, error.getStatusCode());
        verify(1, postRequestedFor(urlEqualTo(RESOURCE_PATH)));
    }

    @Test
    void serverErrorOnAggregate_isNotRetried() {
        stubFor(post(urlEqualTo(RESOURCE_PATH + "/aggregate")).willReturn(serverError()));

        assertThrows(ServerException.class,
            () -> client.aggregate(List.of(Map.of("$match", Map.of())), null).await().atMost(TIMEOUT));

        verify(1, postRequestedFor(urlEqualTo(RESOURCE_PATH + "/aggregate")));
    }

    @Test
    void serverErrorOnDelete_isRetried() {
        stubFor(delete(urlEqualTo(RESOURCE_PATH + "/x")).willReturn(serverError()));

        assertThrows(ServerException.class,
            () -> client.delete("x", null).await().atMost(TIMEOUT));

        verify(3, deleteRequestedFor(urlEqualTo(RESOURCE_PATH + "/x")));
    }

    @Test
    void malformedBody_raisesFormatErrorWithoutRetry() {
        stubFor(get(urlEqualTo(RESOURCE_PATH + "/x"))
            .willReturn(okJson("{not json")));

        assertThrows(DataFormatException.class,
            () -> client.read("x", null).await().atMost(TIMEOUT));
        verify(1, getRequestedFor(urlEqualTo(RESOURCE_PATH + "/x")));
    }

    @Test
    void envelopeWithoutData_raisesFormatError() {
        stubFor(get(urlEqualTo(RESOURCE_PATH + "/x"))
            .willReturn(okJson("{" + METADATA_JSON + "}")));

        assertThrows(DataFormatException.class,
            () -> client.read("x", null).await().atMost(TIMEOUT));
    }

    @Test
    void unreachableServer_raisesNetworkError() {
        HttpDataClient<Headline> unreachable = new HttpDataClients(config("http://127.0.0.1:1"))
            .forResource("headlines", Headline.class);

        var error = assertThrows(NetworkException.class,
            () -> unreachable.read("x", null).await().atMost(TIMEOUT));

        assertEquals(0, error.getStatusCode());
        assertNotNull(error.getCause());
    }
}
