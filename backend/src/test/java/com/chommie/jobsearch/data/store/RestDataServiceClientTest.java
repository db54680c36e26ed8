package com.chommie.jobsearch.data.store;

import com.chommie.jobsearch.config.JobSearchProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RestDataServiceClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private RestDataServiceClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        JobSearchProperties properties = new JobSearchProperties();
        properties.getStore().setMode("rest");
        properties.getStore().setRestBaseUrl(server.url("/rest/v1").toString());
        properties.getStore().setRestApiKey("anon-key");
        properties.getStore().setRequestTimeoutSeconds(5);
        executor = Executors.newFixedThreadPool(1);
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        client = new RestDataServiceClient(properties, mapper, executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void searchRequestCarriesFiltersAndReadsTotal() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Range", "0-0/42")
            .setBody("[{\"id\":\"j1\",\"title\":\"Java Engineer\"}]"));

        RequestParams params = QueryFilter.builder()
            .eq("is_active", true)
            .ilikeAny(List.of("title", "company"), "java")
            .gte("salary_max", 50000)
            .orderBy("created_at", false)
            .limit(20)
            .withCount()
            .build();
        DataResult result = client.request(DataMethod.GET, "jobs", params);

        assertThat(result.rows()).hasSize(1);
        assertThat(result.totalCount()).isEqualTo(42L);

        RecordedRequest request = server.takeRequest();
        String query = URLDecoder.decode(request.getRequestUrl().encodedQuery(), StandardCharsets.UTF_8);
        assertThat(request.getPath()).startsWith("/rest/v1/jobs?");
        assertThat(query)
            .contains("select=*")
            .contains("is_active=eq.true")
            .contains("or=(title.ilike.\"*java*\",company.ilike.\"*java*\")")
            .contains("salary_max=gte.50000")
            .contains("order=created_at.desc")
            .contains("limit=20");
        assertThat(request.getHeader("apikey")).isEqualTo("anon-key");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer anon-key");
        assertThat(request.getHeader("Prefer")).isEqualTo("count=exact");
    }

    @Test
    void unavailableStoreIsTransient() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("overloaded"));

        assertThatThrownBy(() -> client.request(DataMethod.GET, "jobs", RequestParams.none()))
            .isInstanceOf(TransientDataServiceException.class);
    }

    @Test
    void conflictIsPermanentAndFlagged() {
        server.enqueue(new MockResponse().setResponseCode(409).setBody("{\"code\":\"23505\"}"));

        RequestParams params = QueryFilter.builder().body(Map.of("email", "a@example.com")).build();

        assertThatThrownBy(() -> client.request(DataMethod.POST, "users", params))
            .isInstanceOfSatisfying(PermanentDataServiceException.class, e -> assertThat(e.isConflict()).isTrue());
    }

    @Test
    void insertAsksForTheStoredRepresentation() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201).setBody("[{\"id\":\"a1\",\"status\":\"pending\"}]"));

        DataResult result = client.request(
            DataMethod.POST,
            "applications",
            QueryFilter.builder().body(Map.of("user_id", "u1", "job_id", "j1")).build()
        );

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("Prefer")).isEqualTo("return=representation");
        assertThat(request.getBody().readUtf8()).contains("\"user_id\":\"u1\"");
        assertThat(result.firstRow()).contains(Map.of("id", "a1", "status", "pending"));
    }

    @Test
    void unfilteredDeleteIsRefusedWithoutARequest() {
        assertThatThrownBy(() -> client.request(DataMethod.DELETE, "jobs", RequestParams.none()))
            .isInstanceOf(PermanentDataServiceException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void unknownResourceIsRefused() {
        assertThatThrownBy(() -> client.request(DataMethod.GET, "pg_catalog", RequestParams.none()))
            .isInstanceOf(PermanentDataServiceException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void contentRangeParsing() {
        assertThat(RestDataServiceClient.parseTotal("0-24/3573", 25)).isEqualTo(3573L);
        assertThat(RestDataServiceClient.parseTotal("*/0", 0)).isEqualTo(0L);
        assertThat(RestDataServiceClient.parseTotal("0-9/*", 10)).isEqualTo(10L);
        assertThat(RestDataServiceClient.parseTotal(null, 3)).isEqualTo(3L);
    }
}
