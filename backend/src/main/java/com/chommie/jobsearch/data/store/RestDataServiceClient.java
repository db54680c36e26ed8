package com.chommie.jobsearch.data.store;

import com.chommie.jobsearch.config.JobSearchProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Store binding for a hosted Postgres data service that speaks the PostgREST dialect.
 * One call is one HTTP exchange; retries belong to the caller.
 */
@Service
@ConditionalOnProperty(prefix = "jobsearch.store", name = "mode", havingValue = "rest")
public class RestDataServiceClient implements DataServiceClient {
    private static final Logger log = LoggerFactory.getLogger(RestDataServiceClient.class);
    private static final TypeReference<List<Map<String, Object>>> ROWS = new TypeReference<>() {};

    private final JobSearchProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public RestDataServiceClient(
        JobSearchProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("storeHttpExecutor") ExecutorService storeHttpExecutor
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.getStore().getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(storeHttpExecutor)
            .build();
    }

    @Override
    public DataResult request(DataMethod method, String resourcePath, RequestParams params) {
        RequestParams safeParams = params == null ? RequestParams.none() : params;
        ResourceSchema.check(method, resourcePath, safeParams);
        if ((method == DataMethod.PATCH || method == DataMethod.DELETE) && !safeParams.hasFilters()) {
            throw new PermanentDataServiceException(resourcePath, "Refusing unfiltered " + method);
        }

        URI uri = URI.create(baseUrl() + "/" + resourcePath + "?" + queryString(method, safeParams));
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getStore().getRequestTimeoutSeconds()))
            .header("Accept", "application/json");
        String apiKey = properties.getStore().getRestApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("apikey", apiKey).header("Authorization", "Bearer " + apiKey);
        }
        List<String> prefer = new ArrayList<>();
        if (safeParams.countTotal()) {
            prefer.add("count=exact");
        }
        if (method != DataMethod.GET) {
            prefer.add("return=representation");
        }
        if (!prefer.isEmpty()) {
            builder.header("Prefer", String.join(",", prefer));
        }
        HttpRequest request = switch (method) {
            case GET -> builder.GET().build();
            case DELETE -> builder.DELETE().build();
            case POST -> builder.header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(writeBody(resourcePath, safeParams.body()), StandardCharsets.UTF_8))
                .build();
            case PATCH -> builder.header("Content-Type", "application/json")
                .method("PATCH", HttpRequest.BodyPublishers.ofString(writeBody(resourcePath, safeParams.body()), StandardCharsets.UTF_8))
                .build();
        };

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new TransientDataServiceException(resourcePath, "timeout", e);
        } catch (IOException e) {
            throw new TransientDataServiceException(resourcePath, "io_error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientDataServiceException(resourcePath, "interrupted", e);
        }

        int status = response.statusCode();
        if (status == 408 || status == 429 || status >= 500) {
            log.warn("Store returned {} for {} {}", status, method, resourcePath);
            throw new TransientDataServiceException(resourcePath, "http_" + status);
        }
        if (status < 200 || status >= 300) {
            throw new PermanentDataServiceException(resourcePath, "http_" + status + ": " + truncate(response.body()), status == 409, null);
        }
        List<Map<String, Object>> rows = readRows(resourcePath, response.body());
        Long total = safeParams.countTotal()
            ? parseTotal(response.headers().firstValue("Content-Range").orElse(null), rows.size())
            : null;
        return new DataResult(rows, total);
    }

    String queryString(DataMethod method, RequestParams params) {
        List<String> parts = new ArrayList<>();
        if (method == DataMethod.GET) {
            parts.add("select=*");
        }
        for (FilterCondition condition : params.filters()) {
            parts.add(encode(condition.field()) + "=" + encode(filterValue(condition)));
        }
        for (List<FilterCondition> group : params.anyOf()) {
            if (group.isEmpty()) {
                continue;
            }
            List<String> alternatives = new ArrayList<>();
            for (FilterCondition condition : group) {
                alternatives.add(condition.field() + "." + quotedFilterValue(condition));
            }
            parts.add("or=" + encode("(" + String.join(",", alternatives) + ")"));
        }
        if (!params.order().isEmpty()) {
            List<String> order = new ArrayList<>();
            for (SortOrder sortOrder : params.order()) {
                order.add(sortOrder.field() + (sortOrder.ascending() ? ".asc" : ".desc"));
            }
            parts.add("order=" + encode(String.join(",", order)));
        }
        if (params.limit() != null) {
            parts.add("limit=" + Math.max(0, params.limit()));
        }
        if (params.offset() != null && params.offset() > 0) {
            parts.add("offset=" + params.offset());
        }
        return String.join("&", parts);
    }

    private String filterValue(FilterCondition condition) {
        FilterOperator operator = condition.operator();
        return switch (operator) {
            case IS_NULL -> "is.null";
            case ILIKE -> "ilike.*" + condition.value() + "*";
            case IN -> "in.(" + joinQuoted(condition.value()) + ")";
            default -> operator.token() + "." + scalar(condition.value());
        };
    }

    private String quotedFilterValue(FilterCondition condition) {
        FilterOperator operator = condition.operator();
        return switch (operator) {
            case IS_NULL -> "is.null";
            case ILIKE -> "ilike." + quote("*" + condition.value() + "*");
            case IN -> "in.(" + joinQuoted(condition.value()) + ")";
            default -> operator.token() + "." + quote(scalar(condition.value()));
        };
    }

    private String joinQuoted(Object value) {
        Collection<?> values = value instanceof Collection<?> c ? c : List.of(value);
        List<String> quoted = new ArrayList<>(values.size());
        for (Object item : values) {
            quoted.add(quote(scalar(item)));
        }
        return String.join(",", quoted);
    }

    private String scalar(Object value) {
        if (value instanceof Instant instant) {
            return instant.toString();
        }
        return String.valueOf(value);
    }

    private String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private String writeBody(String resourcePath, Map<String, Object> body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (IOException e) {
            throw new PermanentDataServiceException(resourcePath, "Unserializable request body", false, e);
        }
    }

    private List<Map<String, Object>> readRows(String resourcePath, String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        try {
            String trimmed = body.trim();
            if (trimmed.startsWith("{")) {
                return List.of(objectMapper.readValue(trimmed, new TypeReference<Map<String, Object>>() {}));
            }
            List<Map<String, Object>> rows = objectMapper.readValue(trimmed, ROWS);
            return rows == null ? List.of() : rows;
        } catch (IOException e) {
            throw new PermanentDataServiceException(resourcePath, "Malformed store response", false, e);
        }
    }

    static Long parseTotal(String contentRange, int fallback) {
        if (contentRange == null || contentRange.isBlank()) {
            return (long) fallback;
        }
        int slash = contentRange.lastIndexOf('/');
        if (slash < 0 || slash == contentRange.length() - 1) {
            return (long) fallback;
        }
        String total = contentRange.substring(slash + 1).trim();
        if ("*".equals(total)) {
            return (long) fallback;
        }
        try {
            return Long.parseLong(total);
        } catch (NumberFormatException e) {
            return (long) fallback;
        }
    }

    private String baseUrl() {
        String base = properties.getStore().getRestBaseUrl();
        if (base == null || base.isBlank()) {
            throw new PermanentDataServiceException(null, "jobsearch.store.rest-base-url is not configured");
        }
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private String truncate(String body) {
        if (body == null) {
            return "";
        }
        String trimmed = body.trim();
        return trimmed.length() <= 300 ? trimmed : trimmed.substring(0, 300);
    }
}
