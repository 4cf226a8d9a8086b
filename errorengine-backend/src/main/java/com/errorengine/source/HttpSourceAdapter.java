package com.errorengine.source;

import com.errorengine.config.ErrorEngineProperties;
import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.SourceType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Fetches rows from a JSON HTTP endpoint.
 *
 * <p>Settings come from the query's source config: {@code url}, {@code method} (GET by default),
 * {@code headers}, {@code body} (sent as JSON for POST/PUT/PATCH, as query parameters for GET),
 * {@code response_path} (dot-separated path to the row array) and {@code auth_type}
 * ({@code basic}, {@code bearer} or {@code api_key}). A single JSON object is treated as one row.
 */
@Slf4j
@Component
public class HttpSourceAdapter implements SourceAdapter {

    private final ObjectMapper objectMapper;
    private final ErrorEngineProperties properties;
    private final HttpClient httpClient;

    public HttpSourceAdapter(ObjectMapper objectMapper, ErrorEngineProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getSource().getConnectTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public SourceType sourceType() {
        return SourceType.HTTP;
    }

    @Override
    public SourceResult fetch(MonitoredQuery query, Duration timeout) throws SourceException {
        Map<String, Object> config = query.getSourceConfig() != null ? query.getSourceConfig() : Map.of();
        HttpRequest request = buildRequest(config, timeout);

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new SourceException(SourceErrorKind.TIMEOUT, "HTTP request timed out: " + request.uri(), e);
        } catch (IOException e) {
            throw new SourceException(SourceErrorKind.CONNECTION, "HTTP request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceException(SourceErrorKind.TIMEOUT, "HTTP request interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new SourceException(SourceErrorKind.CONNECTION, "HTTP " + status + " from " + request.uri());
        }
        return parseBody(response.body(), text(config.get("response_path")));
    }

    HttpRequest buildRequest(Map<String, Object> config, Duration timeout) throws SourceException {
        String url = text(config.get("url"));
        if (url == null || url.isBlank()) {
            throw new SourceException(SourceErrorKind.CONFIGURATION, "HTTP source url is not configured");
        }
        String method = text(config.get("method"), "GET").toUpperCase(Locale.ROOT);

        Map<String, String> headers = new LinkedHashMap<>();
        if (config.get("headers") instanceof Map<?, ?> configured) {
            configured.forEach((k, v) -> headers.put(String.valueOf(k), String.valueOf(v)));
        }

        String authType = text(config.get("auth_type"));
        if ("basic".equalsIgnoreCase(authType)) {
            String credentials = text(config.get("auth_username"), "") + ":" + text(config.get("auth_password"), "");
            headers.put("Authorization", "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
        } else if ("bearer".equalsIgnoreCase(authType)) {
            headers.put("Authorization", "Bearer " + text(config.get("auth_token"), ""));
        } else if ("api_key".equalsIgnoreCase(authType)) {
            String keyName = text(config.get("api_key_name"), "X-API-Key");
            String keyValue = text(config.get("api_key_value"), "");
            if ("query".equalsIgnoreCase(text(config.get("api_key_in")))) {
                url = appendQueryParam(url, keyName, keyValue);
            } else {
                headers.put(keyName, keyValue);
            }
        }

        Object body = config.get("body");
        HttpRequest.BodyPublisher publisher = HttpRequest.BodyPublishers.noBody();
        if (body != null && (method.equals("POST") || method.equals("PUT") || method.equals("PATCH"))) {
            try {
                publisher = HttpRequest.BodyPublishers.ofString(
                        body instanceof String s ? s : objectMapper.writeValueAsString(body), StandardCharsets.UTF_8);
            } catch (JsonProcessingException e) {
                throw new SourceException(SourceErrorKind.CONFIGURATION, "HTTP source body is not serializable", e);
            }
            headers.putIfAbsent("Content-Type", "application/json");
        } else if (body instanceof Map<?, ?> params && method.equals("GET")) {
            for (Map.Entry<?, ?> p : params.entrySet()) {
                url = appendQueryParam(url, String.valueOf(p.getKey()), String.valueOf(p.getValue()));
            }
        }
        headers.putIfAbsent("Accept", "application/json");

        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .method(method, publisher);
            headers.forEach(builder::header);
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new SourceException(SourceErrorKind.CONFIGURATION, "invalid HTTP source settings: " + e.getMessage(), e);
        }
    }

    SourceResult parseBody(String body, String responsePath) throws SourceException {
        JsonNode data;
        try {
            data = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SourceException(SourceErrorKind.INVALID_RESPONSE, "response is not valid JSON", e);
        }
        if (data == null || data.isMissingNode()) {
            throw new SourceException(SourceErrorKind.INVALID_RESPONSE, "response body is empty");
        }

        if (responsePath != null && !responsePath.isBlank()) {
            for (String key : responsePath.split("\\.")) {
                if (key.isEmpty()) {
                    continue;
                }
                JsonNode next = data.get(key);
                if (next == null) {
                    throw new SourceException(SourceErrorKind.INVALID_RESPONSE,
                            "response_path segment '" + key + "' not found");
                }
                data = next;
            }
        }

        List<JsonNode> items = new ArrayList<>();
        if (data.isObject()) {
            items.add(data);
        } else if (data.isArray()) {
            data.forEach(items::add);
        } else {
            throw new SourceException(SourceErrorKind.INVALID_RESPONSE,
                    "expected a JSON array or object, got " + data.getNodeType());
        }
        int maxRows = properties.getSource().getMaxRows();
        if (maxRows > 0 && items.size() > maxRows) {
            throw new SourceException(SourceErrorKind.INVALID_RESPONSE,
                    "response has " + items.size() + " rows, exceeds max_rows (" + maxRows + ")");
        }

        Set<String> columns = new LinkedHashSet<>();
        List<Map<String, Object>> rows = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            if (!item.isObject()) {
                throw new SourceException(SourceErrorKind.INVALID_RESPONSE,
                        "expected JSON objects as rows, got " + item.getNodeType());
            }
            Map<String, Object> row = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                row.put(field.getKey(), scalar(field.getValue()));
                columns.add(field.getKey());
            }
            rows.add(row);
        }
        return new SourceResult(List.copyOf(columns), rows);
    }

    private static Object scalar(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        // nested objects and arrays are kept as their JSON text
        return node.toString();
    }

    private static String appendQueryParam(String url, String name, String value) {
        String separator = url.contains("?") ? "&" : "?";
        return url + separator + URLEncoder.encode(name, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String text(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static String text(Object value, String fallback) {
        return value == null ? fallback : String.valueOf(value);
    }
}
