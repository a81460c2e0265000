package com.emma.client.adapter;

import com.emma.client.logging.LogContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.StringJoiner;

/**
 * {@link Adapter} implementation using the JDK {@link HttpClient} and Jackson.
 *
 * <p>Requests go to {@code {baseUrl}/{accountId}{path}} with HTTP basic
 * authentication (public key / private key). GET and DELETE parameters are
 * sent as a query string, POST and PUT bodies as JSON.</p>
 *
 * Usage:
 * <pre>
 * Adapter adapter = new HttpClientAdapter(AdapterConfig.of("1234", "08192a3b4c5d6e7f", "f7e6d5c4b3a29180"));
 * Object groups = adapter.get("/members/123/groups", Map.of());
 * </pre>
 */
public class HttpClientAdapter implements Adapter {
    private static final Logger log = LoggerFactory.getLogger(HttpClientAdapter.class);

    private static final int NOT_FOUND = 404;

    private final AdapterConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String authorization;

    public HttpClientAdapter(AdapterConfig config) {
        this(config, HttpClient.newBuilder().connectTimeout(config.timeout()).build(), new ObjectMapper());
    }

    public HttpClientAdapter(AdapterConfig config, HttpClient httpClient, ObjectMapper objectMapper) {
        this.config = config;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        String credentials = config.publicKey() + ":" + config.privateKey();
        this.authorization = "Basic " + Base64.getEncoder()
                .encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
        log.info("HttpClientAdapter initialized for endpoint: {}", config.endpoint());
    }

    @Override
    public Object get(String path, Map<String, ?> params) {
        return send("GET", path, query(params), HttpRequest.BodyPublishers.noBody(), false);
    }

    @Override
    public Object post(String path, Object body) {
        return send("POST", path, "", json("POST", path, body), true);
    }

    @Override
    public Object put(String path, Object body) {
        return send("PUT", path, "", json("PUT", path, body), true);
    }

    @Override
    public Object delete(String path, Map<String, ?> params) {
        return send("DELETE", path, query(params), HttpRequest.BodyPublishers.noBody(), false);
    }

    public AdapterConfig getConfig() {
        return config;
    }

    private Object send(String method, String path, String query,
                        HttpRequest.BodyPublisher body, boolean hasJsonBody) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(config.endpoint() + path + query))
                .timeout(config.timeout())
                .header("Authorization", authorization)
                .header("Accept", "application/json")
                .method(method, body);
        if (hasJsonBody) {
            builder.header("Content-Type", "application/json");
        }

        try (LogContext ctx = LogContext.forRequest(config.accountId(), method, path)) {
            log.debug("api.request method={} path={}", method, path);
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            return processResponse(method, path, response);
        } catch (IOException e) {
            log.error("api.failed method={} path={} error={}", method, path, e.getMessage());
            throw new ApiRequestFailedException(method, path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiRequestFailedException(method, path, e);
        }
    }

    private Object processResponse(String method, String path, HttpResponse<String> response) {
        int status = response.statusCode();
        if (status == NOT_FOUND) {
            log.debug("api.not_found method={} path={}", method, path);
            return null;
        }
        if (status < 200 || status >= 300) {
            log.warn("api.rejected method={} path={} status={}", method, path, status);
            throw new ApiRequestFailedException(method, path, status, response.body());
        }

        String body = response.body();
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(body, Object.class);
        } catch (JsonProcessingException e) {
            throw new ApiRequestFailedException(method, path, e);
        }
    }

    private HttpRequest.BodyPublisher json(String method, String path, Object body) {
        if (body == null) {
            return HttpRequest.BodyPublishers.noBody();
        }
        try {
            return HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new ApiRequestFailedException(method, path, e);
        }
    }

    static String query(Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&", "?", "");
        params.forEach((key, value) -> {
            if (value != null) {
                joiner.add(encode(key) + "=" + encode(value.toString()));
            }
        });
        return joiner.length() > 1 ? joiner.toString() : "";
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
