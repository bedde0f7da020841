package com.eventvault.sync.http;

import com.eventvault.sync.RecordBatch;
import com.eventvault.sync.RemoteConnector;
import com.eventvault.sync.RemoteException;
import com.eventvault.sync.RemoteRejectedException;
import com.eventvault.sync.RemoteThrottledException;
import com.eventvault.sync.RemoteUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Optional;

/**
 * Mirror reached over HTTP/JSON.
 * <ul>
 * <li>{@code PUT {endpoint}/resources/{key}}: replace a table with a document</li>
 * <li>{@code POST {endpoint}/resources/{key}/batches}: write one batch</li>
 * <li>{@code GET {endpoint}/resources/{key}}: read a table (404 = none)</li>
 * <li>{@code GET {endpoint}/health}: connectivity probe</li>
 * </ul>
 * 429 and 503 are throttling (with {@code Retry-After}); other 5xx and read
 * timeouts are treated the same. Connection failures mean unavailable; other
 * 4xx are rejections.
 */
@Slf4j
public class HttpTabularConnector implements RemoteConnector {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String HEALTH_KEY = "health";

    private final HttpUrl baseUrl;
    private final String token;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    /** Last health probe result, kept briefly so a paused worker does not hammer the endpoint. */
    private final Cache<String, Boolean> healthCache;

    public HttpTabularConnector(String endpoint, String token, Duration callTimeout) {
        this(endpoint, token, new OkHttpClient.Builder()
                .connectTimeout(callTimeout)
                .readTimeout(callTimeout)
                .writeTimeout(callTimeout)
                .callTimeout(callTimeout)
                .build(), Duration.ofSeconds(2));
    }

    /** Constructor for testing – allows injecting a custom OkHttpClient. */
    HttpTabularConnector(String endpoint, String token, OkHttpClient httpClient, Duration healthTtl) {
        HttpUrl parsed = HttpUrl.parse(endpoint);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid mirror endpoint: " + endpoint);
        }
        this.baseUrl = parsed;
        this.token = token;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.healthCache = Caffeine.newBuilder()
                .expireAfterWrite(healthTtl)
                .maximumSize(1)
                .build();
    }

    @Override
    public boolean isConnected() {
        Boolean cached = healthCache.getIfPresent(HEALTH_KEY);
        if (cached != null) {
            return cached;
        }
        boolean healthy;
        Request request = authorized(new Request.Builder().url(url("health")).get()).build();
        try (Response response = httpClient.newCall(request).execute()) {
            healthy = response.isSuccessful();
            if (!healthy) {
                log.debug("Mirror health check returned {}", response.code());
            }
        } catch (IOException e) {
            log.debug("Mirror health check failed: {}", e.getMessage());
            healthy = false;
        }
        healthCache.put(HEALTH_KEY, healthy);
        return healthy;
    }

    @Override
    public void push(String key, JsonNode document) throws RemoteException {
        Request request = authorized(new Request.Builder()
                .url(url("resources", key))
                .put(jsonBody(document)))
                .build();
        execute(request, key).close();
    }

    @Override
    public void pushBatch(String key, RecordBatch batch) throws RemoteException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("index", batch.index());
        body.put("total", batch.total());
        body.put("shape", batch.shape().name().toLowerCase());
        body.putArray("records").addAll(batch.records());
        Request request = authorized(new Request.Builder()
                .url(url("resources", key, "batches"))
                .post(jsonBody(body)))
                .build();
        execute(request, key).close();
    }

    @Override
    public Optional<JsonNode> pull(String key) throws RemoteException {
        Request request = authorized(new Request.Builder().url(url("resources", key)).get()).build();
        try (Response response = execute(request, key)) {
            if (response.code() == 404) {
                return Optional.empty();
            }
            ResponseBody body = response.body();
            if (body == null) {
                return Optional.empty();
            }
            String json = body.string();
            if (json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new RemoteRejectedException("mirror returned invalid JSON for " + key + ": " + e.getOriginalMessage(),
                    200);
        } catch (IOException e) {
            throw classify(e, key);
        }
    }

    @Override
    public String describe() {
        return "HTTP mirror at " + baseUrl;
    }

    // ── Internals ──────────────────────────────────────────────────────

    private HttpUrl url(String... segments) {
        HttpUrl.Builder builder = baseUrl.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private Request.Builder authorized(Request.Builder builder) {
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder;
    }

    private RequestBody jsonBody(JsonNode node) throws RemoteRejectedException {
        try {
            return RequestBody.create(objectMapper.writeValueAsBytes(node), JSON);
        } catch (IOException e) {
            throw new RemoteRejectedException("cannot serialize document: " + e.getMessage(), 0);
        }
    }

    /**
     * Execute and map non-success statuses. Returns the open response for
     * 2xx and 404; the caller closes it.
     */
    private Response execute(Request request, String key) throws RemoteException {
        Response response;
        try {
            response = httpClient.newCall(request).execute();
        } catch (IOException e) {
            throw classify(e, key);
        }
        int code = response.code();
        if (response.isSuccessful() || code == 404 && "GET".equals(request.method())) {
            healthCache.put(HEALTH_KEY, true);
            return response;
        }
        String detail = request.method() + " " + request.url().encodedPath() + " returned " + code;
        long retryAfterMs = parseRetryAfterMs(response.header("Retry-After"));
        response.close();
        if (code == 429 || code == 503) {
            throw new RemoteThrottledException(detail, retryAfterMs);
        }
        if (code >= 500) {
            throw new RemoteThrottledException(detail);
        }
        throw new RemoteRejectedException(detail, code);
    }

    private RemoteException classify(IOException e, String key) {
        // Read, write and whole-call timeouts.
        if (e instanceof InterruptedIOException) {
            return new RemoteThrottledException("timeout talking to mirror for " + key, 0, e);
        }
        healthCache.put(HEALTH_KEY, false);
        if (e instanceof ConnectException || e instanceof UnknownHostException) {
            return new RemoteUnavailableException("mirror unreachable: " + e.getMessage(), e);
        }
        return new RemoteUnavailableException("I/O error talking to mirror for " + key + ": " + e.getMessage(), e);
    }

    static long parseRetryAfterMs(String header) {
        if (header == null || header.isBlank()) {
            return 0;
        }
        try {
            return Math.max(0, Long.parseLong(header.trim())) * 1000;
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After: {}", header);
            return 0;
        }
    }
}
