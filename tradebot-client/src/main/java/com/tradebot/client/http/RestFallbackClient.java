package com.tradebot.client.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.tradebot.client.exception.FallbackHttpException;
import com.tradebot.client.rpc.PayloadDecoder;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Blocking HTTP client for the trading service REST endpoints.
 * Used when the channel is unavailable.
 */
public class RestFallbackClient {
    private static final Logger LOG = LoggerFactory.getLogger(RestFallbackClient.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final HttpUrl baseUrl;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public RestFallbackClient(String baseUrl, long timeoutMs, ObjectMapper objectMapper) {
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid API base URL: " + baseUrl);
        }
        this.baseUrl = parsed;
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(timeoutMs, TimeUnit.MILLISECONDS)
            .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
            .writeTimeout(timeoutMs, TimeUnit.MILLISECONDS)
            .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
            .build();
        this.objectMapper = objectMapper;
    }

    /**
     * Execute {@code route} and decode the response body.
     */
    public <T> T execute(HttpRoute route, PayloadDecoder<T> decoder) throws FallbackHttpException {
        JsonNode body = execute(route);
        try {
            return decoder.decode(objectMapper, body);
        } catch (IOException | RuntimeException e) {
            throw new FallbackHttpException(route + " returned an unreadable body: " + e.getMessage(), e);
        }
    }

    /**
     * Execute {@code route} and return the parsed JSON body (a null node
     * when the body is empty).
     */
    public JsonNode execute(HttpRoute route) throws FallbackHttpException {
        Request request = buildRequest(route);
        LOG.debug("HTTP fallback: {}", route);

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new FallbackHttpException(route + " failed: " + response.code(), response.code());
            }
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            if (text.isBlank()) {
                return NullNode.getInstance();
            }
            try {
                return objectMapper.readTree(text);
            } catch (JsonProcessingException e) {
                throw new FallbackHttpException(route + " returned malformed JSON: " + e.getOriginalMessage(), e);
            }
        } catch (IOException e) {
            throw new FallbackHttpException(route + " failed: " + e.getMessage(), e);
        }
    }

    private Request buildRequest(HttpRoute route) throws FallbackHttpException {
        HttpUrl.Builder url = baseUrl.newBuilder();
        for (String segment : route.segments()) {
            url.addPathSegment(segment);
        }
        for (Map.Entry<String, String> param : route.query().entrySet()) {
            url.addQueryParameter(param.getKey(), param.getValue());
        }

        Request.Builder builder = new Request.Builder().url(url.build());
        switch (route.verb()) {
            case "GET" -> builder.get();
            case "DELETE" -> builder.delete();
            case "POST" -> builder.post(RequestBody.create(encode(route), JSON));
            default -> throw new IllegalArgumentException("Unsupported verb: " + route.verb());
        }
        return builder.build();
    }

    private String encode(HttpRoute route) throws FallbackHttpException {
        if (route.body() == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(route.body());
        } catch (JsonProcessingException e) {
            throw new FallbackHttpException("Cannot encode body for " + route + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Release the connection pool and dispatcher threads.
     */
    public void shutdown() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }
}
