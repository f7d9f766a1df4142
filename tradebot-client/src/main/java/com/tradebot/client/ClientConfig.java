package com.tradebot.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration for {@link TradingServiceClient}.
 *
 * Values come from an optional YAML file. Environment variables
 * ({@code TRADEBOT_*}) override the file, and system properties
 * ({@code tradebot.*}) override both.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientConfig {

    private String channelUrl = "ws://localhost:3007/ws";
    private String apiBaseUrl = "http://localhost:3007";
    private long connectTimeoutMs = 5_000;
    private long requestTimeoutMs = 30_000;
    private int maxReconnectAttempts = 5;
    private long reconnectDelayMs = 5_000;
    private long healthCheckIntervalMs = 30_000;
    private long httpTimeoutMs = 30_000;
    private boolean resubscribeOnReconnect = true;
    private boolean retryAfterReconnect = true;

    public String getChannelUrl() { return channelUrl; }
    public void setChannelUrl(String channelUrl) { this.channelUrl = channelUrl; }

    public String getApiBaseUrl() { return apiBaseUrl; }
    public void setApiBaseUrl(String apiBaseUrl) { this.apiBaseUrl = apiBaseUrl; }

    public long getConnectTimeoutMs() { return connectTimeoutMs; }
    public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

    public long getRequestTimeoutMs() { return requestTimeoutMs; }
    public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

    public int getMaxReconnectAttempts() { return maxReconnectAttempts; }
    public void setMaxReconnectAttempts(int maxReconnectAttempts) { this.maxReconnectAttempts = maxReconnectAttempts; }

    public long getReconnectDelayMs() { return reconnectDelayMs; }
    public void setReconnectDelayMs(long reconnectDelayMs) { this.reconnectDelayMs = reconnectDelayMs; }

    public long getHealthCheckIntervalMs() { return healthCheckIntervalMs; }
    public void setHealthCheckIntervalMs(long healthCheckIntervalMs) { this.healthCheckIntervalMs = healthCheckIntervalMs; }

    public long getHttpTimeoutMs() { return httpTimeoutMs; }
    public void setHttpTimeoutMs(long httpTimeoutMs) { this.httpTimeoutMs = httpTimeoutMs; }

    public boolean isResubscribeOnReconnect() { return resubscribeOnReconnect; }
    public void setResubscribeOnReconnect(boolean resubscribeOnReconnect) { this.resubscribeOnReconnect = resubscribeOnReconnect; }

    public boolean isRetryAfterReconnect() { return retryAfterReconnect; }
    public void setRetryAfterReconnect(boolean retryAfterReconnect) { this.retryAfterReconnect = retryAfterReconnect; }

    /**
     * Load from the default file location with property/env overrides.
     */
    public static ClientConfig load() throws IOException {
        return load(defaultPath());
    }

    /**
     * Load from {@code path} (missing file means defaults), then apply
     * system property and environment overrides.
     */
    public static ClientConfig load(Path path) throws IOException {
        ClientConfig config = new ClientConfig();
        if (Files.exists(path)) {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            config = mapper.readValue(path.toFile(), ClientConfig.class);
        }
        config.applyOverrides(System.getProperties(), System.getenv());
        return config;
    }

    public static Path defaultPath() {
        return Path.of(System.getProperty("user.home"), ".tradebot", "client.yaml");
    }

    /**
     * Apply {@code tradebot.*} properties and {@code TRADEBOT_*} environment
     * entries on top of the current values.
     */
    void applyOverrides(Map<Object, Object> properties, Map<String, String> env) {
        channelUrl = lookup(properties, env, "channel_url", channelUrl);
        apiBaseUrl = lookup(properties, env, "api_base_url", apiBaseUrl);
        connectTimeoutMs = Long.parseLong(lookup(properties, env, "connect_timeout_ms", String.valueOf(connectTimeoutMs)));
        requestTimeoutMs = Long.parseLong(lookup(properties, env, "request_timeout_ms", String.valueOf(requestTimeoutMs)));
        maxReconnectAttempts = Integer.parseInt(lookup(properties, env, "max_reconnect_attempts", String.valueOf(maxReconnectAttempts)));
        reconnectDelayMs = Long.parseLong(lookup(properties, env, "reconnect_delay_ms", String.valueOf(reconnectDelayMs)));
        healthCheckIntervalMs = Long.parseLong(lookup(properties, env, "health_check_interval_ms", String.valueOf(healthCheckIntervalMs)));
        httpTimeoutMs = Long.parseLong(lookup(properties, env, "http_timeout_ms", String.valueOf(httpTimeoutMs)));
        resubscribeOnReconnect = Boolean.parseBoolean(lookup(properties, env, "resubscribe_on_reconnect", String.valueOf(resubscribeOnReconnect)));
        retryAfterReconnect = Boolean.parseBoolean(lookup(properties, env, "retry_after_reconnect", String.valueOf(retryAfterReconnect)));
    }

    private static String lookup(Map<Object, Object> properties, Map<String, String> env, String key, String fallback) {
        String envValue = env.get("TRADEBOT_" + key.toUpperCase());
        Object propValue = properties.get("tradebot." + key);
        if (propValue != null && !propValue.toString().isBlank()) {
            return propValue.toString().trim();
        }
        if (envValue != null && !envValue.isBlank()) {
            return envValue.trim();
        }
        return fallback;
    }
}
