package com.tradebot.client.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.tradebot.client.channel.ConnectionManager;
import com.tradebot.client.channel.ConnectionState;
import com.tradebot.client.exception.PayloadDecodeException;
import com.tradebot.client.exception.RequestTimeoutException;
import com.tradebot.client.exception.ServerRejectedException;
import com.tradebot.client.exception.TradingClientException;
import com.tradebot.client.exception.TransportUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Request/response correlation over the shared channel.
 *
 * Each request gets a fresh id and a pending entry with its own timeout.
 * An entry is settled exactly once, by whichever comes first of the
 * matching response, the timeout or loss of the channel. Responses that
 * arrive after that are dropped.
 */
public class RequestCorrelator {
    private static final Logger LOG = LoggerFactory.getLogger(RequestCorrelator.class);

    private final ConnectionManager connection;
    private final ScheduledExecutorService scheduler;
    private final ObjectMapper objectMapper;
    private final long requestTimeoutMs;
    private final Supplier<String> idSource;

    private final Map<String, PendingRequest> pending = new ConcurrentHashMap<>();

    public RequestCorrelator(ConnectionManager connection, ScheduledExecutorService scheduler,
                             ObjectMapper objectMapper, long requestTimeoutMs) {
        this(connection, scheduler, objectMapper, requestTimeoutMs, RequestIds::next);
    }

    RequestCorrelator(ConnectionManager connection, ScheduledExecutorService scheduler,
                      ObjectMapper objectMapper, long requestTimeoutMs, Supplier<String> idSource) {
        this.connection = connection;
        this.scheduler = scheduler;
        this.objectMapper = objectMapper;
        this.requestTimeoutMs = requestTimeoutMs;
        this.idSource = idSource;
    }

    /**
     * Send a typed request and decode its result.
     * A result that does not decode fails with {@link PayloadDecodeException}.
     */
    public <T> CompletableFuture<T> sendRequest(RemoteMethod<T> method, Object params) {
        return sendRequest(method.name(), params).thenCompose(data -> {
            try {
                return CompletableFuture.completedFuture(method.decode(objectMapper, data));
            } catch (IOException | RuntimeException e) {
                return CompletableFuture.failedFuture(new PayloadDecodeException(
                    "Cannot decode " + method.name() + " result: " + e.getMessage(), e));
            }
        });
    }

    /**
     * Send {@code {id, method, params}} and return the response {@code data}.
     */
    public CompletableFuture<JsonNode> sendRequest(String method, Object params) {
        if (!connection.isChannelUsable()) {
            return CompletableFuture.failedFuture(
                new TransportUnavailableException("Channel not usable for " + method));
        }

        PendingRequest entry = register(method);
        entry.setTimeoutTask(scheduler.schedule(() -> expire(entry),
            requestTimeoutMs, TimeUnit.MILLISECONDS));

        Map<String, Object> message = new LinkedHashMap<>();
        message.put("id", entry.id());
        message.put("method", method);
        if (params != null) {
            message.put("params", params);
        }

        try {
            String json = objectMapper.writeValueAsString(message);
            connection.send(json);
            LOG.debug("Sent request {} ({})", entry.id(), method);
        } catch (JsonProcessingException e) {
            settle(entry, new TransportUnavailableException("Cannot encode " + method + ": " + e.getOriginalMessage()));
        } catch (TransportUnavailableException e) {
            settle(entry, e);
        }
        return entry.future();
    }

    /**
     * Settle the pending request a response belongs to.
     *
     * @return false when no live request has the response's id
     */
    public boolean handleResponse(JsonNode response) {
        String id = response.path("id").asText(null);
        if (id == null) {
            return false;
        }
        PendingRequest entry = pending.remove(id);
        if (entry == null) {
            return false;
        }
        entry.cancelTimeout();

        if (response.path("success").asBoolean(false)) {
            JsonNode data = response.get("data");
            entry.future().complete(data != null ? data : NullNode.getInstance());
        } else {
            String error = response.path("error").asText("");
            entry.future().completeExceptionally(new ServerRejectedException(
                entry.method(), error.isEmpty() ? "Unknown error" : error));
        }
        return true;
    }

    public boolean isPending(String id) {
        return pending.containsKey(id);
    }

    public int pendingCount() {
        return pending.size();
    }

    /**
     * Fail every live request with {@code cause}.
     */
    public void failAll(TradingClientException cause) {
        List<PendingRequest> entries = new ArrayList<>(pending.values());
        int failed = 0;
        for (PendingRequest entry : entries) {
            if (settle(entry, cause)) {
                failed++;
            }
        }
        if (failed > 0) {
            LOG.warn("Failed {} pending request(s): {}", failed, cause.getMessage());
        }
    }

    /**
     * Connection listener hook: pending requests cannot be answered once
     * the channel is gone.
     */
    public void onConnectionStateChanged(ConnectionState state) {
        if (state == ConnectionState.DISCONNECTED) {
            failAll(new TransportUnavailableException("Channel closed before response"));
        }
    }

    private PendingRequest register(String method) {
        while (true) {
            PendingRequest entry = new PendingRequest(idSource.get(), method);
            if (pending.putIfAbsent(entry.id(), entry) == null) {
                return entry;
            }
            LOG.debug("Request id collision on {}, drawing again", entry.id());
        }
    }

    private void expire(PendingRequest entry) {
        if (pending.remove(entry.id(), entry)) {
            LOG.warn("Request {} ({}) timed out after {}ms", entry.id(), entry.method(), requestTimeoutMs);
            entry.future().completeExceptionally(new RequestTimeoutException(entry.method(), requestTimeoutMs));
        }
    }

    private boolean settle(PendingRequest entry, TradingClientException cause) {
        if (pending.remove(entry.id(), entry)) {
            entry.cancelTimeout();
            entry.future().completeExceptionally(cause);
            return true;
        }
        return false;
    }
}
