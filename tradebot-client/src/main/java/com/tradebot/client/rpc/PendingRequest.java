package com.tradebot.client.rpc;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * A request written to the channel and still waiting for its response.
 */
final class PendingRequest {

    private final String id;
    private final String method;
    private final CompletableFuture<JsonNode> future = new CompletableFuture<>();
    private final Instant createdAt = Instant.now();
    private volatile ScheduledFuture<?> timeoutTask;

    PendingRequest(String id, String method) {
        this.id = id;
        this.method = method;
    }

    String id() { return id; }
    String method() { return method; }
    CompletableFuture<JsonNode> future() { return future; }
    Instant createdAt() { return createdAt; }

    void setTimeoutTask(ScheduledFuture<?> timeoutTask) {
        this.timeoutTask = timeoutTask;
    }

    void cancelTimeout() {
        ScheduledFuture<?> task = timeoutTask;
        if (task != null) {
            task.cancel(false);
        }
    }
}
