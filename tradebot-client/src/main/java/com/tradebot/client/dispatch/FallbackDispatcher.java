package com.tradebot.client.dispatch;

import com.tradebot.client.channel.ConnectionManager;
import com.tradebot.client.channel.TransportMode;
import com.tradebot.client.exception.FallbackHttpException;
import com.tradebot.client.exception.PayloadDecodeException;
import com.tradebot.client.exception.RequestTimeoutException;
import com.tradebot.client.exception.ServerRejectedException;
import com.tradebot.client.exception.TransportUnavailableException;
import com.tradebot.client.http.HttpRoute;
import com.tradebot.client.http.RestFallbackClient;
import com.tradebot.client.rpc.RemoteMethod;
import com.tradebot.client.rpc.RequestCorrelator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Runs a call over the channel when it is preferred, otherwise (or when the
 * channel path fails) over HTTP.
 *
 * Channel failures get one reconnect-and-retry before the channel is demoted.
 * A rejection from the service is an answer, not a transport failure, and is
 * returned as-is.
 */
public class FallbackDispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(FallbackDispatcher.class);

    private final ConnectionManager connection;
    private final RequestCorrelator correlator;
    private final RestFallbackClient http;
    private final Executor httpExecutor;
    private final boolean retryAfterReconnect;

    public FallbackDispatcher(ConnectionManager connection, RequestCorrelator correlator,
                              RestFallbackClient http, Executor httpExecutor,
                              boolean retryAfterReconnect) {
        this.connection = connection;
        this.correlator = correlator;
        this.http = http;
        this.httpExecutor = httpExecutor;
        this.retryAfterReconnect = retryAfterReconnect;
    }

    /**
     * Run {@code method} with {@code params}, or {@code route} when the channel
     * cannot serve it.
     */
    public <T> CompletableFuture<T> dispatch(RemoteMethod<T> method, Object params, HttpRoute route) {
        if (!connection.isChannelUsable()) {
            return viaHttp(method, route);
        }
        return correlator.sendRequest(method, params)
            .<CompletableFuture<T>>handle((result, error) -> error == null
                ? CompletableFuture.completedFuture(result)
                : recover(method, params, route, unwrap(error)))
            .thenCompose(f -> f);
    }

    private <T> CompletableFuture<T> recover(RemoteMethod<T> method, Object params, HttpRoute route, Throwable error) {
        if (error instanceof ServerRejectedException) {
            return CompletableFuture.failedFuture(error);
        }
        if (!retryAfterReconnect || !isRetryable(error)
                || connection.getMode() == TransportMode.FALLBACK_ONLY) {
            return fallBack(method, route, error);
        }

        LOG.info("Channel call {} failed ({}), reconnecting before retry", method.name(), error.getMessage());
        return connection.connect().thenCompose(ignored -> {
            if (!connection.isChannelUsable()) {
                return fallBack(method, route, error);
            }
            return correlator.sendRequest(method, params)
                .<CompletableFuture<T>>handle((result, retryError) -> {
                    if (retryError == null) {
                        return CompletableFuture.completedFuture(result);
                    }
                    Throwable cause = unwrap(retryError);
                    if (cause instanceof ServerRejectedException) {
                        return CompletableFuture.failedFuture(cause);
                    }
                    return fallBack(method, route, cause);
                })
                .thenCompose(f -> f);
        });
    }

    private <T> CompletableFuture<T> fallBack(RemoteMethod<T> method, HttpRoute route, Throwable error) {
        LOG.warn("Channel call {} failed: {}", method.name(), error.getMessage());
        connection.demote("channel call " + method.name() + " failed");
        return viaHttp(method, route);
    }

    private <T> CompletableFuture<T> viaHttp(RemoteMethod<T> method, HttpRoute route) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return http.execute(route, method.decoder());
            } catch (FallbackHttpException e) {
                throw new CompletionException(e);
            }
        }, httpExecutor);
    }

    private static boolean isRetryable(Throwable error) {
        return error instanceof TransportUnavailableException
            || error instanceof RequestTimeoutException
            || error instanceof PayloadDecodeException;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
