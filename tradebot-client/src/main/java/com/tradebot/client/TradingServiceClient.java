package com.tradebot.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tradebot.client.channel.ChannelFactory;
import com.tradebot.client.channel.ConnectionManager;
import com.tradebot.client.channel.ConnectionState;
import com.tradebot.client.channel.ReconnectPolicy;
import com.tradebot.client.channel.TransportMode;
import com.tradebot.client.channel.WebSocketChannel;
import com.tradebot.client.dispatch.FallbackDispatcher;
import com.tradebot.client.http.HttpRoute;
import com.tradebot.client.http.RestFallbackClient;
import com.tradebot.client.rpc.RemoteMethods;
import com.tradebot.client.rpc.RequestCorrelator;
import com.tradebot.client.subscription.ListenerRegistration;
import com.tradebot.client.subscription.SubscriptionRegistry;
import com.tradebot.client.subscription.Topic;
import com.tradebot.client.subscription.TopicKey;
import com.tradebot.core.model.ActiveSessionRoi;
import com.tradebot.core.model.AutoTradingStatus;
import com.tradebot.core.model.MarketAnalysis;
import com.tradebot.core.model.ServerInfo;
import com.tradebot.core.model.TotalBalance;
import com.tradebot.core.model.Trade;
import com.tradebot.core.model.TradingSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Client for the trading service.
 *
 * Every call goes over the persistent channel while it is healthy and falls
 * back to the REST API otherwise; callers only see the typed futures.
 * Create one instance at startup, pass it around, and {@link #close()} it on
 * shutdown.
 */
public class TradingServiceClient implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(TradingServiceClient.class);

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "TradingServiceClient-Scheduler");
        t.setDaemon(true);
        return t;
    });
    private final ExecutorService httpExecutor;

    private final ConnectionManager connection;
    private final RequestCorrelator correlator;
    private final SubscriptionRegistry subscriptions;
    private final RestFallbackClient http;
    private final FallbackDispatcher dispatcher;

    public TradingServiceClient(ClientConfig config) {
        this(config, WebSocketChannel.factory(config.getChannelUrl()));
    }

    public TradingServiceClient(ClientConfig config, ChannelFactory channelFactory) {
        AtomicInteger httpThreads = new AtomicInteger();
        this.httpExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "TradingServiceClient-Http-" + httpThreads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        this.connection = new ConnectionManager(channelFactory, scheduler,
            config.getConnectTimeoutMs(), config.getHealthCheckIntervalMs(),
            new ReconnectPolicy(config.getMaxReconnectAttempts(), config.getReconnectDelayMs()));
        this.correlator = new RequestCorrelator(connection, scheduler, objectMapper, config.getRequestTimeoutMs());
        this.subscriptions = new SubscriptionRegistry(connection, objectMapper, config.isResubscribeOnReconnect());
        this.http = new RestFallbackClient(config.getApiBaseUrl(), config.getHttpTimeoutMs(), objectMapper);
        this.dispatcher = new FallbackDispatcher(connection, correlator, http, httpExecutor,
            config.isRetryAfterReconnect());

        connection.setMessageHandler(new MessageRouter(objectMapper, correlator, subscriptions));
        connection.addConnectionListener(correlator::onConnectionStateChanged);
        connection.addConnectionListener(subscriptions::onConnectionStateChanged);
    }

    // ========== Lifecycle ==========

    /**
     * Open the channel. Completes once connected or demoted to HTTP; never
     * completes exceptionally.
     */
    public CompletableFuture<Void> connect() {
        return connection.connect();
    }

    public void disconnect() {
        connection.disconnect();
    }

    @Override
    public void close() {
        LOG.info("Closing trading service client");
        connection.close();
        scheduler.shutdownNow();
        httpExecutor.shutdown();
        http.shutdown();
    }

    // ========== Sessions ==========

    public CompletableFuture<List<TradingSession>> getAllSessions() {
        return dispatcher.dispatch(RemoteMethods.GET_ALL_SESSIONS, null,
            HttpRoute.get("trading", "sessions"));
    }

    public CompletableFuture<TradingSession> getSessionStatus(String symbol) {
        return dispatcher.dispatch(RemoteMethods.GET_SESSION_STATUS, params("symbol", symbol),
            HttpRoute.get("trading", "session", symbol, "status"));
    }

    public CompletableFuture<List<Trade>> getSessionTrades(String sessionId) {
        return dispatcher.dispatch(RemoteMethods.GET_SESSION_TRADES, params("sessionId", sessionId),
            HttpRoute.get("trading", "session", sessionId, "trades"));
    }

    public CompletableFuture<TradingSession> initializeSession(String symbol, double initialBalance, double reserveBalance) {
        Map<String, Object> body = params("symbol", symbol, "initialBalance", initialBalance, "reserveBalance", reserveBalance);
        return dispatcher.dispatch(RemoteMethods.INITIALIZE_SESSION, body,
            HttpRoute.post(body, "trading", "session", "initialize"));
    }

    public CompletableFuture<Void> closeSession(String sessionId) {
        return dispatcher.dispatch(RemoteMethods.CLOSE_SESSION, params("sessionId", sessionId),
            HttpRoute.delete("trading", "session", sessionId));
    }

    public CompletableFuture<Void> analyzeAndTrade(String symbol) {
        return dispatcher.dispatch(RemoteMethods.ANALYZE_AND_TRADE, params("symbol", symbol),
            HttpRoute.post(null, "trading", "session", symbol, "analyze"));
    }

    public CompletableFuture<Void> updateVolatilityCheck(String sessionId, boolean enabled) {
        return dispatcher.dispatch(RemoteMethods.UPDATE_VOLATILITY_CHECK,
            params("sessionId", sessionId, "enableVolatilityCheck", enabled),
            HttpRoute.post(params("enabled", enabled), "trading", "session", sessionId, "volatility-check"));
    }

    public CompletableFuture<List<ActiveSessionRoi>> getActiveSessionsWithRoi() {
        return dispatcher.dispatch(RemoteMethods.GET_ACTIVE_SESSIONS_WITH_ROI, null,
            HttpRoute.get("trading", "active-sessions-roi"));
    }

    public CompletableFuture<Integer> getActivePositionsCount() {
        return dispatcher.dispatch(RemoteMethods.GET_ACTIVE_POSITIONS_COUNT, null,
            HttpRoute.get("trading", "active-positions-count"));
    }

    // ========== Market ==========

    public CompletableFuture<List<MarketAnalysis>> getMarketAnalysis(String symbol) {
        return dispatcher.dispatch(RemoteMethods.GET_MARKET_ANALYSIS, params("symbol", symbol),
            HttpRoute.get("trading", "market", "analysis", symbol));
    }

    /**
     * Analysis for several symbols, one list per symbol in request order.
     * Symbols the service could not analyze yield an empty list.
     */
    public CompletableFuture<List<List<MarketAnalysis>>> getMarketAnalysisBatch(List<String> symbols) {
        return dispatcher.dispatch(RemoteMethods.GET_MARKET_ANALYSIS_BATCH, params("symbols", symbols),
            HttpRoute.get("trading", "market", "analysis-batch").withQuery("symbols", String.join(",", symbols)));
    }

    public CompletableFuture<List<String>> getAvailableSymbols() {
        return dispatcher.dispatch(RemoteMethods.GET_AVAILABLE_SYMBOLS, null,
            HttpRoute.get("trading", "available-symbols"));
    }

    public CompletableFuture<List<String>> getActiveSymbols() {
        return dispatcher.dispatch(RemoteMethods.GET_ACTIVE_SYMBOLS, null,
            HttpRoute.get("trading", "active-symbols"));
    }

    // ========== Account / server ==========

    public CompletableFuture<TotalBalance> getTotalBalance() {
        return dispatcher.dispatch(RemoteMethods.GET_TOTAL_BALANCE, null,
            HttpRoute.get("trading", "total-balance"));
    }

    public CompletableFuture<ServerInfo> getServerInfo() {
        return dispatcher.dispatch(RemoteMethods.GET_SERVER_INFO, null,
            HttpRoute.get("trading", "server-info"));
    }

    // ========== Auto-trading ==========

    /**
     * @param intervalMs analysis interval, or null for the service default
     */
    public CompletableFuture<Void> startAutoTrading(Long intervalMs) {
        Map<String, Object> body = params("intervalMs", intervalMs);
        return dispatcher.dispatch(RemoteMethods.START_AUTO_TRADING, body,
            HttpRoute.post(body, "trading", "auto-trading", "start"));
    }

    public CompletableFuture<Void> stopAutoTrading() {
        return dispatcher.dispatch(RemoteMethods.STOP_AUTO_TRADING, null,
            HttpRoute.post(null, "trading", "auto-trading", "stop"));
    }

    public CompletableFuture<AutoTradingStatus> getAutoTradingStatus() {
        return dispatcher.dispatch(RemoteMethods.GET_AUTO_TRADING_STATUS, null,
            HttpRoute.get("trading", "auto-trading", "status"));
    }

    public CompletableFuture<Void> updateAutoTradingInterval(long intervalMs) {
        Map<String, Object> body = params("intervalMs", intervalMs);
        return dispatcher.dispatch(RemoteMethods.UPDATE_AUTO_TRADING_INTERVAL, body,
            HttpRoute.post(body, "trading", "auto-trading", "interval"));
    }

    // ========== Subscriptions ==========

    public boolean subscribeToSessions() {
        return subscriptions.subscribe(Topic.SESSIONS.key());
    }

    public void unsubscribeFromSessions() {
        subscriptions.unsubscribe(Topic.SESSIONS.key());
    }

    public boolean subscribeToTrades(String sessionId) {
        return subscriptions.subscribe(Topic.TRADES.key(sessionId));
    }

    public void unsubscribeFromTrades(String sessionId) {
        subscriptions.unsubscribe(Topic.TRADES.key(sessionId));
    }

    public boolean subscribeToMarketAnalysis(String symbol) {
        return subscriptions.subscribe(Topic.MARKET_ANALYSIS.key(symbol));
    }

    public void unsubscribeFromMarketAnalysis(String symbol) {
        subscriptions.unsubscribe(Topic.MARKET_ANALYSIS.key(symbol));
    }

    public boolean subscribeToBalance() {
        return subscriptions.subscribe(Topic.BALANCE.key());
    }

    public void unsubscribeFromBalance() {
        subscriptions.unsubscribe(Topic.BALANCE.key());
    }

    /**
     * Listen for broadcasts on {@code key}. Listeners run on the channel thread.
     */
    public <T> ListenerRegistration on(TopicKey<T> key, Consumer<? super T> listener) {
        return subscriptions.on(key, listener);
    }

    // ========== Status ==========

    public ConnectionStatus getConnectionStatus() {
        return new ConnectionStatus(
            connection.isConnected(),
            connection.getMode() == TransportMode.CHANNEL_PREFERRED,
            connection.getReconnectAttempts(),
            subscriptions.subscriptionCount());
    }

    public boolean isChannelConnected() {
        return connection.isConnected();
    }

    public boolean isUsingChannel() {
        return connection.getMode() == TransportMode.CHANNEL_PREFERRED;
    }

    public void addConnectionListener(Consumer<ConnectionState> listener) {
        connection.addConnectionListener(listener);
    }

    public void removeConnectionListener(Consumer<ConnectionState> listener) {
        connection.removeConnectionListener(listener);
    }

    ConnectionManager connectionManager() {
        return connection;
    }

    SubscriptionRegistry subscriptionRegistry() {
        return subscriptions;
    }

    /**
     * Build a params map from name/value pairs, skipping null values.
     */
    private static Map<String, Object> params(Object... pairs) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            if (pairs[i + 1] != null) {
                map.put((String) pairs[i], pairs[i + 1]);
            }
        }
        return map;
    }
}
