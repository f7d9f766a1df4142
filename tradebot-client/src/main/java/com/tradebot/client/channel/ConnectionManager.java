package com.tradebot.client.channel;

import com.tradebot.client.exception.ConnectFailureException;
import com.tradebot.client.exception.TransportUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Owns the persistent channel to the trading service.
 *
 * Handles:
 * - Coalesced connect with a connect timeout (connect never fails, it demotes)
 * - Classification of unexpected closes (server intent vs. network loss)
 * - Bounded fixed-delay reconnection
 * - Periodic health check that is the only way back after the budget is spent
 * - The transport mode flag the dispatcher reads
 *
 * Every timer runs on the injected scheduler and is cancelled by
 * {@link #disconnect()}.
 */
public class ConnectionManager implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionManager.class);

    private final ChannelFactory channelFactory;
    private final ScheduledExecutorService scheduler;
    private final long connectTimeoutMs;
    private final long healthCheckIntervalMs;
    private final ReconnectPolicy reconnectPolicy;

    private final Object lock = new Object();

    // Guarded by lock
    private Channel channel;
    private CompletableFuture<Void> pendingConnect;
    private ScheduledFuture<?> connectTimeoutTask;
    private ScheduledFuture<?> reconnectTask;
    private ScheduledFuture<?> healthCheckTask;
    private boolean disconnectRequested;
    private boolean shutdown;

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile TransportMode mode = TransportMode.CHANNEL_PREFERRED;

    private final Set<Consumer<ConnectionState>> connectionListeners = ConcurrentHashMap.newKeySet();
    private volatile Consumer<String> messageHandler = message -> {};

    public ConnectionManager(ChannelFactory channelFactory, ScheduledExecutorService scheduler,
                             long connectTimeoutMs, long healthCheckIntervalMs,
                             ReconnectPolicy reconnectPolicy) {
        this.channelFactory = channelFactory;
        this.scheduler = scheduler;
        this.connectTimeoutMs = connectTimeoutMs;
        this.healthCheckIntervalMs = healthCheckIntervalMs;
        this.reconnectPolicy = reconnectPolicy;
    }

    /**
     * Open the channel if it is not open yet.
     *
     * Concurrent callers share one attempt. The returned future always
     * completes normally; on failure the transport mode is demoted to
     * {@link TransportMode#FALLBACK_ONLY} instead.
     */
    public CompletableFuture<Void> connect() {
        Channel created;
        CompletableFuture<Void> future;

        synchronized (lock) {
            if (shutdown) {
                LOG.warn("Cannot connect - connection manager is shut down");
                return CompletableFuture.completedFuture(null);
            }
            disconnectRequested = false;
            ensureHealthCheck();

            if (state == ConnectionState.CONNECTED && channel != null && channel.isOpen()) {
                LOG.debug("Already connected");
                return CompletableFuture.completedFuture(null);
            }
            if (state == ConnectionState.CONNECTING && pendingConnect != null) {
                LOG.debug("Connect already in flight, joining it");
                return pendingConnect;
            }

            future = new CompletableFuture<>();
            BoundListener listener = new BoundListener();
            try {
                created = channelFactory.create(listener);
            } catch (ConnectFailureException e) {
                LOG.error("Failed to create channel: {}", e.getMessage());
                demote("channel could not be created");
                future.complete(null);
                return future;
            }
            listener.owner = created;
            channel = created;
            pendingConnect = future;
            state = ConnectionState.CONNECTING;
            connectTimeoutTask = scheduler.schedule(() -> onConnectTimeout(created),
                connectTimeoutMs, TimeUnit.MILLISECONDS);
        }

        LOG.info("Connecting to trading service channel...");
        notifyListeners(ConnectionState.CONNECTING);

        try {
            created.open();
        } catch (RuntimeException e) {
            failConnect(created, new ConnectFailureException("Channel open failed: " + e.getMessage(), e));
        }
        return future;
    }

    /**
     * Tear the channel down and cancel reconnects and the health check.
     * Does nothing when already disconnected.
     */
    public void disconnect() {
        Channel closing;
        CompletableFuture<Void> abandoned;
        boolean changed;

        synchronized (lock) {
            disconnectRequested = true;
            cancel(reconnectTask);
            cancel(connectTimeoutTask);
            cancel(healthCheckTask);
            reconnectTask = null;
            connectTimeoutTask = null;
            healthCheckTask = null;

            closing = channel;
            channel = null;
            abandoned = pendingConnect;
            pendingConnect = null;
            changed = state != ConnectionState.DISCONNECTED;
            state = ConnectionState.DISCONNECTED;
        }

        if (closing != null) {
            LOG.info("Disconnecting from trading service channel");
            closing.close();
        }
        if (abandoned != null) {
            abandoned.complete(null);
        }
        if (changed) {
            notifyListeners(ConnectionState.DISCONNECTED);
        }
    }

    /**
     * Disconnect and stop accepting connects. The scheduler is owned by the
     * caller and is not shut down here.
     */
    @Override
    public void close() {
        disconnect();
        synchronized (lock) {
            shutdown = true;
        }
    }

    /**
     * Write a message on the connected channel.
     */
    public void send(String message) throws TransportUnavailableException {
        Channel current;
        synchronized (lock) {
            current = state == ConnectionState.CONNECTED ? channel : null;
        }
        if (current == null) {
            throw new TransportUnavailableException("Channel is not connected");
        }
        current.send(message);
    }

    /**
     * True when calls should go over the channel right now.
     */
    public boolean isChannelUsable() {
        return state == ConnectionState.CONNECTED && mode == TransportMode.CHANNEL_PREFERRED;
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    public ConnectionState getState() {
        return state;
    }

    public TransportMode getMode() {
        return mode;
    }

    public int getReconnectAttempts() {
        return reconnectPolicy.getAttempt();
    }

    /**
     * Stop preferring the channel. Only a later successful connect restores it.
     */
    public void demote(String why) {
        if (mode != TransportMode.FALLBACK_ONLY) {
            LOG.warn("Switching to HTTP fallback: {}", why);
            mode = TransportMode.FALLBACK_ONLY;
        }
    }

    public void setMessageHandler(Consumer<String> handler) {
        this.messageHandler = handler != null ? handler : message -> {};
    }

    /**
     * Add a connection state listener. It is called immediately with the
     * current state.
     */
    public void addConnectionListener(Consumer<ConnectionState> listener) {
        connectionListeners.add(listener);
        listener.accept(state);
    }

    public void removeConnectionListener(Consumer<ConnectionState> listener) {
        connectionListeners.remove(listener);
    }

    // ========== Health check ==========

    private void ensureHealthCheck() {
        if (healthCheckTask == null && healthCheckIntervalMs > 0) {
            healthCheckTask = scheduler.scheduleAtFixedRate(this::runHealthCheck,
                healthCheckIntervalMs, healthCheckIntervalMs, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * One health probe. Reconnects when the channel is down, and recycles a
     * connected channel that calls have been demoted away from.
     */
    void runHealthCheck() {
        Channel stale = null;
        synchronized (lock) {
            if (shutdown || disconnectRequested || state == ConnectionState.CONNECTING) {
                return;
            }
            if (state == ConnectionState.CONNECTED) {
                if (mode == TransportMode.CHANNEL_PREFERRED) {
                    return;
                }
                stale = channel;
                channel = null;
                state = ConnectionState.DISCONNECTED;
            }
        }

        if (stale != null) {
            LOG.info("Health check: recycling demoted channel");
            stale.close();
            notifyListeners(ConnectionState.DISCONNECTED);
        } else {
            LOG.info("Health check: channel down, attempting reconnect");
        }
        connect();
    }

    // ========== Reconnection ==========

    private void scheduleReconnect() {
        synchronized (lock) {
            if (shutdown || disconnectRequested) {
                return;
            }
            if (!reconnectPolicy.hasAttemptsLeft()) {
                LOG.error("Reached max reconnect attempts ({})", reconnectPolicy.getMaxAttempts());
                demote("reconnect attempts exhausted");
                return;
            }
            int attempt = reconnectPolicy.nextAttempt();
            LOG.info("Reconnect attempt {}/{} in {}ms",
                attempt, reconnectPolicy.getMaxAttempts(), reconnectPolicy.getDelayMs());
            reconnectTask = scheduler.schedule(this::runReconnectAttempt,
                reconnectPolicy.getDelayMs(), TimeUnit.MILLISECONDS);
        }
    }

    private void runReconnectAttempt() {
        connect().whenComplete((ignored, error) -> {
            if (state != ConnectionState.CONNECTED) {
                scheduleReconnect();
            }
        });
    }

    // ========== Channel events ==========

    private void onOpened(Channel source) {
        CompletableFuture<Void> completed;
        boolean stale;
        synchronized (lock) {
            stale = source != channel;
            if (stale || state != ConnectionState.CONNECTING) {
                completed = null;
            } else {
                cancel(connectTimeoutTask);
                connectTimeoutTask = null;
                state = ConnectionState.CONNECTED;
                mode = TransportMode.CHANNEL_PREFERRED;
                reconnectPolicy.reset();
                completed = pendingConnect;
                pendingConnect = null;
            }
        }
        if (stale) {
            LOG.debug("Closing channel that opened after its connect was abandoned");
            source.close();
            return;
        }
        if (completed == null) {
            LOG.debug("Ignoring duplicate open");
            return;
        }

        LOG.info("Connected to trading service channel");
        notifyListeners(ConnectionState.CONNECTED);
        completed.complete(null);
    }

    private void onConnectTimeout(Channel source) {
        failConnect(source, new ConnectFailureException(
            "Channel did not open within " + connectTimeoutMs + "ms"));
    }

    private void onClosed(Channel source, CloseReason reason, int code, String detail) {
        boolean connecting;
        synchronized (lock) {
            if (source != channel) {
                LOG.debug("Ignoring close from a stale channel");
                return;
            }
            connecting = state == ConnectionState.CONNECTING;
            if (!connecting) {
                channel = null;
                state = ConnectionState.DISCONNECTED;
            }
        }
        if (connecting) {
            // Closed before it ever opened: a failed connect, not a lost connection
            failConnect(source, new ConnectFailureException(
                "Channel closed while connecting: code=" + code + ", reason=" + detail));
            return;
        }

        LOG.warn("Channel closed: {} (code={}, reason={})", reason, code, detail);
        // Listeners must already see FALLBACK_ONLY when the service ended the channel
        if (reason == CloseReason.SERVER_TERMINATED) {
            demote("service closed the channel");
        }
        notifyListeners(ConnectionState.DISCONNECTED);

        switch (reason) {
            case CONNECTION_LOST -> scheduleReconnect();
            case CLIENT_REQUESTED -> LOG.debug("Channel closed by client");
            case SERVER_TERMINATED -> LOG.debug("Not reconnecting after service close");
        }
    }

    private void onErrored(Channel source, Exception error) {
        boolean connecting;
        synchronized (lock) {
            connecting = source == channel && state == ConnectionState.CONNECTING;
        }
        if (connecting) {
            failConnect(source, new ConnectFailureException("Channel error while connecting: " + error.getMessage(), error));
        }
        // Errors on an open channel are followed by onClose
    }

    private void onInbound(Channel source, String message) {
        synchronized (lock) {
            if (source != channel) {
                return;
            }
        }
        try {
            messageHandler.accept(message);
        } catch (Exception e) {
            LOG.warn("Error handling channel message: {}", e.getMessage());
        }
    }

    /**
     * Settle the pending connect as failed: tear down, demote, complete.
     */
    private void failConnect(Channel source, ConnectFailureException failure) {
        CompletableFuture<Void> completed;
        synchronized (lock) {
            if (source == null || source != channel || state != ConnectionState.CONNECTING) {
                return;
            }
            cancel(connectTimeoutTask);
            connectTimeoutTask = null;
            channel = null;
            state = ConnectionState.DISCONNECTED;
            completed = pendingConnect;
            pendingConnect = null;
        }

        LOG.warn("Channel connect failed: {}", failure.getMessage());
        source.close();
        demote("channel unavailable");
        notifyListeners(ConnectionState.DISCONNECTED);
        if (completed != null) {
            completed.complete(null);
        }
    }

    private void notifyListeners(ConnectionState newState) {
        for (Consumer<ConnectionState> listener : connectionListeners) {
            try {
                listener.accept(newState);
            } catch (Exception e) {
                LOG.warn("Error in connection listener: {}", e.getMessage());
            }
        }
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }

    /**
     * Routes events of one channel instance back here, tagged with that
     * instance so late events from replaced channels are ignored.
     */
    private class BoundListener implements ChannelListener {
        private volatile Channel owner;

        @Override
        public void onOpen() {
            onOpened(owner);
        }

        @Override
        public void onMessage(String message) {
            onInbound(owner, message);
        }

        @Override
        public void onClose(CloseReason reason, int code, String detail) {
            onClosed(owner, reason, code, detail);
        }

        @Override
        public void onError(Exception error) {
            onErrored(owner, error);
        }
    }
}
