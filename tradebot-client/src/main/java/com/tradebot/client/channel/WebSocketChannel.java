package com.tradebot.client.channel;

import com.tradebot.client.exception.ConnectFailureException;
import com.tradebot.client.exception.TransportUnavailableException;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.exceptions.WebsocketNotConnectedException;
import org.java_websocket.handshake.ServerHandshake;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * {@link Channel} over a plain WebSocket carrying JSON text frames.
 */
public class WebSocketChannel implements Channel {
    private static final Logger LOG = LoggerFactory.getLogger(WebSocketChannel.class);
    private static final int CONNECTION_LOST_TIMEOUT_SECONDS = 60;

    private final TradingWebSocket webSocket;
    private final ChannelListener listener;

    public WebSocketChannel(URI serverUri, ChannelListener listener) {
        this.listener = listener;
        this.webSocket = new TradingWebSocket(serverUri);
        this.webSocket.setConnectionLostTimeout(CONNECTION_LOST_TIMEOUT_SECONDS);
    }

    /**
     * Factory producing channels for {@code url}.
     */
    public static ChannelFactory factory(String url) {
        return listener -> {
            try {
                return new WebSocketChannel(new URI(url), listener);
            } catch (URISyntaxException e) {
                throw new ConnectFailureException("Invalid channel URL: " + url, e);
            }
        };
    }

    @Override
    public void open() {
        webSocket.connect();
    }

    @Override
    public void send(String message) throws TransportUnavailableException {
        try {
            webSocket.send(message);
        } catch (WebsocketNotConnectedException e) {
            throw new TransportUnavailableException("Channel is not connected");
        }
    }

    @Override
    public void close() {
        webSocket.close();
    }

    @Override
    public boolean isOpen() {
        return webSocket.isOpen();
    }

    /**
     * WebSocket client implementation.
     */
    private class TradingWebSocket extends WebSocketClient {

        TradingWebSocket(URI serverUri) {
            super(serverUri);
        }

        @Override
        public void onOpen(ServerHandshake handshake) {
            listener.onOpen();
        }

        @Override
        public void onMessage(String message) {
            listener.onMessage(message);
        }

        @Override
        public void onClose(int code, String reason, boolean remote) {
            LOG.debug("WebSocket closed: code={}, reason={}, remote={}", code, reason, remote);
            listener.onClose(CloseReason.fromCloseCode(code, remote), code, reason);
        }

        @Override
        public void onError(Exception ex) {
            LOG.error("WebSocket error: {}", ex.getMessage());
            listener.onError(ex);
        }
    }
}
