package com.tradebot.client.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tradebot.client.ClientConfig;
import com.tradebot.client.StubTradingService;
import com.tradebot.client.TradingServiceClient;
import com.tradebot.client.subscription.Topic;
import com.tradebot.core.model.ServerInfo;
import com.tradebot.core.model.TotalBalance;
import org.java_websocket.WebSocket;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.server.WebSocketServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.tradebot.client.TestWaits.waitUntil;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end test of the client over a loopback WebSocket server.
 */
@Timeout(20)
class WebSocketChannelTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicInteger channelCalls = new AtomicInteger();
    private final List<String> controlMessages = new CopyOnWriteArrayList<>();

    private TradingWebSocketServer server;
    private StubTradingService rest;
    private TradingServiceClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new TradingWebSocketServer();
        server.setReuseAddr(true);
        server.start();
        assertTrue(server.started.await(5, TimeUnit.SECONDS), "server did not start");

        rest = new StubTradingService()
            .respond("GET", "/trading/server-info", "{\"environment\": \"fallback\", \"port\": 3007}");

        ClientConfig config = new ClientConfig();
        config.setChannelUrl("ws://127.0.0.1:" + server.getPort() + "/ws");
        config.setApiBaseUrl(rest.baseUrl());
        config.setConnectTimeoutMs(3000);
        config.setRequestTimeoutMs(3000);
        config.setHealthCheckIntervalMs(0);
        client = new TradingServiceClient(config);
    }

    @AfterEach
    void tearDown() throws Exception {
        client.close();
        rest.close();
        server.stop(1000);
    }

    @Test
    @DisplayName("Calls, broadcasts and a server close over a real socket")
    void endToEnd() throws Exception {
        // Connect
        client.connect().get(5, TimeUnit.SECONDS);
        assertTrue(client.isChannelConnected());
        assertTrue(client.isUsingChannel());

        // Request over the channel
        ServerInfo info = client.getServerInfo().get(5, TimeUnit.SECONDS);
        assertEquals("channel", info.environment());
        assertEquals(1, channelCalls.get());

        // Subscription and broadcast
        CountDownLatch pushed = new CountDownLatch(1);
        List<TotalBalance> balances = new CopyOnWriteArrayList<>();
        client.on(Topic.BALANCE.key(), balance -> {
            balances.add(balance);
            pushed.countDown();
        });
        assertTrue(client.subscribeToBalance());
        assertTrue(pushed.await(5, TimeUnit.SECONDS), "no balance broadcast");
        assertEquals(77.0, balances.get(0).totalBalance());
        assertTrue(controlMessages.get(0).contains("\"balance\""));

        // Service ends the session on purpose: calls move to HTTP
        server.getConnections().forEach(conn -> conn.close(1000, "shutting down"));
        waitUntil(() -> !client.isUsingChannel(), 5000, "demotion after server close");

        ServerInfo fallback = client.getServerInfo().get(5, TimeUnit.SECONDS);
        assertEquals("fallback", fallback.environment());
        assertEquals(1, channelCalls.get());
        assertFalse(client.isChannelConnected());
    }

    @Test
    @DisplayName("Unreachable channel leaves the client on HTTP")
    void unreachableChannel() throws Exception {
        ClientConfig config = new ClientConfig();
        config.setChannelUrl("ws://127.0.0.1:1/ws");
        config.setApiBaseUrl(rest.baseUrl());
        config.setConnectTimeoutMs(2000);
        config.setHealthCheckIntervalMs(0);

        try (TradingServiceClient offline = new TradingServiceClient(config)) {
            offline.connect().get(5, TimeUnit.SECONDS);

            assertFalse(offline.isUsingChannel());
            assertEquals("fallback", offline.getServerInfo().get(5, TimeUnit.SECONDS).environment());
        }
    }

    /**
     * Minimal trading service: answers getServerInfo and pushes one balance
     * update per subscribe.
     */
    private class TradingWebSocketServer extends WebSocketServer {
        final CountDownLatch started = new CountDownLatch(1);

        TradingWebSocketServer() {
            super(new InetSocketAddress("127.0.0.1", 0));
        }

        @Override
        public void onStart() {
            started.countDown();
        }

        @Override
        public void onOpen(WebSocket conn, ClientHandshake handshake) {
        }

        @Override
        public void onClose(WebSocket conn, int code, String reason, boolean remote) {
        }

        @Override
        public void onMessage(WebSocket conn, String message) {
            try {
                JsonNode request = mapper.readTree(message);
                if (request.has("id")) {
                    channelCalls.incrementAndGet();
                    ObjectNode response = mapper.createObjectNode();
                    response.put("id", request.get("id").asText());
                    response.put("success", true);
                    response.set("data", mapper.readTree("{\"environment\": \"channel\", \"port\": 3007}"));
                    conn.send(mapper.writeValueAsString(response));
                } else if ("subscribe".equals(request.path("type").asText())) {
                    controlMessages.add(message);
                    conn.send("{\"type\": \"balance\", \"data\": {\"totalBalance\": 77}}");
                }
            } catch (Exception e) {
                conn.close(1011, e.getMessage());
            }
        }

        @Override
        public void onError(WebSocket conn, Exception ex) {
        }
    }
}
