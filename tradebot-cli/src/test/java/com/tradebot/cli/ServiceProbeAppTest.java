package com.tradebot.cli;

import com.sun.net.httpserver.HttpServer;
import com.tradebot.client.ClientConfig;
import com.tradebot.client.TradingServiceClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(30)
class ServiceProbeAppTest {

    private final Map<String, String> responses = new ConcurrentHashMap<>();
    private HttpServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            String body = responses.get(exchange.getRequestURI().getPath());
            byte[] bytes = (body != null ? body : "{\"error\": \"Not found\"}").getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(body != null ? 200 : 404, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private TradingServiceClient client() {
        ClientConfig config = new ClientConfig();
        config.setApiBaseUrl("http://127.0.0.1:" + server.getAddress().getPort());
        config.setChannelUrl("ws://127.0.0.1:1/ws");
        config.setConnectTimeoutMs(2000);
        config.setHealthCheckIntervalMs(0);
        return new TradingServiceClient(config);
    }

    @Test
    @DisplayName("Reports each check and the fallback transport")
    void probeSucceeds() {
        // Given
        responses.put("/trading/server-info", "{\"environment\": \"development\", \"port\": 3007, \"binanceTestnet\": true}");
        responses.put("/trading/total-balance", "{\"totalWalletBalance\": 1000, \"totalAvailableBalance\": 900}");
        responses.put("/trading/sessions", "[{\"id\": \"s-1\"}, {\"id\": \"s-2\"}]");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        // When
        int exitCode;
        try (TradingServiceClient client = client()) {
            exitCode = new ServiceProbeApp().run(client, new PrintStream(buffer, true, StandardCharsets.UTF_8));
        }
        String output = buffer.toString(StandardCharsets.UTF_8);

        // Then
        assertEquals(0, exitCode);
        assertTrue(output.contains("OK: development on port 3007"), output);
        assertTrue(output.contains("OK: 2 session(s)"), output);
        assertTrue(output.contains("FAILED: GET /trading/available-symbols failed: 404"), output);
        assertTrue(output.contains("HTTP fallback"), output);
    }

    @Test
    @DisplayName("Fails when the service does not answer")
    void probeFails() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        int exitCode;
        try (TradingServiceClient client = client()) {
            exitCode = new ServiceProbeApp().run(client, new PrintStream(buffer, true, StandardCharsets.UTF_8));
        }

        assertEquals(1, exitCode);
        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("service unreachable"));
    }
}
