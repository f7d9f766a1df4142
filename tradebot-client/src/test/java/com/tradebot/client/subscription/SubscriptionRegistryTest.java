package com.tradebot.client.subscription;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tradebot.client.channel.CloseReason;
import com.tradebot.client.channel.ConnectionManager;
import com.tradebot.client.channel.FakeChannel;
import com.tradebot.client.channel.FakeChannelFactory;
import com.tradebot.client.channel.ReconnectPolicy;
import com.tradebot.core.model.MarketAnalysis;
import com.tradebot.core.model.TotalBalance;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static com.tradebot.client.TestWaits.waitUntil;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SubscriptionRegistry.
 */
@Timeout(10)
class SubscriptionRegistryTest {

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

    private ScheduledExecutorService scheduler;
    private FakeChannelFactory factory;
    private ConnectionManager connection;
    private SubscriptionRegistry registry;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newScheduledThreadPool(1);
        factory = new FakeChannelFactory(FakeChannel.OpenBehavior.OPEN_IMMEDIATELY);
        connection = new ConnectionManager(factory, scheduler, 1000, 0, new ReconnectPolicy(3, 20));
        registry = new SubscriptionRegistry(connection, mapper, true);
        connection.addConnectionListener(registry::onConnectionStateChanged);
    }

    @AfterEach
    void tearDown() {
        connection.close();
        scheduler.shutdownNow();
    }

    private void connect() throws Exception {
        connection.connect().get(1, TimeUnit.SECONDS);
    }

    private JsonNode sent(FakeChannel channel, int index) throws Exception {
        return mapper.readTree(channel.sent().get(index));
    }

    @Nested
    @DisplayName("Subscribe and unsubscribe")
    class ControlTests {

        @Test
        @DisplayName("Subscribe sends a control message with the scope field")
        void subscribeSendsControl() throws Exception {
            connect();

            assertTrue(registry.subscribe(Topic.MARKET_ANALYSIS.key("BTCUSDT")));

            JsonNode message = sent(factory.last(), 0);
            assertEquals("subscribe", message.get("type").asText());
            assertEquals("market_analysis", message.get("payload").get("channel").asText());
            assertEquals("BTCUSDT", message.get("payload").get("symbol").asText());
            assertEquals(Set.of("market_analysis_BTCUSDT"), registry.activeSubscriptions());
        }

        @Test
        @DisplayName("Subscribing twice keeps one key and sends one message")
        void subscribeIsIdempotent() throws Exception {
            connect();
            TopicKey<List<MarketAnalysis>> key = Topic.MARKET_ANALYSIS.key("BTCUSDT");

            registry.subscribe(key);
            registry.subscribe(Topic.MARKET_ANALYSIS.key("BTCUSDT"));

            assertEquals(1, registry.subscriptionCount());
            assertEquals(1, factory.last().sent().size());
        }

        @Test
        @DisplayName("Subscribe without a usable channel is a local no-op")
        void subscribeWhileDisconnected() {
            assertFalse(registry.subscribe(Topic.SESSIONS.key()));

            assertEquals(0, registry.subscriptionCount());
            assertEquals(0, factory.createdCount());
        }

        @Test
        @DisplayName("Unsubscribe sends a control message and drops the key")
        void unsubscribe() throws Exception {
            connect();
            registry.subscribe(Topic.TRADES.key("s-1"));

            registry.unsubscribe(Topic.TRADES.key("s-1"));

            JsonNode message = sent(factory.last(), 1);
            assertEquals("unsubscribe", message.get("type").asText());
            assertEquals("trades", message.get("payload").get("channel").asText());
            assertEquals("s-1", message.get("payload").get("sessionId").asText());
            assertFalse(registry.isSubscribed(Topic.TRADES.key("s-1")));
        }

        @Test
        @DisplayName("Unsubscribe without a usable channel still drops the key")
        void unsubscribeWhileDemoted() throws Exception {
            connect();
            registry.subscribe(Topic.BALANCE.key());
            connection.demote("test");

            registry.unsubscribe(Topic.BALANCE.key());

            assertEquals(0, registry.subscriptionCount());
            assertEquals(1, factory.last().sent().size());
        }

        @Test
        @DisplayName("Keys are re-subscribed after a reconnect")
        void resubscribeAfterReconnect() throws Exception {
            // Given
            connect();
            registry.subscribe(Topic.SESSIONS.key());
            registry.subscribe(Topic.MARKET_ANALYSIS.key("ETHUSDT"));

            // When
            factory.last().remoteClose(CloseReason.CONNECTION_LOST, 1006);
            waitUntil(() -> factory.createdCount() == 2 && factory.last().sent().size() == 2, 2000, "re-subscribe");

            // Then
            List<String> resent = factory.last().sent();
            assertTrue(resent.stream().allMatch(m -> m.contains("\"subscribe\"")));
            assertEquals(2, registry.subscriptionCount());
        }
    }

    @Nested
    @DisplayName("Broadcast delivery")
    class DeliveryTests {

        @Test
        @DisplayName("Delivers typed payloads to listeners of the key")
        void deliversTyped() throws Exception {
            List<TotalBalance> received = new CopyOnWriteArrayList<>();
            registry.on(Topic.BALANCE.key(), received::add);

            boolean delivered = registry.handleBroadcast("balance",
                mapper.readTree("{\"totalBalance\": 100, \"availableBalance\": 60}"));

            assertTrue(delivered);
            assertEquals(1, received.size());
            assertEquals(100.0, received.get(0).totalBalance());
        }

        @Test
        @DisplayName("Scoped keys only reach their own listeners")
        void scopedDelivery() throws Exception {
            List<List<MarketAnalysis>> btc = new CopyOnWriteArrayList<>();
            List<List<MarketAnalysis>> eth = new CopyOnWriteArrayList<>();
            registry.on(Topic.MARKET_ANALYSIS.key("BTCUSDT"), btc::add);
            registry.on(Topic.MARKET_ANALYSIS.key("ETHUSDT"), eth::add);

            registry.handleBroadcast("market_analysis_BTCUSDT",
                mapper.readTree("[{\"symbol\": \"BTCUSDT\", \"timeframe\": \"1h\", \"volatility\": \"low\"}]"));

            assertEquals(1, btc.size());
            assertEquals("BTCUSDT", btc.get(0).get(0).symbol());
            assertTrue(eth.isEmpty());
        }

        @Test
        @DisplayName("Unknown types and bad payloads are dropped")
        void dropsUndecodable() throws Exception {
            List<Object> received = new CopyOnWriteArrayList<>();
            registry.on(Topic.SESSIONS.key(), received::add);

            assertFalse(registry.handleBroadcast("weather", mapper.readTree("{}")));
            assertFalse(registry.handleBroadcast("sessions", mapper.readTree("{\"not\": \"a list\"}")));
            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("A failing listener does not stop the others")
        void listenerIsolation() throws Exception {
            List<String> order = new CopyOnWriteArrayList<>();
            registry.on(Topic.SESSIONS.key(), sessions -> order.add("first"));
            registry.on(Topic.SESSIONS.key(), sessions -> {
                throw new IllegalStateException("boom");
            });
            registry.on(Topic.SESSIONS.key(), sessions -> order.add("third"));

            registry.handleBroadcast("sessions", mapper.readTree("[]"));

            assertEquals(List.of("first", "third"), order);
        }

        @Test
        @DisplayName("Removed listeners stop receiving")
        void removeListener() throws Exception {
            List<Object> received = new CopyOnWriteArrayList<>();
            ListenerRegistration registration = registry.on(Topic.SESSIONS.key(), received::add);

            registration.remove();
            registry.handleBroadcast("sessions", mapper.readTree("[]"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("Removing the last listener of a scope forgets the scope")
        void removeLastListenerDropsKey() {
            // Given
            ListenerRegistration first = registry.on(Topic.TRADES.key("s-1"), trades -> { });
            ListenerRegistration second = registry.on(Topic.TRADES.key("s-1"), trades -> { });
            ListenerRegistration other = registry.on(Topic.TRADES.key("s-2"), trades -> { });

            // When
            first.remove();

            // Then: s-1 still has a listener
            assertEquals(2, registry.listenerKeyCount());

            // When
            second.remove();
            other.remove();
            other.remove();

            // Then
            assertEquals(0, registry.listenerKeyCount());
        }
    }

    @Test
    @DisplayName("Broadcast types parse back to topic keys")
    void parseKey() {
        assertEquals(Topic.SESSIONS.key(), Topic.parseKey("sessions").orElseThrow());
        assertEquals(Topic.TRADES.key("42"), Topic.parseKey("trades_42").orElseThrow());
        assertEquals("market_analysis_SOLUSDT", Topic.parseKey("market_analysis_SOLUSDT").orElseThrow().key());
        assertTrue(Topic.parseKey("trades_").isEmpty());
        assertTrue(Topic.parseKey("unknown").isEmpty());
    }
}
