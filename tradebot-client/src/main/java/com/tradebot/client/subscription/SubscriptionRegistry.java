package com.tradebot.client.subscription;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradebot.client.channel.ConnectionManager;
import com.tradebot.client.channel.ConnectionState;
import com.tradebot.client.exception.TransportUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Server-push subscriptions and typed broadcast delivery.
 *
 * The key set records what the client believes the service is pushing.
 * Subscribing only talks to the service while the channel is usable; in
 * fallback mode it is a no-op and callers poll instead.
 */
public class SubscriptionRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final ConnectionManager connection;
    private final ObjectMapper objectMapper;
    private final boolean resubscribeOnReconnect;

    private final Map<String, TopicKey<?>> active = new ConcurrentHashMap<>();
    private final Map<String, List<Consumer<Object>>> listeners = new ConcurrentHashMap<>();

    public SubscriptionRegistry(ConnectionManager connection, ObjectMapper objectMapper,
                                boolean resubscribeOnReconnect) {
        this.connection = connection;
        this.objectMapper = objectMapper;
        this.resubscribeOnReconnect = resubscribeOnReconnect;
    }

    /**
     * Ask the service to push {@code key}.
     *
     * @return true if the key is subscribed after the call
     */
    public boolean subscribe(TopicKey<?> key) {
        if (!connection.isChannelUsable()) {
            LOG.debug("Channel not usable, not subscribing to {} (poll instead)", key);
            return false;
        }
        if (active.putIfAbsent(key.key(), key) != null) {
            return true;
        }
        if (!sendControl("subscribe", key)) {
            active.remove(key.key(), key);
            return false;
        }
        LOG.info("Subscribed to {}", key);
        return true;
    }

    /**
     * Stop the push for {@code key}. The key is dropped locally even when
     * the channel is down.
     */
    public void unsubscribe(TopicKey<?> key) {
        if (active.remove(key.key()) == null) {
            return;
        }
        if (connection.isChannelUsable()) {
            sendControl("unsubscribe", key);
        }
        LOG.info("Unsubscribed from {}", key);
    }

    /**
     * Attach a listener for broadcasts of {@code key}. Listeners run on the
     * channel thread, in registration order.
     */
    @SuppressWarnings("unchecked")
    public <T> ListenerRegistration on(TopicKey<T> key, Consumer<? super T> listener) {
        Consumer<Object> untyped = payload -> listener.accept((T) payload);
        listeners.compute(key.key(), (k, list) -> {
            List<Consumer<Object>> target = list != null ? list : new CopyOnWriteArrayList<>();
            target.add(untyped);
            return target;
        });
        return () -> listeners.computeIfPresent(key.key(), (k, list) -> {
            list.remove(untyped);
            return list.isEmpty() ? null : list;
        });
    }

    int listenerKeyCount() {
        return listeners.size();
    }

    /**
     * Decode a broadcast and fan it out to its listeners.
     *
     * @return true if the payload was decoded and delivered
     */
    public boolean handleBroadcast(String type, JsonNode data) {
        Optional<TopicKey<?>> parsed = Topic.parseKey(type);
        if (parsed.isEmpty()) {
            LOG.debug("Dropping broadcast of unknown type '{}'", type);
            return false;
        }

        Object payload;
        try {
            payload = objectMapper.readerFor(parsed.get().topic().payloadType()).readValue(data);
        } catch (IOException e) {
            LOG.warn("Dropping undecodable '{}' broadcast: {}", type, e.getMessage());
            return false;
        }

        List<Consumer<Object>> targets = listeners.get(type);
        if (targets == null || targets.isEmpty()) {
            return true;
        }
        for (Consumer<Object> listener : targets) {
            try {
                listener.accept(payload);
            } catch (Exception e) {
                LOG.warn("Error in '{}' listener: {}", type, e.getMessage());
            }
        }
        return true;
    }

    /**
     * Connection listener hook: restore pushes after the channel comes back.
     */
    public void onConnectionStateChanged(ConnectionState state) {
        if (state != ConnectionState.CONNECTED || !resubscribeOnReconnect || active.isEmpty()) {
            return;
        }
        List<TopicKey<?>> keys = new ArrayList<>(active.values());
        LOG.info("Re-subscribing to {} topic(s)", keys.size());
        for (TopicKey<?> key : keys) {
            sendControl("subscribe", key);
        }
    }

    public boolean isSubscribed(TopicKey<?> key) {
        return active.containsKey(key.key());
    }

    public int subscriptionCount() {
        return active.size();
    }

    /**
     * Sorted snapshot of the subscribed key strings.
     */
    public Set<String> activeSubscriptions() {
        return new TreeSet<>(active.keySet());
    }

    private boolean sendControl(String type, TopicKey<?> key) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", type);
        message.put("payload", key.controlPayload());
        try {
            connection.send(objectMapper.writeValueAsString(message));
            return true;
        } catch (JsonProcessingException e) {
            LOG.error("Cannot encode {} for {}: {}", type, key, e.getOriginalMessage());
        } catch (TransportUnavailableException e) {
            LOG.warn("Cannot {} {}: {}", type, key, e.getMessage());
        }
        return false;
    }
}
