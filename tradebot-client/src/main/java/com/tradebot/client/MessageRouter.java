package com.tradebot.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradebot.client.rpc.RequestCorrelator;
import com.tradebot.client.subscription.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Splits inbound channel text into responses and broadcasts.
 *
 * A message whose id matches a live request is a response. Otherwise a
 * message with both {@code type} and {@code data} is a broadcast. Anything
 * else (late responses included) is dropped.
 */
final class MessageRouter implements Consumer<String> {
    private static final Logger LOG = LoggerFactory.getLogger(MessageRouter.class);

    private final ObjectMapper objectMapper;
    private final RequestCorrelator correlator;
    private final SubscriptionRegistry registry;

    MessageRouter(ObjectMapper objectMapper, RequestCorrelator correlator, SubscriptionRegistry registry) {
        this.objectMapper = objectMapper;
        this.correlator = correlator;
        this.registry = registry;
    }

    @Override
    public void accept(String text) {
        JsonNode message;
        try {
            message = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            LOG.warn("Unparseable channel message: {}", e.getOriginalMessage());
            return;
        }
        if (message == null || !message.isObject()) {
            LOG.debug("Ignoring non-object channel message");
            return;
        }

        if (message.hasNonNull("id") && correlator.handleResponse(message)) {
            return;
        }

        JsonNode type = message.get("type");
        JsonNode data = message.get("data");
        if (type != null && type.isTextual() && data != null && !data.isNull()) {
            registry.handleBroadcast(type.asText(), data);
        } else if (message.hasNonNull("id")) {
            LOG.debug("Dropping response for unknown or expired request {}", message.get("id").asText());
        } else {
            LOG.debug("Ignoring channel message without id or type");
        }
    }
}
