package com.tradebot.client.subscription;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A topic plus its scope (session id or symbol), if the topic has one.
 */
public record TopicKey<T>(Topic<T> topic, String scope) {

    /**
     * Key string as used in broadcast {@code type} fields, e.g.
     * {@code trades_42} or {@code market_analysis_BTCUSDT}.
     */
    public String key() {
        return scope == null ? topic.channel() : topic.channel() + "_" + scope;
    }

    /**
     * Payload of a subscribe/unsubscribe control message.
     */
    public Map<String, Object> controlPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel", topic.channel());
        if (scope != null) {
            payload.put(topic.scopeField(), scope);
        }
        return payload;
    }

    @Override
    public String toString() {
        return key();
    }
}
