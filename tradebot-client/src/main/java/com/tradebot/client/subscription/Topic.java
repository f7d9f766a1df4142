package com.tradebot.client.subscription;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tradebot.core.model.MarketAnalysis;
import com.tradebot.core.model.TotalBalance;
import com.tradebot.core.model.Trade;
import com.tradebot.core.model.TradingSession;

import java.util.List;
import java.util.Optional;

/**
 * A broadcast topic the service pushes, and the payload type it carries.
 *
 * Scoped topics ({@link #TRADES}, {@link #MARKET_ANALYSIS}) need a scope value
 * to form a key; the key string is {@code <channel>_<scope>}.
 */
public final class Topic<T> {

    public static final Topic<List<TradingSession>> SESSIONS =
        new Topic<>("sessions", null, new TypeReference<List<TradingSession>>() {});
    public static final Topic<TotalBalance> BALANCE =
        new Topic<>("balance", null, new TypeReference<TotalBalance>() {});
    public static final Topic<List<Trade>> TRADES =
        new Topic<>("trades", "sessionId", new TypeReference<List<Trade>>() {});
    public static final Topic<List<MarketAnalysis>> MARKET_ANALYSIS =
        new Topic<>("market_analysis", "symbol", new TypeReference<List<MarketAnalysis>>() {});

    private static final List<Topic<?>> ALL = List.of(SESSIONS, BALANCE, TRADES, MARKET_ANALYSIS);

    private final String channel;
    private final String scopeField;
    private final TypeReference<T> payloadType;

    private Topic(String channel, String scopeField, TypeReference<T> payloadType) {
        this.channel = channel;
        this.scopeField = scopeField;
        this.payloadType = payloadType;
    }

    public String channel() { return channel; }
    public String scopeField() { return scopeField; }
    public TypeReference<T> payloadType() { return payloadType; }

    public boolean isScoped() {
        return scopeField != null;
    }

    public TopicKey<T> key() {
        if (isScoped()) {
            throw new IllegalStateException("Topic " + channel + " needs a " + scopeField);
        }
        return new TopicKey<>(this, null);
    }

    public TopicKey<T> key(String scope) {
        if (!isScoped()) {
            throw new IllegalStateException("Topic " + channel + " takes no scope");
        }
        if (scope == null || scope.isBlank()) {
            throw new IllegalArgumentException(scopeField + " must not be blank");
        }
        return new TopicKey<>(this, scope);
    }

    /**
     * Resolve a broadcast {@code type} back to its topic key.
     */
    public static Optional<TopicKey<?>> parseKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        for (Topic<?> topic : ALL) {
            if (!topic.isScoped() && topic.channel.equals(key)) {
                return Optional.of(topic.key());
            }
            String prefix = topic.channel + "_";
            if (topic.isScoped() && key.startsWith(prefix) && key.length() > prefix.length()) {
                return Optional.of(topic.key(key.substring(prefix.length())));
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return channel;
    }
}
