package com.tradebot.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * A trading session managed by the trading service for one symbol.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TradingSession(
    String id,
    String symbol,              // e.g., "BTCUSDT"
    double initialBalance,
    double reserveBalance,      // Held back for averaging
    double tradingBalance,
    double currentBalance,
    double totalPnL,
    SessionStatus status,
    Double averageEntryPrice,   // null while flat
    double totalPositionSize,
    int averagingCount,
    Double liquidationPrice,    // null while flat
    Instant createdAt,
    Instant updatedAt
) {

    @JsonIgnore
    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    @JsonIgnore
    public boolean hasPosition() {
        return totalPositionSize != 0 && averageEntryPrice != null;
    }
}
