package com.tradebot.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * A single fill executed within a trading session.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Trade(
    String id,
    String sessionId,
    TradeType type,
    TradeSide side,
    double price,
    double quantity,
    double value,
    Double pnl,              // Only set on exits
    Double roi,              // Only set on exits
    String binanceOrderId,
    String notes,
    Instant createdAt
) {}
