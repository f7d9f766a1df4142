package com.tradebot.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Active session together with the live return on its open position.
 * Position fields are null when the session is flat.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ActiveSessionRoi(
    String symbol,
    String sessionId,
    String status,
    boolean hasPosition,
    Double currentPrice,
    Double entryPrice,
    Double roi,
    Double pnl,
    Double positionSize,
    double totalPnL,
    double initialBalance,
    double currentBalance,
    double tradingBalance
) {}
