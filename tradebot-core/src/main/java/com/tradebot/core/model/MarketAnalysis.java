package com.tradebot.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Technical analysis snapshot for one symbol and timeframe.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MarketAnalysis(
    String symbol,
    String timeframe,        // e.g., "1h"
    double currentPrice,
    Indicators indicators,
    Volatility volatility,
    boolean consolidation,
    double supportLevel,
    double resistanceLevel,
    double weight            // Relative weight of this timeframe
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Indicators(
        double sma20,
        double sma50,
        double rsi,
        double bbUpper,
        double bbMiddle,
        double bbLower,
        double atr
    ) {}
}
