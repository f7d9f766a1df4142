package com.tradebot.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * State of the service-side periodic analysis loop.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AutoTradingStatus(
    @JsonProperty("isRunning") boolean running,
    int activeSessions,
    long intervalMs,
    String lastUpdate,
    long totalAnalyses,
    long successfulAnalyses,
    long failedAnalyses
) {}
