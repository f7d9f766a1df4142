package com.tradebot.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Diagnostic information about the trading service host.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ServerInfo(
    String serverTime,
    String environment,
    int port,
    List<NetworkAddress> addresses,
    @JsonProperty("externalIP") String externalIp,
    String binanceApiUrl,
    boolean binanceTestnet,
    boolean hasApiKey,
    boolean hasApiSecret
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NetworkAddress(String name, String address, String family, boolean internal) {}
}
