package com.tradebot.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * One entry of a batch analysis response. {@code analysis} is null when the
 * service failed to analyze the symbol.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MarketAnalysisBatchResult(
    String symbol,
    List<MarketAnalysis> analysis,
    boolean success,
    String error
) {

    public List<MarketAnalysis> analysisOrEmpty() {
        return analysis != null ? analysis : List.of();
    }
}
