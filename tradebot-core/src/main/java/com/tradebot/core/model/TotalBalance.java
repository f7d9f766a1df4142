package com.tradebot.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Aggregate futures account balance.
 *
 * The channel and HTTP endpoints name these fields differently; both
 * spellings are accepted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TotalBalance(
    @JsonAlias("totalWalletBalance") double totalBalance,
    @JsonAlias("totalAvailableBalance") double availableBalance,
    @JsonAlias("totalUnrealizedProfit") double unrealizedProfit,
    @JsonAlias("totalMarginBalance") double marginBalance,
    @JsonAlias("totalUsedBalance") double usedBalance
) {}
