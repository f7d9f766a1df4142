package com.tradebot.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Volatility bucket assigned by the market analysis.
 */
public enum Volatility {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    Volatility(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Volatility fromValue(String value) {
        for (Volatility volatility : values()) {
            if (volatility.value.equalsIgnoreCase(value)) {
                return volatility;
            }
        }
        throw new IllegalArgumentException("Unknown volatility: " + value);
    }
}
