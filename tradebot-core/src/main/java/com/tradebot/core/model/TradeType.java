package com.tradebot.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TradeType {
    ENTRY("entry"),
    AVERAGING("averaging"),
    EXIT("exit");

    private final String value;

    TradeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TradeType fromValue(String value) {
        for (TradeType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown trade type: " + value);
    }
}
