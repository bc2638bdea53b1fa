package com.solprofile.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a swap from the wallet's point of view: tokens coming {@code in} are buys,
 * tokens going {@code out} are sells.
 */
public enum TradeDirection {
    IN("in"),
    OUT("out");

    private final String code;

    TradeDirection(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static TradeDirection fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Trade direction must not be null");
        }
        for (TradeDirection d : values()) {
            if (d.code.equalsIgnoreCase(code.trim())) return d;
        }
        throw new IllegalArgumentException("Unknown trade direction: " + code);
    }
}
