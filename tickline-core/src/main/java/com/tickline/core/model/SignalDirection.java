package com.tickline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a trading signal, and of a trade.
 */
public enum SignalDirection {
    LONG("long"),
    SHORT("short"),
    FLAT("flat");

    private final String value;

    SignalDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SignalDirection fromValue(String value) {
        for (SignalDirection d : values()) {
            if (d.value.equalsIgnoreCase(value)) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unknown signal direction: " + value);
    }
}
