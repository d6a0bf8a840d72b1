package com.tickline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a pending order does when it executes.
 */
public enum OrderAction {
    /** Buy: open or add to a long position. */
    OPEN_LONG("open_long"),

    /** Sell short: open or add to a short position. */
    OPEN_SHORT("open_short"),

    /** Flatten the whole position, whatever its side. */
    CLOSE("close");

    private final String value;

    OrderAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static OrderAction fromValue(String value) {
        for (OrderAction action : values()) {
            if (action.value.equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown order action: " + value);
    }

    public boolean isOpen() {
        return this != CLOSE;
    }

    /**
     * Direction of the position this action opens, null for CLOSE.
     */
    public SignalDirection openDirection() {
        return switch (this) {
            case OPEN_LONG -> SignalDirection.LONG;
            case OPEN_SHORT -> SignalDirection.SHORT;
            case CLOSE -> null;
        };
    }
}
