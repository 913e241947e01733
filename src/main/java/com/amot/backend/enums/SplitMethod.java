package com.amot.backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Strategy used to derive the shares of a bill from its total.
 */
public enum SplitMethod {
    EQUAL("equal"),
    CUSTOM("custom"),
    PERCENTAGE("percentage"),
    ITEM_BASED("item-based");

    private final String value;

    SplitMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SplitMethod fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        for (SplitMethod method : values()) {
            if (method.value.equalsIgnoreCase(raw) || method.name().equalsIgnoreCase(raw)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown split method: " + raw);
    }
}
