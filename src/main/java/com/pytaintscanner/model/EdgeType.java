package com.pytaintscanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EdgeType {
    FLOW, TRUE, FALSE, EXCEPTION, CALL, RETURN, AWAIT, YIELD, BREAK, CONTINUE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EdgeType fromWire(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
