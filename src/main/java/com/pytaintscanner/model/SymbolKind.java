package com.pytaintscanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SymbolKind {
    VAR, PARAM, FUNCTION, CLASS, IMPORT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SymbolKind fromWire(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
