package com.ietfdata.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** The {@code history_type} marker of a history record. */
public enum HistoryType {
    CREATED("+"),
    CHANGED("~"),
    DELETED("-");

    private final String symbol;

    HistoryType(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    @JsonCreator
    public static HistoryType fromSymbol(String symbol) {
        for (HistoryType type : values()) {
            if (type.symbol.equals(symbol)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown history_type: " + symbol);
    }
}
