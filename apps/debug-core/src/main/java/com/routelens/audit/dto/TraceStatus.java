package com.routelens.audit.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** started → success / error / warning（终态） */
public enum TraceStatus {
    STARTED,
    SUCCESS,
    ERROR,
    WARNING;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TraceStatus fromWire(String s) {
        return s == null ? null : TraceStatus.valueOf(s.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isTerminal() {
        return this != STARTED;
    }
}
