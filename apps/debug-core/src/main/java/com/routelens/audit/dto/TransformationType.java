package com.routelens.audit.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TransformationType {
    CREATION("creation"),
    DELETION("deletion"),
    TYPE_CONVERSION("type-conversion"),
    STRUCTURE_CHANGE("structure-change"),
    MODIFICATION("modification");

    private final String wire;

    TransformationType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static TransformationType fromWire(String s) {
        for (TransformationType t : values()) {
            if (t.wire.equals(s)) return t;
        }
        throw new IllegalArgumentException("Unknown transformation type: " + s);
    }
}
