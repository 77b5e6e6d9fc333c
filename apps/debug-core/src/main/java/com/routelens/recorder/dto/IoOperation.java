package com.routelens.recorder.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/** 层 I/O 记录的方向 */
public enum IoOperation {
    INPUT("input"),
    OUTPUT("output"),
    ERROR("error");

    private final String wire;

    IoOperation(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
