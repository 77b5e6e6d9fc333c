package com.routelens.replay.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** idle → running → completed / error / stopped，running ⇄ paused */
public enum ReplayState {
    IDLE,
    RUNNING,
    PAUSED,
    COMPLETED,
    ERROR,
    STOPPED;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }
}
