package com.routelens.replay.dto;

public enum ReplayEventType {
    REPLAY_STARTED,
    INTERACTION_REPLAYED,
    REPLAY_PAUSED,
    REPLAY_RESUMED,
    REPLAY_STOPPED,
    REPLAY_COMPLETED,
    REPLAY_ERROR,
    SPEED_CHANGED
}
