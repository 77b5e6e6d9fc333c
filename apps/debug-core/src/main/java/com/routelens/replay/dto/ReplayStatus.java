package com.routelens.replay.dto;

/** getReplayStatus 的只读快照 */
public record ReplayStatus(
        String replayId,
        ReplayState state,
        String currentSessionId,
        int currentStep,
        int totalSteps,
        double progress,
        int layerRecords,
        int toolCallResults,
        double speed,
        ReplayOptions options
) {}
