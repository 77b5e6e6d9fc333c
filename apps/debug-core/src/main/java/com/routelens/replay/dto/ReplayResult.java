package com.routelens.replay.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/** 一次回放的汇总，结束时写入 replay/dynamic-replay-*.json */
@Data
public class ReplayResult {
    private String replayId;
    private String sessionId;
    private String startTime;
    private String endTime;
    private int totalInteractions;
    private int completedInteractions;
    private int dynamicDataLoaded;
    private int toolCallsReplayed;
    private double dataCoverageRate;
    private long totalDuration;
    private ReplayState finalState;
    private List<InteractionResult> executionDetails = new ArrayList<>();
    private List<ReplayError> errors = new ArrayList<>();
}
