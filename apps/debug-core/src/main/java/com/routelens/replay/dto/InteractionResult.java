package com.routelens.replay.dto;

import java.util.List;
import java.util.Map;

public record InteractionResult(
        int step,
        String recordId,
        String layer,
        String operation,
        String timestamp,
        boolean hasRealData,
        int toolCallsReplayed,
        List<ReplayedToolCall> toolCalls,
        List<String> missingToolResults,
        Map<String, Object> originalData
) {}
