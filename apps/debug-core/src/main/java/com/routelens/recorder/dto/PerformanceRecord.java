package com.routelens.recorder.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PerformanceRecord(
        String recordId,
        String sessionId,
        String timestamp,
        String layer,
        String operation,
        long startTime,    // epoch ms
        long endTime,      // epoch ms
        long duration,     // ms
        Map<String, Object> systemSnapshot,
        JsonNode metrics
) {}
