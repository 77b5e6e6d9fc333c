package com.routelens.recorder.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * 回放场景：从一个会话里挑出来的有序记录引用。
 * 回放引擎只认 replay/scenario-*.json。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReplayScenario(
        String scenarioId,
        String scenarioName,
        String sessionId,
        String createdAt,
        List<LedgerEntry> records,
        Map<String, Object> metadata
) {
    public List<LedgerEntry> records() {
        return records == null ? List.of() : records;
    }
}
