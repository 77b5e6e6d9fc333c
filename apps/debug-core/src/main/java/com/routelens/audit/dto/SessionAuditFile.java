package com.routelens.audit.dto;

import java.util.Map;

/** sessions/session-<sessionId>.json 的内容：变换计数和 变换 -> trace 索引 */
public record SessionAuditFile(
        String sessionId,
        String startTime,
        String lastUpdate,
        int traceCount,
        int transformationCount,
        Map<String, IndexEntry> traceabilityIndex
) {
    public record IndexEntry(String traceId, String layer, String timestamp) {}
}
