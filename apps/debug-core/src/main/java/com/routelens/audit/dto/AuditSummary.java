package com.routelens.audit.dto;

import java.util.List;
import java.util.Map;

/** 会话级审计汇总，同时落盘到 audit/audit-summary-<sessionId>.json */
public record AuditSummary(
        String sessionId,
        int totalTraces,
        List<LayerSequenceEntry> layerSequence,
        Map<String, LayerStats> layerStats,
        TransformationStats transformationStats,
        PerformanceStats performanceStats,
        Map<String, LayerFlow> dataFlowMap,
        String generatedAt
) {
    public record LayerSequenceEntry(String layer, String operation, String traceId,
                                     String timestamp, String parentTraceId) {}

    public record LayerStats(int totalOperations, int successCount, int errorCount, int warningCount,
                             double averageDuration, long totalDuration) {}

    public record TransformationStats(int totalTransformations, Map<String, Integer> byLayer,
                                      Map<String, Integer> byType, double averageTransformationSize) {}

    public record PerformanceStats(int totalOperations, long totalDuration, double averageDuration,
                                   int sessionsTracked) {}

    public record FlowOperation(String traceId, String operation, String timestamp) {}

    /** 某层的操作列表，以及因果树里与它相邻的上游 / 下游层 */
    public record LayerFlow(List<FlowOperation> operations, List<String> parents, List<String> children) {}
}
