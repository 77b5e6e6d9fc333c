package com.routelens.audit.dto;

import java.util.List;

/**
 * 以某个 trace 为根的数据血缘快照。每次构建都是新对象、新文件。
 */
public record Lineage(
        String rootTraceId,
        String sessionId,
        String buildTime,
        List<DataFlowEntry> dataFlow,
        List<TransformationRecord> transformations,
        List<String> layerSequence,
        Metadata metadata
) {
    public record Metadata(int totalLayers, int totalTransformations, long totalDuration) {}
}
