package com.routelens.replay.dto;

/** 工具调用 → 录制结果；每次回放重建，不落盘 */
public record ToolCallMapping(
        ToolCallDescriptor toolCall,
        ToolCallResult result,
        String recordId,
        String timestamp,
        boolean hasRealResult
) {
    public ToolCallMapping withResult(ToolCallResult r) {
        return new ToolCallMapping(toolCall, r, recordId, timestamp, r != null);
    }
}
