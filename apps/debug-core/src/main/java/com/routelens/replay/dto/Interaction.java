package com.routelens.replay.dto;

import com.fasterxml.jackson.databind.JsonNode;

/** 时间线上的一条交互，由场景里的一条记录还原而来 */
public record Interaction(
        String timestamp,
        String recordId,
        String layer,
        String operation,
        JsonNode data,
        JsonNode metadata
) {
    /** data 非空（null、空对象、空数组、空串都算空） */
    public boolean hasPayload() {
        if (data == null || data.isNull() || data.isMissingNode()) return false;
        if (data.isContainerNode()) return data.size() > 0;
        if (data.isTextual()) return !data.textValue().isBlank();
        return true;
    }
}
