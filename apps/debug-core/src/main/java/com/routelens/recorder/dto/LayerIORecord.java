package com.routelens.recorder.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/** 某一层一次输入/输出/错误的快照，写入 layers/ 后不再修改 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LayerIORecord(
        String recordId,
        String sessionId,
        String timestamp,      // ISO-8601
        String layer,
        String operation,      // input / output / error
        JsonNode data,         // 已脱敏
        JsonNode metadata      // method、dataSize、dataHash 以及调用方字段
) {}
