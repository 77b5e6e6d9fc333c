package com.routelens.audit.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/** 某个 trace 的输出与输入不同的证据，写入 transformations/ */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TransformationRecord(
        String transformationId,
        String traceId,
        String sessionId,
        String timestamp,
        String layer,
        JsonNode inputData,
        JsonNode outputData,
        TransformationAnalysis transformation,
        Map<String, Object> metadata
) {}
