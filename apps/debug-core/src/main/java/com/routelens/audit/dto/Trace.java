package com.routelens.audit.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 会话因果树里的一个节点。父子关系只存 id（children / parentTraceId），
 * 节点本身放在审计链的 traceId -> Trace 表里。
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Trace {
    public static final String META_START_TIME = "startTime";
    public static final String META_END_TIME = "endTime";
    public static final String META_DURATION = "duration";
    public static final String META_INPUT_SIZE = "inputDataSize";
    public static final String META_OUTPUT_SIZE = "outputDataSize";

    private String traceId;
    private String sessionId;
    private String layer;
    private String operation;
    private String timestamp;        // 开始时间 ISO-8601
    private String parentTraceId;
    private List<String> children = new ArrayList<>();
    private JsonNode inputData;
    private TraceStatus status;
    private JsonNode outputData;
    private String endTime;          // 完成时间 ISO-8601
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /** 完成后的耗时（ms），未完成返回 null */
    @JsonIgnore
    public Long getDuration() {
        Object d = metadata == null ? null : metadata.get(META_DURATION);
        return d instanceof Number n ? n.longValue() : null;
    }

    @JsonIgnore
    public boolean isComplete() {
        return status != null && status.isTerminal();
    }

    /** 深拷贝给外部，避免调用方改到表里的节点 */
    public Trace copy() {
        Trace t = new Trace();
        t.traceId = traceId;
        t.sessionId = sessionId;
        t.layer = layer;
        t.operation = operation;
        t.timestamp = timestamp;
        t.parentTraceId = parentTraceId;
        t.children = new ArrayList<>(children);
        t.inputData = inputData == null ? null : inputData.deepCopy();
        t.status = status;
        t.outputData = outputData == null ? null : outputData.deepCopy();
        t.endTime = endTime;
        t.metadata = new LinkedHashMap<>(metadata);
        return t;
    }
}
