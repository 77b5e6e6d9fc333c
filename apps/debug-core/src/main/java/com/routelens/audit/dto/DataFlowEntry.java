package com.routelens.audit.dto;

public record DataFlowEntry(
        String traceId,
        String layer,
        String operation,
        String timestamp,
        TraceStatus status
) {}
