package com.routelens.session.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.routelens.audit.dto.AuditSummary;
import com.routelens.recorder.dto.SessionSummary;

import java.util.List;

/** 会话调试报告，落盘到 sessions/debug-report-<sessionId>.json */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DebugReport(
        String sessionId,
        String generatedAt,
        DebugStatus summary,
        SessionSummary recordingSummary,
        AuditSummary auditSummary,
        List<String> availableScenarios
) {
    public record DebugStatus(String sessionId, int activeOperations, long uptime, boolean closed) {}
}
